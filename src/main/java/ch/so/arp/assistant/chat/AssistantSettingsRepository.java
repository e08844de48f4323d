package ch.so.arp.assistant.chat;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Reads the per community assistant configuration. Communities without a row
 * get an enabled assistant with the configured defaults, columns left
 * {@code NULL} fall back to the defaults as well.
 */
public class AssistantSettingsRepository {

    private static final String FIND_SQL = """
            SELECT community, enabled, system_prompt, temperature, max_tokens
            FROM assistant_settings
            WHERE community = :community
            """;

    private final JdbcClient jdbcClient;
    private final ChatProperties defaults;

    public AssistantSettingsRepository(NamedParameterJdbcOperations jdbcOperations, ChatProperties defaults) {
        this.jdbcClient = JdbcClient.create(Objects.requireNonNull(jdbcOperations, "jdbcOperations"));
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public AssistantSettings find(String community) {
        return jdbcClient.sql(FIND_SQL)
                .param("community", community)
                .query(new SettingsRowMapper(defaults))
                .optional()
                .orElseGet(() -> defaultsFor(community));
    }

    AssistantSettings defaultsFor(String community) {
        return new AssistantSettings(community, true, defaults.getSystemPrompt(), defaults.getTemperature(),
                defaults.getMaxTokens());
    }

    private record SettingsRowMapper(ChatProperties defaults) implements RowMapper<AssistantSettings> {

        @Override
        public AssistantSettings mapRow(ResultSet rs, int rowNum) throws SQLException {
            String systemPrompt = rs.getString("system_prompt");
            double temperature = rs.getDouble("temperature");
            if (rs.wasNull()) {
                temperature = defaults.getTemperature();
            }
            int maxTokens = rs.getInt("max_tokens");
            if (rs.wasNull()) {
                maxTokens = defaults.getMaxTokens();
            }
            return new AssistantSettings(
                    rs.getString("community"),
                    rs.getBoolean("enabled"),
                    systemPrompt == null || systemPrompt.isBlank() ? defaults.getSystemPrompt() : systemPrompt,
                    temperature,
                    maxTokens);
        }
    }
}
