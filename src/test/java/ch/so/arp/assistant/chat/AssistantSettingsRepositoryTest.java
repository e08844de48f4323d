package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;

import ch.so.arp.assistant.TestDatabase;

class AssistantSettingsRepositoryTest {

    private final ChatProperties defaults = new ChatProperties();

    private JdbcClient jdbcClient;
    private AssistantSettingsRepository repository;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.create();
        jdbcClient = JdbcClient.create(dataSource);
        repository = new AssistantSettingsRepository(new NamedParameterJdbcTemplate(dataSource), defaults);
    }

    @Test
    void usesDefaultsWithoutRow() {
        AssistantSettings settings = repository.find("dev");

        assertThat(settings.enabled()).isTrue();
        assertThat(settings.systemPrompt()).isEqualTo(
                "You are a friendly community assistant. Answer user questions based on the knowledge base.");
        assertThat(settings.temperature()).isEqualTo(0.7d);
        assertThat(settings.maxTokens()).isEqualTo(1024);
    }

    @Test
    void readsCommunityRow() {
        jdbcClient.sql("""
                INSERT INTO assistant_settings (community, enabled, system_prompt, temperature, max_tokens)
                VALUES ('dev', TRUE, 'Answer like a pirate.', 0.2, 300)
                """).update();

        assertThat(repository.find("dev"))
                .isEqualTo(new AssistantSettings("dev", true, "Answer like a pirate.", 0.2d, 300));
    }

    @Test
    void fillsMissingColumnsFromDefaults() {
        jdbcClient.sql("INSERT INTO assistant_settings (community, enabled) VALUES ('ops', FALSE)").update();

        AssistantSettings settings = repository.find("ops");

        assertThat(settings.enabled()).isFalse();
        assertThat(settings.systemPrompt()).isEqualTo(defaults.getSystemPrompt());
        assertThat(settings.maxTokens()).isEqualTo(defaults.getMaxTokens());
    }
}
