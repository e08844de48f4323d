package ch.so.arp.assistant.chat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link UsageLog} backed by the {@code assistant_usage_log} table.
 */
public class JdbcUsageLog implements UsageLog {

    private static final String INSERT_SQL = """
            INSERT INTO assistant_usage_log
                (community, user_id, question, answer, prompt_tokens, completion_tokens, total_tokens,
                 latency_ms, outcome, created_at)
            VALUES (:community, :userId, :question, :answer, :promptTokens, :completionTokens, :totalTokens,
                 :latencyMs, :outcome, :createdAt)
            """;

    private static final String SUMMARY_SQL = """
            SELECT COUNT(*) AS calls, COALESCE(SUM(total_tokens), 0) AS total_tokens
            FROM assistant_usage_log
            WHERE community = :community
            """;

    private final JdbcClient jdbcClient;

    public JdbcUsageLog(NamedParameterJdbcOperations jdbcOperations) {
        this.jdbcClient = JdbcClient.create(Objects.requireNonNull(jdbcOperations, "jdbcOperations"));
    }

    @Override
    public void record(UsageRecord usageRecord) {
        jdbcClient.sql(INSERT_SQL)
                .param("community", usageRecord.community())
                .param("userId", usageRecord.userId())
                .param("question", usageRecord.question())
                .param("answer", usageRecord.answer())
                .param("promptTokens", usageRecord.usage().promptTokens())
                .param("completionTokens", usageRecord.usage().completionTokens())
                .param("totalTokens", usageRecord.usage().totalTokens())
                .param("latencyMs", usageRecord.latencyMs())
                .param("outcome", usageRecord.outcome().name())
                .param("createdAt", OffsetDateTime.ofInstant(usageRecord.createdAt(), ZoneOffset.UTC))
                .update();
    }

    @Override
    public UsageSummary summarize(String community) {
        return jdbcClient.sql(SUMMARY_SQL)
                .param("community", community)
                .query((rs, rowNum) -> new UsageSummary(community, rs.getLong("calls"), rs.getLong("total_tokens")))
                .single();
    }
}
