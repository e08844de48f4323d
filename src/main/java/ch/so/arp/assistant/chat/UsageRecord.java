package ch.so.arp.assistant.chat;

import java.time.Instant;

/**
 * One row of the usage audit trail. Question and answer are cut to
 * {@link #MAX_TEXT_LENGTH} characters.
 */
public record UsageRecord(
        String community,
        long userId,
        String question,
        String answer,
        TokenUsage usage,
        long latencyMs,
        AnswerOutcome outcome,
        Instant createdAt) {

    public static final int MAX_TEXT_LENGTH = 500;

    public UsageRecord {
        question = truncate(question);
        answer = truncate(answer);
    }

    public static UsageRecord of(String community, long userId, String question, ModelAnswer answer,
            Instant createdAt) {
        return new UsageRecord(community, userId, question, answer.content(), answer.usage(), answer.latencyMs(),
                answer.outcome(), createdAt);
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_TEXT_LENGTH);
    }
}
