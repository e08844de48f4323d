package ch.so.arp.assistant.chat;

/**
 * How a model call ended. Only {@link #COMPLETED} carries generated content,
 * the other outcomes are degraded answers with a fixed message.
 */
public enum AnswerOutcome {

    COMPLETED,
    RATE_LIMITED,
    FAILED,
    CANCELLED
}
