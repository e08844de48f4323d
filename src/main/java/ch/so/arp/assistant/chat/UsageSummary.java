package ch.so.arp.assistant.chat;

/**
 * Aggregated model usage of a community.
 */
public record UsageSummary(String community, long calls, long totalTokens) {
}
