package ch.so.arp.assistant.chat;

/**
 * Append-only audit trail of model calls.
 */
public interface UsageLog {

    void record(UsageRecord usageRecord);

    UsageSummary summarize(String community);
}
