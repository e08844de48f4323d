package ch.so.arp.assistant.knowledge;

import java.time.Instant;

/**
 * Document uploaded to the knowledge base of a community.
 */
public record KnowledgeDocument(
        long id,
        String community,
        String name,
        DocumentFormat format,
        long sizeBytes,
        String location,
        int chunkCount,
        long totalChars,
        long uploadedBy,
        DocumentStatus status,
        Instant createdAt,
        Instant updatedAt) {
}
