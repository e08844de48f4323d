package ch.so.arp.assistant.knowledge;

/**
 * Outcome of an upload. A document without any extractable text is not stored
 * and reported with an empty {@code documentId}.
 */
public record IngestionResult(Long documentId, String name, int chunkCount, long totalChars) {

    static IngestionResult empty(String name) {
        return new IngestionResult(null, name, 0, 0L);
    }

    public boolean isEmpty() {
        return documentId == null;
    }
}
