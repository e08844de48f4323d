package ch.so.arp.assistant.knowledge;

/**
 * Metadata of a document that is about to be stored.
 */
public record DocumentUpload(
        String community,
        String name,
        DocumentFormat format,
        long sizeBytes,
        String location,
        long uploadedBy) {
}
