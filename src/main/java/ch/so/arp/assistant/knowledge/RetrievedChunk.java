package ch.so.arp.assistant.knowledge;

/**
 * Chunk selected by the retriever together with the score that ranked it.
 */
public record RetrievedChunk(
        long chunkId,
        String documentName,
        int index,
        String content,
        double score) {

    /**
     * Formats the chunk for the prompt. The source document name precedes the
     * text so that the model can attribute its answer.
     */
    public String formatForPrompt() {
        String source = documentName == null || documentName.isBlank() ? "unknown" : documentName;
        return "[Source: " + source + "]\n" + content;
    }
}
