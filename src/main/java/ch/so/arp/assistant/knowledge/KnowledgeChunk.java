package ch.so.arp.assistant.knowledge;

import java.util.List;

/**
 * Retrievable slice of a document. The name of the source document travels with
 * the chunk so that retrieved context can be attributed.
 */
public record KnowledgeChunk(
        long id,
        long documentId,
        String documentName,
        String community,
        int index,
        String content,
        List<String> keywords,
        int charCount) {

    public KnowledgeChunk {
        keywords = List.copyOf(keywords);
    }

    public boolean hasKeyword(String term) {
        return keywords.contains(term);
    }
}
