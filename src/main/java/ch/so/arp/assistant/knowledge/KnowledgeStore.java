package ch.so.arp.assistant.knowledge;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of knowledge documents and their chunks, scoped by community.
 */
public interface KnowledgeStore {

    /**
     * Store a document together with all of its chunks. Either the document and
     * every chunk become visible, or nothing does.
     *
     * @param upload metadata of the document
     * @param chunks chunk texts in reading order
     * @return the id of the new document
     */
    long storeDocument(DocumentUpload upload, List<String> chunks);

    /**
     * Mark the document as deleted and remove its chunks. Unknown or already
     * deleted documents are ignored.
     */
    void deleteDocument(long documentId);

    boolean hasKnowledge(String community);

    /**
     * List the chunks of all active documents of the community in insertion
     * order.
     */
    List<KnowledgeChunk> listChunks(String community);

    List<KnowledgeDocument> listDocuments(String community);

    Optional<KnowledgeDocument> findDocument(long documentId);
}
