package ch.so.arp.assistant.knowledge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingestion path of the knowledge base: validates the upload, extracts its
 * text, chunks it and stores document and chunks. The raw file is kept in the
 * upload directory of the community under a name unique to the ingestion, so
 * documents sharing a file name never share a stored file.
 */
public class KnowledgeIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeIngestionService.class);

    private final KnowledgeStore knowledgeStore;
    private final DocumentTextExtractor textExtractor;
    private final TextChunker chunker;
    private final Path uploadDirectory;

    public KnowledgeIngestionService(KnowledgeStore knowledgeStore, DocumentTextExtractor textExtractor,
            TextChunker chunker, Path uploadDirectory) {
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.uploadDirectory = Objects.requireNonNull(uploadDirectory, "uploadDirectory");
    }

    /**
     * Ingest an uploaded file.
     *
     * @throws UnsupportedDocumentFormatException if the file extension is not allowed
     * @throws DocumentExtractionException        if the file content cannot be read
     */
    public IngestionResult ingest(String community, String fileName, byte[] content, long uploadedBy) {
        Objects.requireNonNull(content, "content");
        String name = sanitizeFileName(fileName);
        DocumentFormat format = DocumentFormat.fromFileName(name);

        List<String> chunks = chunker.chunk(textExtractor.extract(format, content));
        if (chunks.isEmpty()) {
            LOGGER.info("Document '{}' for community {} contains no text, nothing stored", name, community);
            return IngestionResult.empty(name);
        }

        Path location = write(community, name, content);
        try {
            long documentId = knowledgeStore.storeDocument(
                    new DocumentUpload(community, name, format, content.length, location.toString(), uploadedBy),
                    chunks);
            long totalChars = chunks.stream().mapToLong(String::length).sum();
            return new IngestionResult(documentId, name, chunks.size(), totalChars);
        } catch (RuntimeException ex) {
            deleteQuietly(location);
            throw ex;
        }
    }

    /**
     * Delete a document of the community.
     *
     * @return {@code false} if the community owns no document with that id
     */
    public boolean deleteDocument(String community, long documentId) {
        boolean owned = knowledgeStore.findDocument(documentId)
                .filter(document -> document.community().equals(community))
                .isPresent();
        if (owned) {
            knowledgeStore.deleteDocument(documentId);
        }
        return owned;
    }

    public boolean hasKnowledge(String community) {
        return knowledgeStore.hasKnowledge(community);
    }

    public List<KnowledgeDocument> listDocuments(String community) {
        return knowledgeStore.listDocuments(community);
    }

    private Path write(String community, String name, byte[] content) {
        Path directory = uploadDirectory.resolve(sanitizeFileName(community));
        Path target = directory.resolve(UUID.randomUUID() + "-" + name);
        try {
            Files.createDirectories(directory);
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to store upload " + target, ex);
        }
    }

    private void deleteQuietly(Path location) {
        try {
            Files.deleteIfExists(location);
        } catch (IOException ex) {
            LOGGER.warn("Unable to remove upload {} after a failed ingestion", location, ex);
        }
    }

    private static String sanitizeFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "unknown";
        }
        Path name = Path.of(fileName.replace('\\', '/')).getFileName();
        if (name == null || name.toString().equals("..") || name.toString().equals(".")) {
            return "unknown";
        }
        return name.toString();
    }
}
