package ch.so.arp.assistant.knowledge;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the knowledge base: chunking, retrieval and upload storage.
 */
@ConfigurationProperties(prefix = "rag.knowledge")
public class KnowledgeProperties {

    /**
     * Maximum number of characters per chunk.
     */
    private int chunkSize = TextChunker.DEFAULT_CHUNK_SIZE;

    /**
     * Number of chunks that are passed to the model as context.
     */
    private int topK = KnowledgeRetriever.DEFAULT_TOP_K;

    /**
     * Number of keywords stored per chunk.
     */
    private int maxKeywords = KeywordExtractor.DEFAULT_MAX_KEYWORDS;

    /**
     * Directory receiving the raw uploaded files, one sub directory per
     * community.
     */
    private String uploadDir = "data/uploads";

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getMaxKeywords() {
        return maxKeywords;
    }

    public void setMaxKeywords(int maxKeywords) {
        this.maxKeywords = maxKeywords;
    }

    public String getUploadDir() {
        return uploadDir;
    }

    public void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }
}
