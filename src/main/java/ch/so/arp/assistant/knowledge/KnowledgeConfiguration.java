package ch.so.arp.assistant.knowledge;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.assistant.ClockConfiguration;

/**
 * Wires chunking, storage, retrieval and ingestion of the knowledge base.
 */
@Configuration
@EnableConfigurationProperties(KnowledgeProperties.class)
@Import(ClockConfiguration.class)
public class KnowledgeConfiguration {

    @Bean
    public TextChunker textChunker(KnowledgeProperties properties) {
        return new TextChunker(properties.getChunkSize());
    }

    @Bean
    public KeywordExtractor keywordExtractor(KnowledgeProperties properties) {
        return new KeywordExtractor(properties.getMaxKeywords());
    }

    @Bean
    public DocumentTextExtractor documentTextExtractor() {
        return new DocumentTextExtractor();
    }

    @Bean
    public KnowledgeStore knowledgeStore(NamedParameterJdbcOperations jdbcOperations,
            TransactionTemplate transactionTemplate, KeywordExtractor keywordExtractor, Clock clock) {
        return new JdbcKnowledgeStore(jdbcOperations, transactionTemplate, keywordExtractor, clock);
    }

    @Bean
    public KnowledgeRetriever knowledgeRetriever(KnowledgeStore knowledgeStore) {
        return new KnowledgeRetriever(knowledgeStore);
    }

    @Bean
    public KnowledgeIngestionService knowledgeIngestionService(KnowledgeStore knowledgeStore,
            DocumentTextExtractor documentTextExtractor, TextChunker textChunker, KnowledgeProperties properties) {
        return new KnowledgeIngestionService(knowledgeStore, documentTextExtractor, textChunker,
                Path.of(properties.getUploadDir()));
    }
}
