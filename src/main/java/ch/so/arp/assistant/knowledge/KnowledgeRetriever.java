package ch.so.arp.assistant.knowledge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexical retrieval over the chunks of a community. Chunks are scored with a
 * BM25 variant in which the term frequency only records whether a term occurs in
 * the chunk, and get a flat bonus for every query term found among their
 * keywords. The chunk list is fetched once per call and scored without locks.
 */
public class KnowledgeRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeRetriever.class);

    public static final int DEFAULT_TOP_K = 5;

    static final double K1 = 1.5d;
    static final double B = 0.75d;
    static final double KEYWORD_BONUS = 0.5d;

    static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

    private final KnowledgeStore knowledgeStore;

    public KnowledgeRetriever(KnowledgeStore knowledgeStore) {
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
    }

    /**
     * Build the prompt context for the query. An empty string means that the
     * community has no knowledge.
     */
    public String retrieve(String community, String query, int topK) {
        return findRelevantChunks(community, query, topK).stream()
                .map(RetrievedChunk::formatForPrompt)
                .collect(Collectors.joining(CONTEXT_SEPARATOR));
    }

    public String retrieve(String community, String query) {
        return retrieve(community, query, DEFAULT_TOP_K);
    }

    /**
     * Rank the chunks of the community against the query. Without any usable
     * query term, or without any lexical overlap, the first chunks in storage
     * order are returned instead.
     *
     * @param topK maximum number of chunks, values below one are treated as one
     */
    public List<RetrievedChunk> findRelevantChunks(String community, String query, int topK) {
        List<KnowledgeChunk> chunks = knowledgeStore.listChunks(community);
        if (chunks.isEmpty()) {
            return List.of();
        }
        int limit = Math.max(1, topK);
        Set<String> queryTerms = new LinkedHashSet<>(TextTokenizer.terms(query));
        if (queryTerms.isEmpty()) {
            LOGGER.debug("Query without usable terms, returning the first {} chunks of community {}", limit,
                    community);
            return leadingChunks(chunks, limit);
        }

        List<RetrievedChunk> ranked = score(chunks, queryTerms);
        ranked.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());
        if (ranked.get(0).score() <= 0.0d) {
            LOGGER.debug("No lexical overlap for community {}, returning the first {} chunks", community, limit);
            return leadingChunks(chunks, limit);
        }
        LOGGER.debug("Ranked {} chunks of community {} (best score {})", chunks.size(), community,
                ranked.get(0).score());
        return List.copyOf(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    private List<RetrievedChunk> score(List<KnowledgeChunk> chunks, Set<String> queryTerms) {
        int chunkCount = chunks.size();
        List<Set<String>> chunkTerms = new ArrayList<>(chunkCount);
        Map<String, Integer> documentFrequency = new HashMap<>();
        long totalLength = 0L;
        for (KnowledgeChunk chunk : chunks) {
            Set<String> terms = new HashSet<>(TextTokenizer.terms(chunk.content()));
            chunkTerms.add(terms);
            terms.forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            totalLength += chunk.content().length();
        }
        double averageLength = totalLength > 0 ? (double) totalLength / chunkCount : 1.0d;

        List<RetrievedChunk> scored = new ArrayList<>(chunkCount);
        for (int i = 0; i < chunkCount; i++) {
            KnowledgeChunk chunk = chunks.get(i);
            Set<String> terms = chunkTerms.get(i);
            double lengthNorm = 1 - B + B * chunk.content().length() / averageLength;
            double score = 0.0d;
            for (String term : queryTerms) {
                Integer df = documentFrequency.get(term);
                if (df == null) {
                    continue;
                }
                double idf = Math.log((chunkCount - df + 0.5d) / (df + 0.5d) + 1.0d);
                int tf = terms.contains(term) ? 1 : 0;
                double denominator = tf + K1 * lengthNorm;
                if (denominator > 0.0d) {
                    score += idf * (tf * (K1 + 1)) / denominator;
                }
            }
            for (String term : queryTerms) {
                if (chunk.hasKeyword(term)) {
                    score += KEYWORD_BONUS;
                }
            }
            scored.add(toRetrieved(chunk, score));
        }
        return scored;
    }

    private static List<RetrievedChunk> leadingChunks(List<KnowledgeChunk> chunks, int limit) {
        return chunks.stream()
                .limit(limit)
                .map(chunk -> toRetrieved(chunk, 0.0d))
                .toList();
    }

    private static RetrievedChunk toRetrieved(KnowledgeChunk chunk, double score) {
        return new RetrievedChunk(chunk.id(), chunk.documentName(), chunk.index(), chunk.content(), score);
    }
}
