package ch.so.arp.assistant.knowledge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the most frequent meaningful words of a chunk. The keywords are
 * stored next to the chunk and give matching queries a small relevance boost
 * during retrieval.
 */
public class KeywordExtractor {

    public static final int DEFAULT_MAX_KEYWORDS = 10;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "shall", "can", "to", "of", "in", "for",
            "on", "with", "at", "by", "from", "as", "into", "through", "during",
            "before", "after", "above", "below", "between", "under", "again",
            "further", "then", "once", "here", "there", "when", "where", "why",
            "how", "all", "both", "each", "few", "more", "most", "other", "some",
            "such", "no", "not", "only", "own", "same", "so", "than", "too",
            "very", "just", "don", "now", "and", "but", "or", "if", "it", "its",
            "this", "that", "these", "those", "i", "me", "my", "we", "our", "you",
            "your", "he", "him", "his", "she", "her", "they", "them", "their",
            "what", "which", "who", "whom",
            "的", "了", "在", "是", "我", "有", "和", "就", "不", "人", "都",
            "一", "上", "也", "很", "到", "说", "要", "去", "你", "会", "着",
            "看", "好", "这");

    private final int maxKeywords;

    public KeywordExtractor() {
        this(DEFAULT_MAX_KEYWORDS);
    }

    public KeywordExtractor(int maxKeywords) {
        if (maxKeywords <= 0) {
            throw new IllegalArgumentException("maxKeywords must be positive");
        }
        this.maxKeywords = maxKeywords;
    }

    /**
     * Return up to {@code maxKeywords} keywords ordered by descending frequency.
     * Words with the same frequency keep the order of their first occurrence.
     */
    public List<String> extract(String text) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String token : TextTokenizer.tokenize(text)) {
            if (STOP_WORDS.contains(token) || !TextTokenizer.isSignificant(token)) {
                continue;
            }
            frequencies.merge(token, 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return ranked.stream()
                .limit(maxKeywords)
                .map(Map.Entry::getKey)
                .toList();
    }
}
