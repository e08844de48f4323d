package ch.so.arp.assistant.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits extracted document text into chunks of bounded size. Paragraphs are
 * packed greedily into a chunk as long as they fit; a paragraph that is longer
 * than the chunk size is packed word by word instead. Words are never split,
 * so a single word exceeding the limit ends up as a chunk of its own.
 */
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 800;

    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final String WORD_SEPARATOR = " ";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int chunkSize;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public TextChunker(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Chunk the text. Blank input yields an empty list.
     */
    public List<String> chunk(String text) {
        String normalized = normalize(text);
        List<String> chunks = new ArrayList<>();
        if (normalized.isEmpty()) {
            return chunks;
        }
        StringBuilder buffer = new StringBuilder();
        for (String candidate : normalized.split(PARAGRAPH_SEPARATOR)) {
            String paragraph = candidate.strip();
            if (paragraph.isEmpty()) {
                continue;
            }
            if (buffer.length() + paragraph.length() + PARAGRAPH_SEPARATOR.length() <= chunkSize) {
                append(buffer, PARAGRAPH_SEPARATOR, paragraph);
                continue;
            }
            flush(buffer, chunks);
            if (paragraph.length() > chunkSize) {
                for (String word : WHITESPACE.split(paragraph)) {
                    if (buffer.length() + word.length() + WORD_SEPARATOR.length() <= chunkSize) {
                        append(buffer, WORD_SEPARATOR, word);
                    } else {
                        flush(buffer, chunks);
                        buffer.append(word);
                    }
                }
            } else {
                buffer.append(paragraph);
            }
        }
        flush(buffer, chunks);
        return chunks;
    }

    /**
     * Collapse runs of blank lines and horizontal whitespace and trim the text.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = LINE_BREAK.matcher(text).replaceAll("\n");
        normalized = EXCESS_BLANK_LINES.matcher(normalized).replaceAll(PARAGRAPH_SEPARATOR);
        normalized = HORIZONTAL_WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }

    private static void append(StringBuilder buffer, String separator, String text) {
        if (buffer.length() > 0) {
            buffer.append(separator);
        }
        buffer.append(text);
    }

    private static void flush(StringBuilder buffer, List<String> chunks) {
        if (buffer.length() > 0) {
            chunks.add(buffer.toString());
            buffer.setLength(0);
        }
    }
}
