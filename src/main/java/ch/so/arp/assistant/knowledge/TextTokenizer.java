package ch.so.arp.assistant.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexical tokenizer shared by keyword extraction and retrieval. Text is lower
 * cased and split into runs of letters, digits and underscores. Han ideographs
 * never join a run, every ideograph is a token of its own.
 */
final class TextTokenizer {

    private TextTokenizer() {
    }

    /**
     * Split the text into raw tokens without any filtering.
     */
    static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return tokens;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        StringBuilder word = new StringBuilder();
        int offset = 0;
        while (offset < normalized.length()) {
            int codePoint = normalized.codePointAt(offset);
            if (isIdeograph(codePoint)) {
                flush(word, tokens);
                tokens.add(new String(Character.toChars(codePoint)));
            } else if (Character.isLetterOrDigit(codePoint) || codePoint == '_') {
                word.appendCodePoint(codePoint);
            } else {
                flush(word, tokens);
            }
            offset += Character.charCount(codePoint);
        }
        flush(word, tokens);
        return tokens;
    }

    /**
     * Tokens that take part in relevance scoring: at least two characters long
     * or a single ideograph, and not purely numeric.
     */
    static List<String> terms(String value) {
        List<String> terms = new ArrayList<>();
        for (String token : tokenize(value)) {
            if (isSignificant(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    static boolean isSignificant(String token) {
        return (token.length() >= 2 || isIdeograph(token)) && !isNumeric(token);
    }

    static boolean isIdeograph(String token) {
        return token.codePointCount(0, token.length()) == 1 && isIdeograph(token.codePointAt(0));
    }

    static boolean isNumeric(String token) {
        return !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }

    private static boolean isIdeograph(int codePoint) {
        return Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN;
    }

    private static void flush(StringBuilder word, List<String> tokens) {
        if (word.length() > 0) {
            tokens.add(word.toString());
            word.setLength(0);
        }
    }
}
