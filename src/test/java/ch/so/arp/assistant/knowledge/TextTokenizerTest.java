package ch.so.arp.assistant.knowledge;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextTokenizerTest {

    @Test
    void splitsOnPunctuationAndLowercases() {
        assertThat(TextTokenizer.tokenize("What is Bitcoin? snake_case, v2!"))
                .containsExactly("what", "is", "bitcoin", "snake_case", "v2");
    }

    @Test
    void emitsIdeographsAsSingleTokens() {
        assertThat(TextTokenizer.tokenize("区块链abc")).containsExactly("区", "块", "链", "abc");
    }

    @Test
    void termsSkipShortAndNumericTokens() {
        assertThat(TextTokenizer.terms("a 42 ok 链")).containsExactly("ok", "链");
    }
}
