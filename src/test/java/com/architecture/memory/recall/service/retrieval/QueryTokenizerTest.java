package com.architecture.memory.recall.service.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTokenizerTest {

    @Test
    void extractsIdentifierLikeTokens() {
        assertThat(QueryTokenizer.tokenize("where is parse_config in src/app.py called?"))
                .containsExactly("where", "parse_config", "src/app.py", "called");
    }

    @Test
    void dropsShortWordsAndLeadingDigits() {
        assertThat(QueryTokenizer.tokenize("a b")).isEmpty();
        assertThat(QueryTokenizer.tokenize("is it 42 ok")).isEmpty();
        assertThat(QueryTokenizer.tokenize("")).isEmpty();
        assertThat(QueryTokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void deduplicatesCaseInsensitivelyKeepingFirstCasing() {
        assertThat(QueryTokenizer.tokenize("Invoice invoice INVOICE total"))
                .containsExactly("Invoice", "total");
    }

    @Test
    void capsTokenCount() {
        assertThat(QueryTokenizer.tokenize("one two three four five six seven eight nine ten"))
                .hasSize(QueryTokenizer.MAX_TOKENS)
                .startsWith("one")
                .endsWith("eight");
    }
}
