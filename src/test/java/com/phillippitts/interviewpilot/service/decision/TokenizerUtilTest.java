package com.phillippitts.interviewpilot.service.decision;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerUtilTest {

    @Test
    void shouldReturnEmptyListForNullOrBlank() {
        assertThat(TokenizerUtil.tokenize(null)).isEmpty();
        assertThat(TokenizerUtil.tokenize("   ")).isEmpty();
    }

    @Test
    void shouldLowercaseAndSplitOnPunctuation() {
        assertThat(TokenizerUtil.tokenize("Kafka, Redis; PostgreSQL!"))
                .containsExactly("kafka", "redis", "postgresql");
    }

    @Test
    void shouldDropStopWordsAndSingleCharacters() {
        assertThat(TokenizerUtil.tokenize("I used a queue for the retries, x"))
                .containsExactly("used", "queue", "retries");
    }

    @Test
    void shouldKeepDigitsAndDuplicates() {
        assertThat(TokenizerUtil.tokenize("http2 and http2")).containsExactly("http2", "http2");
    }
}
