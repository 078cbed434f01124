package com.rulewise.core.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicExtractorTest {

    private final TopicExtractor extractor = new TopicExtractor();

    @Test
    @DisplayName("extracts topics in vocabulary order")
    void extractsInVocabularyOrder() {
        assertEquals(List.of("authentication", "api"), List.copyOf(extractor.extract("Add JWT login to the API")));
    }

    @Test
    @DisplayName("matching is case-insensitive")
    void caseInsensitive() {
        assertEquals(List.of("performance", "database"),
                List.copyOf(extractor.extract("OPTIMIZE the SLOW database QUERY")));
    }

    @Test
    @DisplayName("blank or unrelated text yields no topics")
    void noTopics() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("  ").isEmpty());
        assertTrue(extractor.extract("hello there").isEmpty());
    }

    @Test
    @DisplayName("vocabulary lists every topic")
    void vocabulary() {
        assertEquals(List.of("authentication", "testing", "security", "performance", "database",
                "api", "deployment", "monitoring", "refactoring"), List.copyOf(extractor.vocabulary()));
    }
}
