package com.rulewise.core.classifier;

import com.rulewise.core.model.IntentAction;
import com.rulewise.core.model.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntentAnalyzerTest {

    private final IntentAnalyzer analyzer = new IntentAnalyzer(new TopicExtractor());

    @Test
    @DisplayName("fix request in production is urgent")
    void urgentFix() {
        var intent = analyzer.analyze("Fix the critical bug in production");
        assertEquals(IntentAction.FIX, intent.action());
        assertEquals(Urgency.HIGH, intent.urgency());
    }

    @Test
    @DisplayName("first matching action wins")
    void actionOrder() {
        // "add" (implement) is checked before "refactor"
        assertEquals(IntentAction.IMPLEMENT, analyzer.analyze("Please refactor and add tests").action());
        assertEquals(IntentAction.REFACTOR, analyzer.analyze("Refactor the user service").action());
        assertEquals(IntentAction.REVIEW, analyzer.analyze("Review the code").action());
    }

    @Test
    @DisplayName("actions and urgency match whole words only")
    void wordBoundaries() {
        var intent = analyzer.analyze("The address field and the production-like setup");
        // "address" does not contain the word "add"; "production" is a whole word before "-"
        assertEquals(IntentAction.GENERAL, intent.action());
        assertEquals(Urgency.HIGH, intent.urgency());
    }

    @Test
    @DisplayName("topics come from the topic extractor")
    void topics() {
        var intent = analyzer.analyze("Add OAuth login and write tests");
        assertTrue(intent.topics().contains("authentication"));
        assertTrue(intent.topics().contains("testing"));
    }

    @Test
    @DisplayName("blank message is a general, normal-urgency intent without topics")
    void blank() {
        var intent = analyzer.analyze(" ");
        assertEquals(IntentAction.GENERAL, intent.action());
        assertEquals(Urgency.NORMAL, intent.urgency());
        assertTrue(intent.topics().isEmpty());
    }
}
