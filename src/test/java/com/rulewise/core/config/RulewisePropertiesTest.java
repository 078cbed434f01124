package com.rulewise.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RulewisePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new RulewiseProperties();
        assertEquals("PaulDuvall/centralized-rules", props.getContentSourceId());
        assertEquals("main", props.getRef());
        assertTrue(props.isCacheEnabled());
        assertEquals(3600, props.getCacheTtlSeconds());
        assertEquals(5, props.getMaxRules());
        assertEquals(5000, props.getMaxTokens());
        assertEquals(5, props.getConcurrencyLimit());
        assertEquals(3, props.getMaxRetries());
        assertEquals(1000, props.getInitialBackoffMs());
        assertEquals(3000, props.getDeadlineMs());
        assertFalse(props.isVerbose());
        assertEquals("", props.getCatalog().getLocation());
    }

    @Test
    @DisplayName("defaults validate")
    void defaultsValidate() {
        assertDoesNotThrow(() -> new RulewiseProperties().validate());
    }

    @Test
    @DisplayName("zero max rules names the offending key")
    void zeroMaxRules() {
        var props = new RulewiseProperties();
        props.getSelection().setMaxRules(0);

        var e = assertThrows(ConfigurationException.class, props::validate);
        assertEquals("rulewise.selection.max-rules", e.getConfigKey());
    }

    @Test
    @DisplayName("zero token budget is allowed, negative is not")
    void tokenBudget() {
        var props = new RulewiseProperties();
        props.getSelection().setMaxTokens(0);
        assertDoesNotThrow(props::validate);

        props.getSelection().setMaxTokens(-1);
        assertEquals("rulewise.selection.max-tokens",
                assertThrows(ConfigurationException.class, props::validate).getConfigKey());
    }

    @Test
    @DisplayName("fetch settings are validated")
    void fetchSettings() {
        var props = new RulewiseProperties();
        props.getFetch().setConcurrencyLimit(0);
        assertEquals("rulewise.fetch.concurrency-limit",
                assertThrows(ConfigurationException.class, props::validate).getConfigKey());

        props = new RulewiseProperties();
        props.getFetch().setMaxRetries(-1);
        assertEquals("rulewise.fetch.max-retries",
                assertThrows(ConfigurationException.class, props::validate).getConfigKey());

        props = new RulewiseProperties();
        props.getFetch().setDeadlineMs(0);
        assertEquals("rulewise.fetch.deadline-ms",
                assertThrows(ConfigurationException.class, props::validate).getConfigKey());
    }

    @Test
    @DisplayName("blank ref is rejected")
    void blankRef() {
        var props = new RulewiseProperties();
        props.getSource().setRef(" ");
        assertEquals("rulewise.source.ref",
                assertThrows(ConfigurationException.class, props::validate).getConfigKey());
    }
}
