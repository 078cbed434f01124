package com.rulewise.core.fetch;

import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FetchResultTest {

    private final RuleDescriptor rule =
            new RuleDescriptor("base/a.md", "a", RuleCategory.BASE, null, null, null, null, null, 100);

    @Test
    @DisplayName("content is copied in and out")
    void contentIsCopied() {
        byte[] body = "A".getBytes(StandardCharsets.UTF_8);
        var result = FetchResult.of(rule, FetchStatus.FETCHED, body);
        body[0] = 'X';
        result.content()[0] = 'Y';

        assertEquals("A", result.contentAsString());
    }

    @Test
    @DisplayName("results with equal bytes are equal")
    void equality() {
        var first = FetchResult.of(rule, FetchStatus.CACHED, "A".getBytes(StandardCharsets.UTF_8));
        var second = FetchResult.of(rule, FetchStatus.CACHED, "A".getBytes(StandardCharsets.UTF_8));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, FetchResult.of(rule, FetchStatus.STALE, "A".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("statuses without content drop any bytes")
    void emptyStatusDropsContent() {
        var result = FetchResult.of(rule, FetchStatus.NOT_FOUND, "A".getBytes(StandardCharsets.UTF_8));

        assertFalse(result.hasContent());
        assertNull(result.content());
    }

    @Test
    @DisplayName("a content status without bytes is rejected")
    void contentStatusNeedsBytes() {
        assertThrows(IllegalArgumentException.class, () -> FetchResult.empty(rule, FetchStatus.FETCHED));
    }
}
