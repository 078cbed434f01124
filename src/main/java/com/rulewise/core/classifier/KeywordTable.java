package com.rulewise.core.classifier;

import com.rulewise.core.config.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword lookup table keyed by a tag (a category, a topic name, ...).
 * <p>
 * Entries are validated when the table is built: keywords must be non-blank,
 * trimmed and lower-case, weights must be positive, and a keyword may appear at
 * most once per tag. Lookups work on lower-cased text and match keywords as
 * substrings. Iteration follows insertion order.
 *
 * @param <K> tag type
 */
public final class KeywordTable<K> {

    private final String name;
    private final Map<K, Map<String, Integer>> entries;

    private KeywordTable(String name, Map<K, Map<String, Integer>> entries) {
        this.name = name;
        this.entries = entries;
    }

    public static <K> Builder<K> builder(String name) {
        return new Builder<>(name);
    }

    public String name() {
        return name;
    }

    public Set<K> tags() {
        return entries.keySet();
    }

    /**
     * Sums, per tag, the weights of keywords contained in the text.
     * Tags without any hit are reported with score 0.
     *
     * @param lowerText text already lower-cased by the caller
     */
    public Map<K, Integer> score(String lowerText) {
        var scores = new LinkedHashMap<K, Integer>();
        for (var entry : entries.entrySet()) {
            int total = 0;
            for (var keyword : entry.getValue().entrySet()) {
                if (lowerText.contains(keyword.getKey())) {
                    total += keyword.getValue();
                }
            }
            scores.put(entry.getKey(), total);
        }
        return scores;
    }

    /**
     * Returns the tags that have at least one keyword contained in the text.
     *
     * @param lowerText text already lower-cased by the caller
     */
    public Set<K> matchingTags(String lowerText) {
        var matched = new LinkedHashSet<K>();
        for (var entry : entries.entrySet()) {
            for (String keyword : entry.getValue().keySet()) {
                if (lowerText.contains(keyword)) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    public static final class Builder<K> {

        private final String name;
        private final Map<K, Map<String, Integer>> entries = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Adds one weighted keyword for the tag. */
        public Builder<K> add(K tag, String keyword, int weight) {
            if (tag == null) {
                throw new ConfigurationException("Keyword table '%s' has an entry without a tag".formatted(name));
            }
            if (keyword == null || keyword.isBlank()
                    || !keyword.equals(keyword.strip())
                    || !keyword.equals(keyword.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Keyword table '%s' has malformed keyword '%s' for %s"
                        .formatted(name, keyword, tag));
            }
            if (weight <= 0) {
                throw new ConfigurationException("Keyword table '%s' has non-positive weight %d for '%s'"
                        .formatted(name, weight, keyword));
            }
            var keywords = entries.computeIfAbsent(tag, k -> new LinkedHashMap<>());
            if (keywords.putIfAbsent(keyword, weight) != null) {
                throw new ConfigurationException("Keyword table '%s' lists '%s' twice for %s"
                        .formatted(name, keyword, tag));
            }
            return this;
        }

        /** Adds several keywords for the tag, each with weight 1. */
        public Builder<K> addAll(K tag, String... keywords) {
            for (String keyword : keywords) {
                add(tag, keyword, 1);
            }
            return this;
        }

        public KeywordTable<K> build() {
            if (entries.isEmpty()) {
                throw new ConfigurationException("Keyword table '%s' is empty".formatted(name));
            }
            var frozen = new LinkedHashMap<K, Map<String, Integer>>();
            entries.forEach((tag, keywords) ->
                    frozen.put(tag, Collections.unmodifiableMap(new LinkedHashMap<>(keywords))));
            return new KeywordTable<>(name, Collections.unmodifiableMap(frozen));
        }
    }
}
