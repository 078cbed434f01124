package com.rulewise.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rulewise")
public class RulewiseProperties {

    private Source source = new Source();
    private Cache cache = new Cache();
    private Selection selection = new Selection();
    private Fetch fetch = new Fetch();
    private Catalog catalog = new Catalog();
    private boolean verbose = false;

    // -- Flat accessors (delegate to nested) --
    public String getContentSourceId() { return source.id; }
    public String getRef() { return source.ref; }
    public boolean isCacheEnabled() { return cache.enabled; }
    public long getCacheTtlSeconds() { return cache.ttlSeconds; }
    public int getCacheCapacity() { return cache.capacity; }
    public int getMaxRules() { return selection.maxRules; }
    public int getMaxTokens() { return selection.maxTokens; }
    public int getConcurrencyLimit() { return fetch.concurrencyLimit; }
    public int getMaxRetries() { return fetch.maxRetries; }
    public long getInitialBackoffMs() { return fetch.initialBackoffMs; }
    public long getDeadlineMs() { return fetch.deadlineMs; }

    /**
     * Rejects values the pipeline cannot run with.
     *
     * @throws ConfigurationException naming the first invalid key
     */
    public void validate() {
        requirePositive(selection.maxRules, "rulewise.selection.max-rules");
        requireNonNegative(selection.maxTokens, "rulewise.selection.max-tokens");
        requirePositive(fetch.concurrencyLimit, "rulewise.fetch.concurrency-limit");
        requireNonNegative(fetch.maxRetries, "rulewise.fetch.max-retries");
        requireNonNegative(fetch.initialBackoffMs, "rulewise.fetch.initial-backoff-ms");
        requirePositive(fetch.deadlineMs, "rulewise.fetch.deadline-ms");
        requirePositive(cache.ttlSeconds, "rulewise.cache.ttl-seconds");
        requirePositive(cache.capacity, "rulewise.cache.capacity");
        requirePositive(source.requestTimeoutSeconds, "rulewise.source.request-timeout-seconds");
        if (source.ref == null || source.ref.isBlank()) {
            throw new ConfigurationException("Missing required setting rulewise.source.ref", "rulewise.source.ref");
        }
    }

    private static void requirePositive(long value, String key) {
        if (value <= 0) {
            throw new ConfigurationException("%s must be > 0 (was %d)".formatted(key, value), key);
        }
    }

    private static void requireNonNegative(long value, String key) {
        if (value < 0) {
            throw new ConfigurationException("%s must be >= 0 (was %d)".formatted(key, value), key);
        }
    }

    public boolean isVerbose() { return verbose; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }
    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public static class Source {
        /** Remote document source in {@code owner/repo} form. */
        private String id = "PaulDuvall/centralized-rules";
        private String ref = "main";
        private String apiUrl = "https://api.github.com";
        private String token = "";
        private int requestTimeoutSeconds = 5;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getRef() { return ref; }
        public void setRef(String ref) { this.ref = ref; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Cache {
        private boolean enabled = true;
        private long ttlSeconds = 3600;
        private int capacity = 256;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    public static class Selection {
        private int maxRules = 5;
        private int maxTokens = 5000;

        public int getMaxRules() { return maxRules; }
        public void setMaxRules(int maxRules) { this.maxRules = maxRules; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class Fetch {
        private int concurrencyLimit = 5;
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
        private long deadlineMs = 3000;

        public int getConcurrencyLimit() { return concurrencyLimit; }
        public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }
        public long getDeadlineMs() { return deadlineMs; }
        public void setDeadlineMs(long deadlineMs) { this.deadlineMs = deadlineMs; }
    }

    public static class Catalog {
        /** Filesystem path of a catalog JSON file; blank means the bundled catalog. */
        private String location = "";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }
}
