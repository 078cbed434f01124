package com.rulewise.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulewise.core.cache.RulesCache;
import com.rulewise.core.catalog.RuleCatalog;
import com.rulewise.core.catalog.RuleCatalogLoader;
import com.rulewise.core.classifier.IntentAnalyzer;
import com.rulewise.core.classifier.PromptClassifier;
import com.rulewise.core.engine.RuleAssembler;
import com.rulewise.core.engine.RulePipeline;
import com.rulewise.core.fetch.ConcurrentFetcher;
import com.rulewise.core.fetch.ContentSource;
import com.rulewise.core.fetch.ContentSourceId;
import com.rulewise.core.fetch.GitHubContentSource;
import com.rulewise.core.fetch.Sleeper;
import com.rulewise.core.metrics.RulewiseMetrics;
import com.rulewise.core.scanner.SessionContextCache;
import com.rulewise.core.selection.RuleSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the explicitly constructed parts of the pipeline. Settings are validated
 * before any bean is built, so a bad value fails application start.
 */
@Configuration
public class RulewiseConfig {

    private static final Logger log = LoggerFactory.getLogger(RulewiseConfig.class);

    private final RulewiseProperties properties;

    public RulewiseConfig(RulewiseProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleCatalogLoader ruleCatalogLoader(ObjectMapper objectMapper) {
        return new RuleCatalogLoader(objectMapper);
    }

    @Bean
    public RuleCatalog ruleCatalog(RuleCatalogLoader loader) {
        return loader.load(properties.getCatalog().getLocation());
    }

    @Bean
    public RulesCache rulesCache(Clock clock) {
        return new RulesCache(Duration.ofSeconds(properties.getCacheTtlSeconds()),
                properties.getCacheCapacity(), clock);
    }

    @Bean
    public ContentSource contentSource() {
        var source = properties.getSource();
        var id = ContentSourceId.parse(source.getId());
        log.debug("Using GitHub content source {} at {} (ref {})", id, source.getApiUrl(), source.getRef());
        return new GitHubContentSource(id, source.getApiUrl(), source.getToken(),
                Duration.ofSeconds(source.getRequestTimeoutSeconds()));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public ConcurrentFetcher concurrentFetcher(ContentSource contentSource, RulesCache rulesCache, Sleeper sleeper,
                                               @Autowired(required = false) RulewiseMetrics metrics) {
        var settings = new ConcurrentFetcher.Settings(
                properties.getRef(),
                properties.getConcurrencyLimit(),
                properties.getMaxRetries(),
                Duration.ofMillis(properties.getInitialBackoffMs()),
                properties.isCacheEnabled());
        return new ConcurrentFetcher(contentSource, rulesCache, settings, sleeper, metrics);
    }

    @Bean
    public RulePipeline rulePipeline(PromptClassifier classifier, IntentAnalyzer intentAnalyzer,
                                     SessionContextCache contextCache, RuleSelector selector,
                                     ConcurrentFetcher fetcher, RuleAssembler assembler, RuleCatalog catalog,
                                     @Autowired(required = false) RulewiseMetrics metrics) {
        return new RulePipeline(classifier, intentAnalyzer, contextCache, selector, fetcher, assembler, catalog,
                Duration.ofMillis(properties.getDeadlineMs()), metrics);
    }
}
