package com.rulewise.core.metrics;

import com.rulewise.core.fetch.FetchStatus;
import com.rulewise.core.model.PromptCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for rule selection and retrieval.
 */
@Service
public class RulewiseMetrics {

    private final MeterRegistry registry;

    public RulewiseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(PromptCategory category) {
        Counter.builder("rulewise.classifications")
                .tag("category", tagValue(category.name()))
                .register(registry)
                .increment();
    }

    public void recordSelection(int ruleCount, long tokens) {
        DistributionSummary.builder("rulewise.selection.rules")
                .register(registry)
                .record(ruleCount);
        DistributionSummary.builder("rulewise.selection.tokens")
                .baseUnit("tokens")
                .register(registry)
                .record(tokens);
    }

    public void recordFetchResult(FetchStatus status) {
        Counter.builder("rulewise.fetch.results")
                .tag("status", tagValue(status.name()))
                .register(registry)
                .increment();
    }

    /**
     * Records one retry of a transient content-source failure.
     */
    public void recordFetchRetry() {
        Counter.builder("rulewise.fetch.retries")
                .description("Content reads retried after a transient failure")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome pipeline status, e.g. {@code injected}, {@code skipped}
     */
    public void recordPipelineDuration(String outcome, long ms) {
        Timer.builder("rulewise.pipeline.duration")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPartialResult() {
        Counter.builder("rulewise.pipeline.partial")
                .description("Pipeline runs that returned before every fetch resolved")
                .register(registry)
                .increment();
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
