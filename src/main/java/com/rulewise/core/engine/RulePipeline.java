package com.rulewise.core.engine;

import com.rulewise.core.catalog.RuleCatalog;
import com.rulewise.core.classifier.IntentAnalyzer;
import com.rulewise.core.classifier.PromptClassifier;
import com.rulewise.core.config.ConfigurationException;
import com.rulewise.core.fetch.ConcurrentFetcher;
import com.rulewise.core.fetch.FetchStatus;
import com.rulewise.core.logging.MdcContext;
import com.rulewise.core.metrics.RulewiseMetrics;
import com.rulewise.core.model.PipelineResult;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.PromptCategory;
import com.rulewise.core.model.RuleSelection;
import com.rulewise.core.model.UserIntent;
import com.rulewise.core.scanner.DetectionException;
import com.rulewise.core.scanner.SessionContextCache;
import com.rulewise.core.selection.RuleSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Runs one message through classification, context detection, selection,
 * fetching and assembly.
 *
 * <p>Non-actionable messages return {@link PipelineResult.Status#SKIPPED} before
 * any detection or fetching. Fetching is bounded by the wall-clock budget measured
 * from the start of the run; a run that hits the budget returns whatever resolved
 * and is flagged partial. Apart from {@link ConfigurationException}, failures
 * degrade the result instead of propagating.
 */
public class RulePipeline {

    private static final Logger log = LoggerFactory.getLogger(RulePipeline.class);

    static final long SLOW_RUN_MS = 2000;

    private final PromptClassifier classifier;
    private final IntentAnalyzer intentAnalyzer;
    private final SessionContextCache contextCache;
    private final RuleSelector selector;
    private final ConcurrentFetcher fetcher;
    private final RuleAssembler assembler;
    private final RuleCatalog catalog;
    private final Duration budget;
    private final RulewiseMetrics metrics;

    public RulePipeline(PromptClassifier classifier, IntentAnalyzer intentAnalyzer,
                        SessionContextCache contextCache, RuleSelector selector,
                        ConcurrentFetcher fetcher, RuleAssembler assembler, RuleCatalog catalog,
                        Duration budget, RulewiseMetrics metrics) {
        this.classifier = classifier;
        this.intentAnalyzer = intentAnalyzer;
        this.contextCache = contextCache;
        this.selector = selector;
        this.fetcher = fetcher;
        this.assembler = assembler;
        this.catalog = catalog;
        this.budget = budget;
        this.metrics = metrics;
    }

    /**
     * @param message   the user's message
     * @param directory project working directory
     * @param maxRules  maximum number of rules to inject
     * @param maxTokens token budget for injected rules
     */
    public PipelineResult run(String message, Path directory, int maxRules, int maxTokens) {
        if (maxRules < 0) {
            throw new ConfigurationException("maxRules must be >= 0, got " + maxRules, "rulewise.selection.max-rules");
        }
        if (maxTokens < 0) {
            throw new ConfigurationException("maxTokens must be >= 0, got " + maxTokens, "rulewise.selection.max-tokens");
        }

        long startNanos = System.nanoTime();
        String requestId = MdcContext.startRequest();
        PromptCategory category = PromptCategory.UNCLEAR;
        ProjectContext context = null;
        UserIntent intent = null;
        try {
            category = classifier.classify(message);
            if (metrics != null) {
                metrics.recordClassification(category);
            }
            if (!category.isActionable()) {
                log.debug("Message classified as {}, skipping rule injection", category);
                return finish(PipelineResult.skipped(category, elapsedMs(startNanos)));
            }

            context = detect(directory);
            intent = intentAnalyzer.analyze(message);

            RuleSelection selection = selector.select(catalog, context, intent, category, maxRules, maxTokens);
            if (metrics != null) {
                metrics.recordSelection(selection.rules().size(), selection.totalTokens());
            }
            if (selection.status() == RuleSelection.Status.NO_MATCHES) {
                return finish(new PipelineResult(PipelineResult.Status.NO_MATCHES, category, context, intent,
                        List.of(), false, elapsedMs(startNanos)));
            }

            Duration remaining = budget.minusMillis(elapsedMs(startNanos));
            var fetched = fetcher.fetchMany(selection.descriptors(), remaining.isNegative() ? Duration.ZERO : remaining);
            boolean partial = fetched.stream().anyMatch(r -> r.status() == FetchStatus.TIMED_OUT);
            var rules = assembler.assemble(selection, fetched);

            var status = rules.isEmpty() ? PipelineResult.Status.NO_MATCHES : PipelineResult.Status.INJECTED;
            return finish(new PipelineResult(status, category, context, intent, rules, partial, elapsedMs(startNanos)));
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Rule pipeline failed for request {}: {}", requestId, e.getMessage(), e);
            return finish(new PipelineResult(PipelineResult.Status.NO_MATCHES, category, context, intent,
                    List.of(), false, elapsedMs(startNanos)));
        } finally {
            MdcContext.clear();
        }
    }

    public String render(PipelineResult result) {
        return assembler.render(result);
    }

    private ProjectContext detect(Path directory) {
        try {
            return contextCache.get(directory);
        } catch (DetectionException e) {
            log.warn("Context detection failed, continuing without project context: {}", e.getMessage());
            return ProjectContext.empty(String.valueOf(directory));
        }
    }

    private PipelineResult finish(PipelineResult result) {
        if (result.elapsedMs() > SLOW_RUN_MS) {
            log.warn("Rule pipeline took {} ms (status={}, rules={})",
                    result.elapsedMs(), result.status(), result.rules().size());
        } else {
            log.debug("Rule pipeline finished in {} ms (status={}, rules={})",
                    result.elapsedMs(), result.status(), result.rules().size());
        }
        if (metrics != null) {
            metrics.recordPipelineDuration(result.status().name().toLowerCase(Locale.ROOT), result.elapsedMs());
            if (result.partial()) {
                metrics.recordPartialResult();
            }
        }
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
