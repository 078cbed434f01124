package com.rulewise.core.model;

import java.util.List;

/**
 * Final output of one pipeline run.
 *
 * @param status    what happened: rules injected, no relevant rules, or skipped as non-actionable
 * @param category  classifier output for the message
 * @param context   detected project context, {@code null} when skipped before detection
 * @param intent    analysed intent, {@code null} when skipped
 * @param rules     rules in score order, content resolved
 * @param partial   true when the wall-clock budget expired before every fetch resolved
 * @param elapsedMs total run time
 */
public record PipelineResult(
    Status status,
    PromptCategory category,
    ProjectContext context,
    UserIntent intent,
    List<AssembledRule> rules,
    boolean partial,
    long elapsedMs
) {
    public enum Status { INJECTED, NO_MATCHES, SKIPPED }

    public PipelineResult {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static PipelineResult skipped(PromptCategory category, long elapsedMs) {
        return new PipelineResult(Status.SKIPPED, category, null, null, List.of(), false, elapsedMs);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
