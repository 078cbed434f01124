package com.rulewise.dispatch.cli;

import com.rulewise.core.config.RulewiseProperties;
import com.rulewise.core.engine.RulePipeline;
import com.rulewise.core.model.PipelineResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: rulewise select [options] &lt;message&gt;
 * <p>
 * Runs the full pipeline for one message and prints either a summary or the
 * markdown block a host would inject.
 */
@Command(name = "select", mixinStandardHelpOptions = true,
        description = "Select and fetch the rules relevant to a message")
@Component
public class SelectCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "The message to select rules for")
    private List<String> words;

    @Option(names = {"-d", "--dir"}, description = "Project directory (default: current directory)")
    private Path directory;

    @Option(names = "--max-rules", description = "Maximum rules to inject (default: rulewise.selection.max-rules)")
    private Integer maxRules;

    @Option(names = "--max-tokens", description = "Token budget (default: rulewise.selection.max-tokens)")
    private Integer maxTokens;

    @Option(names = {"-m", "--markdown"}, description = "Print only the markdown block to inject")
    private boolean markdown;

    private final RulePipeline pipeline;
    private final RulewiseProperties properties;

    public SelectCommand(RulePipeline pipeline, RulewiseProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        String message = String.join(" ", words);
        Path dir = directory != null ? directory : Path.of("").toAbsolutePath();
        int rules = maxRules != null ? maxRules : properties.getMaxRules();
        int tokens = maxTokens != null ? maxTokens : properties.getMaxTokens();

        PipelineResult result = pipeline.run(message, dir, rules, tokens);

        if (markdown) {
            System.out.print(pipeline.render(result));
            return 0;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.info("Category: " + result.category());
        switch (result.status()) {
            case SKIPPED -> ConsoleOutput.info("Not a coding request, no rules injected");
            case NO_MATCHES -> {
                if (result.context() != null) {
                    ConsoleOutput.context(result.context());
                }
                ConsoleOutput.warn("No relevant rules found");
            }
            case INJECTED -> {
                ConsoleOutput.context(result.context());
                System.out.println();
                ConsoleOutput.success(result.rules().size() + " rule(s) selected:");
                for (int i = 0; i < result.rules().size(); i++) {
                    ConsoleOutput.rule(i + 1, result.rules().get(i));
                }
            }
        }
        if (result.partial()) {
            ConsoleOutput.warn("Deadline reached, some rules were left out");
        }
        ConsoleOutput.info("Done in " + ConsoleOutput.formatDuration(result.elapsedMs()));
        return 0;
    }
}
