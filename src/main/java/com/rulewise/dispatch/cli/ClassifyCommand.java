package com.rulewise.dispatch.cli;

import com.rulewise.core.classifier.IntentAnalyzer;
import com.rulewise.core.classifier.PromptClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: rulewise classify &lt;message&gt;
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Show how a message is classified and what intent it carries")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(arity = "1..*", description = "The message to classify")
    private List<String> words;

    private final PromptClassifier classifier;
    private final IntentAnalyzer intentAnalyzer;

    public ClassifyCommand(PromptClassifier classifier, IntentAnalyzer intentAnalyzer) {
        this.classifier = classifier;
        this.intentAnalyzer = intentAnalyzer;
    }

    @Override
    public void run() {
        String message = String.join(" ", words);
        var category = classifier.classify(message);

        ConsoleOutput.info("Category: " + category);
        if (category.isActionable()) {
            ConsoleOutput.success("Actionable, boosts " + String.join(", ", category.boostTopics())
                    + " (+" + category.boost() + ")");
        } else {
            ConsoleOutput.warn("Not actionable, rules would be skipped");
        }
        ConsoleOutput.intent(intentAnalyzer.analyze(message));
    }
}
