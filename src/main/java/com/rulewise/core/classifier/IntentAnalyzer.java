package com.rulewise.core.classifier;

import com.rulewise.core.model.IntentAction;
import com.rulewise.core.model.Urgency;
import com.rulewise.core.model.UserIntent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives a {@link UserIntent} (topics, action, urgency) from a single message.
 */
@Component
public class IntentAnalyzer {

    /** Checked in order; the first action whose pattern matches wins. */
    private static final Map<IntentAction, Pattern> ACTION_PATTERNS = new LinkedHashMap<>();

    static {
        ACTION_PATTERNS.put(IntentAction.IMPLEMENT, Pattern.compile("\\b(implement|add|create|build|write)\\b"));
        ACTION_PATTERNS.put(IntentAction.FIX, Pattern.compile("\\b(fix|bug|error|issue|problem)\\b"));
        ACTION_PATTERNS.put(IntentAction.REFACTOR, Pattern.compile("\\b(refactor|cleanup|improve|optimize)\\b"));
        ACTION_PATTERNS.put(IntentAction.REVIEW, Pattern.compile("\\b(review|check|validate|audit)\\b"));
    }

    private static final Pattern URGENT = Pattern.compile("\\b(urgent|critical|asap|immediately|production)\\b");

    private final TopicExtractor topicExtractor;

    public IntentAnalyzer(TopicExtractor topicExtractor) {
        this.topicExtractor = topicExtractor;
    }

    public UserIntent analyze(String message) {
        if (message == null || message.isBlank()) {
            return new UserIntent(Set.of(), IntentAction.GENERAL, Urgency.NORMAL);
        }
        String lower = message.toLowerCase(Locale.ROOT);

        IntentAction action = IntentAction.GENERAL;
        for (var entry : ACTION_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                action = entry.getKey();
                break;
            }
        }

        Urgency urgency = URGENT.matcher(lower).find() ? Urgency.HIGH : Urgency.NORMAL;

        return new UserIntent(topicExtractor.extract(message), action, urgency);
    }
}
