package com.rulewise.core.classifier;

import com.rulewise.core.model.PromptCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies a user message into a {@link PromptCategory}.
 * <p>
 * Two phases:
 * <ol>
 *   <li>Pattern matching, category by category in {@link ClassificationPatterns#PRIORITY}
 *       order. The first category with any matching pattern wins.</li>
 *   <li>Keyword scoring when no pattern matched. The category with the strictly highest
 *       weight total wins, provided the total is at least {@value #MIN_KEYWORD_SCORE} and no
 *       other category ties it; otherwise the message is {@link PromptCategory#UNCLEAR}.</li>
 * </ol>
 * Stateless and thread-safe.
 */
@Component
public class PromptClassifier {

    private static final Logger log = LoggerFactory.getLogger(PromptClassifier.class);

    static final int MIN_KEYWORD_SCORE = 2;

    /**
     * @param text raw user message, may be {@code null}
     * @return the detected category, never {@code null}
     */
    public PromptCategory classify(String text) {
        if (text == null || text.isBlank()) {
            return PromptCategory.UNCLEAR;
        }

        var byPattern = classifyByPatterns(text);
        if (byPattern.isPresent()) {
            log.debug("Classified by pattern as {}", byPattern.get());
            return byPattern.get();
        }

        var byKeywords = classifyByKeywords(text);
        log.debug("Classified by keyword scoring as {}", byKeywords);
        return byKeywords;
    }

    Optional<PromptCategory> classifyByPatterns(String text) {
        for (PromptCategory category : ClassificationPatterns.PRIORITY) {
            for (Pattern pattern : ClassificationPatterns.PATTERNS.get(category)) {
                if (pattern.matcher(text).find()) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }

    PromptCategory classifyByKeywords(String text) {
        Map<PromptCategory, Integer> scores =
                ClassificationPatterns.KEYWORD_WEIGHTS.score(text.toLowerCase(Locale.ROOT));

        int maxScore = 0;
        PromptCategory best = PromptCategory.UNCLEAR;
        int tieCount = 0;

        for (var entry : scores.entrySet()) {
            int score = entry.getValue();
            if (score > maxScore) {
                maxScore = score;
                best = entry.getKey();
                tieCount = 1;
            } else if (score == maxScore && score > 0) {
                tieCount++;
            }
        }

        if (tieCount > 1 || maxScore < MIN_KEYWORD_SCORE) {
            return PromptCategory.UNCLEAR;
        }
        return best;
    }
}
