package com.autonomous.shellagent.service;

import com.autonomous.shellagent.model.InteractionCategory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches terminal output against an ordered rule catalog. The first matching rule wins: credential prompts
 * come first so they are never answered automatically, and prompts that need an answer are listed ahead of
 * the informational completion and progress rules.
 */
@Service
public class InteractionClassifier {

    private static final class Rule {
        private final InteractionCategory category;
        private final Pattern pattern;

        private Rule(InteractionCategory category, Pattern pattern) {
            this.category = category;
            this.pattern = pattern;
        }
    }

    private static final List<Rule> RULES = List.of(
        new Rule(InteractionCategory.CREDENTIAL, Pattern.compile(
            "(?i)\\b(password|passphrase|passwd)\\b[^\\n]*:\\s*$")),
        new Rule(InteractionCategory.CONFIRMATION, Pattern.compile(
            "(?i)(\\(y/n\\)|\\[y/n\\]|\\by/n\\b|\\byes/no\\b|\\bcontinue\\s*\\?|\\bproceed\\s*\\?)")),
        new Rule(InteractionCategory.CONTINUATION, Pattern.compile(
            "(?i)(\\bpress\\s+(any\\s+key|enter|return)\\b|\\bhit\\s+enter\\b|--more--|\\bto\\s+continue\\b)")),
        new Rule(InteractionCategory.CONFIRMATION, Pattern.compile(
            "(?i)\\b(are\\s+you\\s+sure|really\\s+want|confirm|overwrite)\\b")),
        new Rule(InteractionCategory.INSTALL_PROMPT, Pattern.compile(
            "(?i)\\b(install|setup|would\\s+you\\s+like\\s+to\\s+install)\\b[^\\n]*\\?")),
        new Rule(InteractionCategory.COMPLETION, Pattern.compile(
            "(?i)\\b(download\\s+complete|installation\\s+complete|successfully\\s+installed|installed\\s+successfully)\\b")),
        new Rule(InteractionCategory.PROGRESS, Pattern.compile(
            "(?i)(\\bdownloading\\b|\\bprogress\\b|\\d{1,3}(\\.\\d+)?%|\\b\\d+/\\d+\\b)"))
    );

    public Optional<InteractionCategory> classify(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        for (Rule rule : RULES) {
            if (rule.pattern.matcher(output).find()) {
                return Optional.of(rule.category);
            }
        }
        return Optional.empty();
    }

    public String defaultResponse(InteractionCategory category) {
        return category == null ? "" : category.getDefaultResponse();
    }

    /**
     * Classifies only the last {@code lines} lines, where a blocking prompt sits.
     */
    public Optional<InteractionCategory> classifyTail(String output, int lines) {
        return classify(tail(output, lines));
    }

    static String tail(String output, int lines) {
        if (output == null || lines <= 0) {
            return output;
        }
        String trimmed = output.stripTrailing();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        int index = trimmed.length();
        for (int i = 0; i < lines && index > 0; i++) {
            index = trimmed.lastIndexOf('\n', index - 1);
            if (index < 0) {
                return trimmed;
            }
        }
        return trimmed.substring(index + 1);
    }
}
