package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared text metrics for the built-in rules, plus consolidation of a rule's findings into a
 * single issue.
 */
public abstract class BaseAuditRule implements AuditRule {

    protected static final Pattern HEADER = Pattern.compile("^(#{1,6})\\s+(.+)$", Pattern.MULTILINE);
    protected static final Pattern MARKDOWN_LINK = Pattern.compile("(?<!!)\\[([^\\]]*)\\]\\(([^)]+)\\)");
    protected static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(([^)]+)\\)");
    protected static final Pattern RAW_URL = Pattern.compile(
            "https?://(www\\.)?[-a-zA-Z0-9@:%._+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b([-a-zA-Z0-9()@:%_+.~#?&/=]*)");
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");
    private static final Pattern LETTER_WORD = Pattern.compile("\\b[a-z]+\\b");

    private final String id;
    private final String name;
    private final String description;
    private final RuleCategory category;
    private final Severity severity;

    protected BaseAuditRule(String id, String name, String description, RuleCategory category, Severity severity) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.severity = severity;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public RuleCategory getCategory() {
        return category;
    }

    @Override
    public Severity getSeverity() {
        return severity;
    }

    protected Issue issue(String title, String description, String suggestion, IssueLocation location) {
        return Issue.builder()
                .ruleId(id)
                .category(category)
                .severity(severity)
                .title(title)
                .description(description)
                .suggestion(suggestion)
                .location(location)
                .build();
    }

    /**
     * Folds findings into at most one issue: the most severe finding (first one wins ties)
     * with the distinct suggestions of all findings. The issue carries the rule's severity.
     */
    protected List<Issue> consolidate(List<Finding> findings, int suggestionLimit) {
        if (findings.isEmpty()) {
            return List.of();
        }
        Finding primary = findings.get(0);
        for (Finding finding : findings) {
            if (finding.severity.isMoreSevereThan(primary.severity)) {
                primary = finding;
            }
        }

        Set<String> suggestions = new LinkedHashSet<>(primary.suggestions);
        for (Finding finding : findings) {
            suggestions.addAll(finding.suggestions);
        }
        String suggestion = String.join("; ", suggestions.stream().limit(suggestionLimit).toList());

        String description = primary.description;
        if (findings.size() > 1) {
            description += " (" + (findings.size() - 1) + " related finding" + (findings.size() > 2 ? "s" : "") + ")";
        }
        return List.of(issue(primary.title, description, suggestion, primary.location));
    }

    protected static int wordCount(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }

    protected static List<String> words(String content) {
        List<String> words = new ArrayList<>();
        if (content == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(content.toLowerCase());
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    protected static List<String> sentences(String content) {
        if (content == null) {
            return List.of();
        }
        return Arrays.stream(content.split("[.!?]+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    protected static List<String> paragraphs(String content) {
        if (content == null) {
            return List.of();
        }
        return Arrays.stream(content.split("\\n\\s*\\n"))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    /**
     * Header texts in document order, without the leading hashes.
     */
    protected static List<String> headers(String content) {
        List<String> headers = new ArrayList<>();
        if (content == null) {
            return headers;
        }
        Matcher matcher = HEADER.matcher(content);
        while (matcher.find()) {
            headers.add(matcher.group(2).trim());
        }
        return headers;
    }

    protected static List<Integer> headerLevels(String content) {
        List<Integer> levels = new ArrayList<>();
        if (content == null) {
            return levels;
        }
        Matcher matcher = HEADER.matcher(content);
        while (matcher.find()) {
            levels.add(matcher.group(1).length());
        }
        return levels;
    }

    /**
     * Flesch reading ease; higher is easier.
     */
    protected static double readabilityScore(String content) {
        int words = wordCount(content);
        int sentences = sentences(content).size();
        if (words == 0 || sentences == 0) {
            return 0;
        }
        double wordsPerSentence = (double) words / sentences;
        double syllablesPerWord = (double) countSyllables(content) / words;
        return 206.835 - (1.015 * wordsPerSentence) - (84.6 * syllablesPerWord);
    }

    protected static int countSyllables(String text) {
        if (text == null) {
            return 0;
        }
        int total = 0;
        Matcher wordMatcher = LETTER_WORD.matcher(text.toLowerCase());
        while (wordMatcher.find()) {
            String word = wordMatcher.group();
            int syllables = 0;
            Matcher vowels = VOWEL_GROUP.matcher(word);
            while (vowels.find()) {
                syllables++;
            }
            // Silent trailing e
            if (word.endsWith("e") && syllables > 1) {
                syllables--;
            }
            total += Math.max(1, syllables);
        }
        return total;
    }

    protected static List<String> basicGrammarProblems(String content) {
        List<String> problems = new ArrayList<>();
        if (content == null) {
            return problems;
        }
        if (content.contains("  ")) {
            problems.add("Multiple consecutive spaces found");
        }
        String trimmed = content.trim();
        if (sentences(content).size() > 1 && !trimmed.isEmpty() && ".!?".indexOf(trimmed.charAt(trimmed.length() - 1)) < 0) {
            problems.add("Content may be missing punctuation at the end");
        }
        for (String header : headers(content)) {
            if (header.length() > 3 && header.toLowerCase().equals(header)) {
                problems.add("Header \"" + header + "\" may need proper capitalization");
            }
        }
        return problems;
    }

    /**
     * One observation of a rule, before consolidation.
     */
    protected static final class Finding {

        private final Severity severity;
        private final String title;
        private final String description;
        private final List<String> suggestions;
        private final IssueLocation location;

        public Finding(Severity severity, String title, String description, List<String> suggestions) {
            this(severity, title, description, suggestions, null);
        }

        public Finding(Severity severity, String title, String description, List<String> suggestions,
                       IssueLocation location) {
            this.severity = severity;
            this.title = title;
            this.description = description;
            this.suggestions = suggestions;
            this.location = location;
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getTitle() {
            return title;
        }
    }
}
