package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Detects repetition inside one article: repeated headers, near-identical paragraphs,
 * verbatim repeated sentences and overused three-word phrases.
 */
@Component
@Order(4)
public class DuplicateContentRule extends BaseAuditRule {

    static final double SIMILARITY_THRESHOLD = 0.8;
    private static final int MIN_CONTENT_LENGTH = 100;
    private static final int MIN_PARAGRAPH_LENGTH = 50;
    private static final int MIN_SENTENCE_LENGTH = 20;
    private static final int MIN_PHRASE_OCCURRENCES = 3;

    private static final List<String> COMMON_PHRASES = List.of(
            "thank you", "please note", "for more information",
            "if you have questions", "contact support", "getting started"
    );

    public DuplicateContentRule() {
        super("duplicate-content", "Duplicate Content Detection",
                "Identifies repeated content sections, similar text blocks and redundant information",
                RuleCategory.CONTENT_QUALITY, Severity.MEDIUM);
    }

    @Override
    public List<Issue> evaluate(Article article) {
        String content = article.getContent();
        if (content == null || content.length() < MIN_CONTENT_LENGTH) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        checkHeaders(content, findings);
        checkParagraphs(content, findings);
        checkSentences(content, findings);
        checkPhrases(content, findings);
        return consolidate(findings, 6);
    }

    private void checkHeaders(String content, List<Finding> findings) {
        List<String> headers = headers(content).stream().map(h -> h.toLowerCase().trim()).toList();
        long duplicates = repeated(headers, 2).size();
        if (duplicates > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Duplicate headers detected",
                    "Found " + duplicates + " headers that are identical or very similar.",
                    List.of("Review header names for uniqueness",
                            "Use more specific header text",
                            "Combine sections with similar headers",
                            "Create a clear content hierarchy")));
        }
    }

    private void checkParagraphs(String content, List<Finding> findings) {
        List<String> paragraphs = paragraphs(content).stream()
                .filter(p -> p.length() > MIN_PARAGRAPH_LENGTH)
                .toList();
        int similarPairs = 0;
        for (int i = 0; i < paragraphs.size(); i++) {
            for (int j = i + 1; j < paragraphs.size(); j++) {
                if (similarity(paragraphs.get(i), paragraphs.get(j)) >= SIMILARITY_THRESHOLD) {
                    similarPairs++;
                }
            }
        }
        if (similarPairs > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Similar paragraphs detected",
                    "Found " + similarPairs + " pairs of paragraphs with high similarity.",
                    List.of("Review similar paragraphs for redundancy",
                            "Combine or consolidate repetitive content",
                            "Ensure each paragraph adds unique value",
                            "Consider creating reusable content blocks")));
        }
    }

    private void checkSentences(String content, List<Finding> findings) {
        List<String> normalized = sentences(content).stream()
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .map(s -> s.toLowerCase().replaceAll("[^\\w\\s]", "").trim())
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .toList();
        int duplicates = repeated(normalized, 2).size();
        if (duplicates > 0) {
            findings.add(new Finding(Severity.HIGH, "Duplicate sentences found",
                    "Found " + duplicates + " sentences that are repeated exactly.",
                    List.of("Remove duplicate sentences",
                            "Vary sentence structure when conveying similar information",
                            "Use references instead of repeating information",
                            "Check for copy-paste errors")));
        }
    }

    private void checkPhrases(String content, List<Finding> findings) {
        List<String> words = words(content);
        List<String> phrases = new ArrayList<>();
        for (int i = 0; i + 2 < words.size(); i++) {
            String phrase = words.get(i) + " " + words.get(i + 1) + " " + words.get(i + 2);
            if (phrase.length() > 10) {
                phrases.add(phrase);
            }
        }
        List<String> repeated = repeated(phrases, MIN_PHRASE_OCCURRENCES).stream()
                .filter(phrase -> COMMON_PHRASES.stream().noneMatch(phrase::contains))
                .toList();
        if (!repeated.isEmpty()) {
            findings.add(new Finding(Severity.LOW, "Repetitive phrases detected",
                    "Found " + repeated.size() + " phrases that are repeated frequently, e.g. \""
                            + repeated.get(0) + "\".",
                    List.of("Vary language to avoid repetitive phrasing",
                            "Use synonyms and alternative expressions",
                            "Review content for necessary repetition",
                            "Consider creating a glossary for repeated terms")));
        }
    }

    /**
     * Jaccard similarity of the word sets of two texts.
     */
    static double similarity(String first, String second) {
        Set<String> firstWords = new HashSet<>(words(first));
        Set<String> secondWords = new HashSet<>(words(second));
        Set<String> union = new HashSet<>(firstWords);
        union.addAll(secondWords);
        if (union.isEmpty()) {
            return 0;
        }
        firstWords.retainAll(secondWords);
        return (double) firstWords.size() / union.size();
    }

    // Items occurring at least minCount times, most frequent first
    private static List<String> repeated(List<String> items, int minCount) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        items.forEach(item -> counts.merge(item, 1, Integer::sum));
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= minCount)
                .sorted((a, b) -> Integer.compare(b.getValue(), a.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }
}
