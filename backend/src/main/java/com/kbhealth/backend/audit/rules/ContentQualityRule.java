package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Readability, length, grammar and structure checks of an article body.
 */
@Component
@Order(3)
public class ContentQualityRule extends BaseAuditRule {

    static final int MIN_WORD_COUNT = 50;
    static final int MAX_WORD_COUNT = 5000;
    static final double MIN_READABILITY = 30;
    static final double MAX_READABILITY = 90;
    static final int MAX_SENTENCE_WORDS = 25;
    static final int MIN_HEADER_COUNT = 1;

    private static final Pattern CODE_CONTENT = Pattern.compile("```|`[^`]+`|\\$\\(|\\$\\{|function\\s*\\(|class\\s+\\w+|def\\s+\\w+");
    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```|`[^`\\n]+`");
    private static final Pattern URL_TEXT = Pattern.compile("https?://[^\\s)]+");
    private static final Pattern LIST_CONTENT = Pattern.compile("^\\s*[-*+]\\s+|\\d+\\.\\s+", Pattern.MULTILINE);
    private static final Pattern WELL_FORMED_LIST = Pattern.compile("^([-*+]|\\d+\\.)\\s+.+$", Pattern.MULTILINE);

    public ContentQualityRule() {
        super("content-quality", "Content Quality Assessment",
                "Evaluates content for readability, structure, grammar and overall quality",
                RuleCategory.CONTENT_QUALITY, Severity.MEDIUM);
    }

    @Override
    public List<Issue> evaluate(Article article) {
        List<Finding> findings = new ArrayList<>();
        String content = article.getContent();
        checkLength(wordCount(content), findings);

        if (content != null && !content.isBlank()) {
            checkReadability(content, findings);
            checkGrammar(content, findings);
            checkStructure(content, findings);
            checkFormatting(content, findings);
        }
        return consolidate(findings, 8);
    }

    private void checkLength(int wordCount, List<Finding> findings) {
        if (wordCount < MIN_WORD_COUNT) {
            findings.add(new Finding(Severity.MEDIUM, "Content too short",
                    "Article contains only " + wordCount + " words, which may not provide sufficient detail.",
                    List.of("Expand the content with more detailed explanations",
                            "Add examples and use cases",
                            "Include troubleshooting steps if applicable",
                            "Consider merging with related content")));
        } else if (wordCount > MAX_WORD_COUNT) {
            findings.add(new Finding(Severity.LOW, "Content very lengthy",
                    "Article contains " + wordCount + " words, which may overwhelm readers.",
                    List.of("Consider breaking into multiple articles",
                            "Use headers to improve scanability",
                            "Remove redundant information",
                            "Create a summary or overview section")));
        }
    }

    private void checkReadability(String content, List<Finding> findings) {
        long score = Math.round(readabilityScore(content));
        if (score < MIN_READABILITY) {
            findings.add(new Finding(Severity.HIGH, "Poor readability",
                    "Content has a low readability score (" + score + "), indicating it may be difficult to read.",
                    List.of("Use shorter sentences and simpler words",
                            "Break up long paragraphs",
                            "Add bullet points and lists",
                            "Use active voice instead of passive",
                            "Define technical terms")));
        } else if (score > MAX_READABILITY) {
            findings.add(new Finding(Severity.LOW, "Content may be too simple",
                    "Content has a very high readability score (" + score + "), which might lack necessary detail.",
                    List.of("Add more detailed explanations",
                            "Include technical specifics where appropriate",
                            "Ensure content depth matches user needs",
                            "Consider adding advanced sections")));
        }
    }

    private void checkGrammar(String content, List<Finding> findings) {
        List<String> problems = basicGrammarProblems(content);
        if (!problems.isEmpty()) {
            findings.add(new Finding(Severity.MEDIUM, "Grammar and formatting issues",
                    "Content contains potential grammar or formatting problems: "
                            + String.join("; ", problems.stream().limit(3).toList()) + ".",
                    List.of("Review content for grammar errors",
                            "Check punctuation and capitalization",
                            "Use consistent formatting throughout",
                            "Consider using a grammar checking tool")));
        }

        long longSentences = sentences(content).stream()
                .filter(sentence -> sentence.split("\\s+").length > MAX_SENTENCE_WORDS)
                .count();
        if (longSentences > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Overly long sentences",
                    "Found " + longSentences + " sentences that may be too long for easy reading.",
                    List.of("Break long sentences into shorter ones",
                            "Use conjunctions to separate ideas",
                            "Consider using bullet points for lists",
                            "Aim for 15-20 words per sentence")));
        }
    }

    private void checkStructure(String content, List<Finding> findings) {
        if (headers(content).size() < MIN_HEADER_COUNT) {
            findings.add(new Finding(Severity.MEDIUM, "Poor content structure",
                    "Content lacks proper header structure for easy navigation.",
                    List.of("Add descriptive headers to organize content",
                            "Use H2 and H3 tags for main sections",
                            "Create a logical hierarchy of information",
                            "Consider adding a table of contents for long articles")));
            return;
        }
        if (paragraphs(content).size() < 2) {
            findings.add(new Finding(Severity.HIGH, "Lacks proper structure",
                    "Content appears to be a single block without proper paragraph breaks.",
                    List.of("Break content into logical paragraphs",
                            "Add an introduction paragraph",
                            "Include a conclusion or summary",
                            "Use white space for better readability")));
        }
    }

    private void checkFormatting(String content, List<Finding> findings) {
        if (CODE_CONTENT.matcher(content).find() && !CODE_BLOCK.matcher(content).find()) {
            findings.add(new Finding(Severity.MEDIUM, "Unformatted code content",
                    "Content appears to contain code that is not properly formatted.",
                    List.of("Use code blocks (```) for multi-line code",
                            "Use inline code (`) for short code snippets",
                            "Add syntax highlighting where appropriate",
                            "Ensure code examples are properly indented")));
        }
        if (URL_TEXT.matcher(content).find() && !MARKDOWN_LINK.matcher(content).find()) {
            findings.add(new Finding(Severity.LOW, "Unformatted URLs",
                    "Content contains raw URLs that should be formatted as links.",
                    List.of("Format URLs as proper markdown links",
                            "Use descriptive link text instead of raw URLs",
                            "Ensure all external links work correctly",
                            "Consider using relative links for internal content")));
        }
        if (LIST_CONTENT.matcher(content).find() && !WELL_FORMED_LIST.matcher(content).find()) {
            findings.add(new Finding(Severity.LOW, "Poor list formatting",
                    "Lists in the content may not be properly formatted.",
                    List.of("Use consistent list formatting (- or *)",
                            "Ensure proper spacing after list markers",
                            "Use numbered lists for sequential steps",
                            "Use bullet points for non-sequential items")));
        }
    }
}
