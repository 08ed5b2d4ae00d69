package com.kbhealth.backend.audit;

import lombok.Value;

/**
 * One-based line and column inside an article's markdown content.
 */
@Value
public class IssueLocation {

    int line;
    int column;

    /**
     * Position of the character at {@code offset} in {@code content}.
     */
    public static IssueLocation of(String content, int offset) {
        int line = 1;
        int lineStart = 0;
        int end = Math.min(offset, content.length());
        for (int i = 0; i < end; i++) {
            if (content.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new IssueLocation(line, end - lineStart + 1);
    }
}
