package com.kbhealth.backend.scraping;

import com.kbhealth.backend.model.entity.Article;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One item emitted by a fetch run: an article to upsert, an article skipped as unchanged, or
 * a failure tagged with the URL that was attempted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome {

    public enum Kind {
        FETCHED,
        UNCHANGED,
        FAILED
    }

    Kind kind;
    String url;
    Article article;
    String errorMessage;
    Integer statusCode;
    boolean transientFailure;

    public static FetchOutcome fetched(Article article) {
        return new FetchOutcome(Kind.FETCHED, article.getUrl(), article, null, null, false);
    }

    public static FetchOutcome unchanged(String url) {
        return new FetchOutcome(Kind.UNCHANGED, url, null, null, null, false);
    }

    public static FetchOutcome failed(String url, String errorMessage, Integer statusCode, boolean transientFailure) {
        return new FetchOutcome(Kind.FAILED, url, null, errorMessage, statusCode, transientFailure);
    }

    public boolean isFetched() {
        return kind == Kind.FETCHED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
