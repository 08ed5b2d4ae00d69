package com.kbhealth.backend.source;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * How a sync run ended, as applied to the registry by {@link SourceRegistry#completeSync}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SyncOutcome {

    public enum Kind {
        SUCCESS,
        ERROR,
        CANCELLED
    }

    Kind kind;
    // Articles owned by the source after the run; ignored for errors
    long articlesCount;
    String errorMessage;

    public static SyncOutcome success(long articlesCount) {
        return new SyncOutcome(Kind.SUCCESS, articlesCount, null);
    }

    public static SyncOutcome error(String errorMessage) {
        return new SyncOutcome(Kind.ERROR, 0, errorMessage);
    }

    public static SyncOutcome cancelled(long articlesCount) {
        return new SyncOutcome(Kind.CANCELLED, articlesCount, null);
    }
}
