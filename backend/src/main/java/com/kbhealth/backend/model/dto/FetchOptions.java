package com.kbhealth.backend.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class FetchOptions {

    // Null falls back to the source setting, then to sync.default-max-articles-per-category
    Integer maxArticlesPerCategory;

    // Re-fetch and upsert articles even when their modification time is unchanged
    boolean forceRefresh;

    public static FetchOptions defaults() {
        return FetchOptions.builder().build();
    }
}
