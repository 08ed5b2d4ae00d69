package com.kbhealth.backend.model.dto;

import com.kbhealth.backend.model.enums.SyncStatus;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one sync run as reported to callers. {@code status} is {@link SyncStatus#SYNCING}
 * only when a sweep found the source already owned by another run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResultDTO {
    private String sourceId;
    private SyncStatus status;
    private int articlesFound;
    private int articlesUnchanged;
    private int errors;
    @Builder.Default
    private List<String> errorSamples = new ArrayList<>();
    private long durationMs;
    private String message;

    public boolean isSuccess() {
        return status == SyncStatus.SUCCESS;
    }
}
