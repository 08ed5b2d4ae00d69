package com.kbhealth.backend.model.dto;

import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.Platform;
import com.kbhealth.backend.model.enums.SyncStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceStatusDTO {
    private String id;
    private String name;
    private Platform platform;
    private String baseUrl;
    private boolean enabled;
    private SyncStatus status;
    private LocalDateTime lastSyncAt;
    private long syncCount;
    private long errorCount;
    private long articlesCount;
    private String lastError;

    public static SourceStatusDTO from(DataSource source) {
        return SourceStatusDTO.builder()
                .id(source.getId())
                .name(source.getName())
                .platform(source.getPlatform())
                .baseUrl(source.getBaseUrl())
                .enabled(source.isEnabled())
                .status(source.getStatus())
                .lastSyncAt(source.getLastSyncAt())
                .syncCount(source.getSyncCount())
                .errorCount(source.getErrorCount())
                .articlesCount(source.getArticlesCount())
                .lastError(source.getLastError())
                .build();
    }
}
