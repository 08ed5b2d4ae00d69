package com.kbhealth.backend.model.entity;

import com.kbhealth.backend.model.enums.Platform;
import com.kbhealth.backend.model.enums.SyncStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * A knowledge-base site the system synchronizes from, together with its live sync status.
 * Instances handed out by the source registry are copies; mutate state through the registry.
 */
@Entity
@Table(name = "data_sources")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DataSource {

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Platform platform = Platform.GENERIC;

    @Column(nullable = false, length = 1024)
    private String baseUrl;

    @Builder.Default
    private boolean enabled = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SyncStatus status = SyncStatus.IDLE;

    private LocalDateTime lastSyncAt;

    @Builder.Default
    private long syncCount = 0;

    @Builder.Default
    private long errorCount = 0;

    @Builder.Default
    private long articlesCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    private Integer maxArticlesPerCategory;

    private Integer syncTimeoutSeconds;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
