package com.kbhealth.backend.model.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.util.DigestUtils;

@Entity
@Table(name = "articles",
        indexes = @Index(name = "idx_articles_source", columnList = "sourceId"),
        uniqueConstraints = @UniqueConstraint(name = "uk_articles_source_url", columnNames = {"sourceId", "url"}))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    /**
     * Derived from the owning source and the canonical URL, so a re-fetch of the same page
     * updates the existing row instead of inserting a new one.
     */
    @Id
    @Column(length = 200)
    private String id;

    @Column(nullable = false, length = 100)
    private String sourceId;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(nullable = false, length = 800)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(length = 200)
    private String category;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "article_tags", joinColumns = @JoinColumn(name = "article_id"))
    @Column(name = "tag", length = 100)
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private LocalDateTime lastModifiedAt;

    @Column(length = 200)
    private String author;

    @Column(length = 50)
    private String publicationStatus;

    private Long viewCount;

    private Long helpfulVotes;

    private LocalDateTime lastReviewedAt;

    // Written only by the audit engine
    private Integer contentHealthScore;

    private LocalDateTime lastAuditedAt;

    private LocalDateTime fetchedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static String buildId(String sourceId, String canonicalUrl) {
        String hash = DigestUtils.md5DigestAsHex(canonicalUrl.getBytes(StandardCharsets.UTF_8));
        return sourceId + "-" + hash;
    }
}
