package com.kbhealth.backend.model.entity;

import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An issue recorded by an audit run against one article.
 */
@Entity
@Table(name = "audit_findings", indexes = {
        @Index(name = "idx_audit_findings_run", columnList = "auditRunId"),
        @Index(name = "idx_audit_findings_article", columnList = "articleId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String auditRunId;

    @Column(nullable = false, length = 200)
    private String articleId;

    @Column(length = 800)
    private String articleTitle;

    @Column(length = 2048)
    private String articleUrl;

    @Column(nullable = false, length = 100)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RuleCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Column(nullable = false, length = 500)
    private String message;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(columnDefinition = "TEXT")
    private String suggestion;
}
