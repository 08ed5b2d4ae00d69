package com.kbhealth.backend.audit;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceAuditSummary {

    String auditRunId;
    String sourceId;
    int articlesAudited;
    int totalIssues;
    double averageHealthScore;
    List<AuditResult> results;

    // Articles whose audit failed, with the reason
    List<String> failures;
}
