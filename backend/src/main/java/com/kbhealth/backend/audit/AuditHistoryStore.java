package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.entity.AuditFinding;
import com.kbhealth.backend.model.entity.AuditRun;
import java.util.List;
import java.util.Optional;

/**
 * Durable history of source audits and the findings they recorded.
 */
public interface AuditHistoryStore {

    void saveRun(AuditRun run);

    void saveFindings(List<AuditFinding> findings);

    Optional<AuditRun> findRun(String auditRunId);

    /**
     * Runs of the source, newest first.
     */
    List<AuditRun> listRuns(String sourceId);

    List<AuditFinding> listFindings(String auditRunId);
}
