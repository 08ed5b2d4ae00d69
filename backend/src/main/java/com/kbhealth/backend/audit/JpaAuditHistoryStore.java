package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.entity.AuditFinding;
import com.kbhealth.backend.model.entity.AuditRun;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional
public class JpaAuditHistoryStore implements AuditHistoryStore {

    private final AuditRunRepository auditRunRepository;
    private final AuditFindingRepository auditFindingRepository;

    @Override
    public void saveRun(AuditRun run) {
        auditRunRepository.save(run);
    }

    @Override
    public void saveFindings(List<AuditFinding> findings) {
        if (!findings.isEmpty()) {
            auditFindingRepository.saveAll(findings);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuditRun> findRun(String auditRunId) {
        return auditRunRepository.findById(auditRunId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditRun> listRuns(String sourceId) {
        return auditRunRepository.findBySourceIdOrderByStartedAtDesc(sourceId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditFinding> listFindings(String auditRunId) {
        return auditFindingRepository.findByAuditRunIdOrderByIdAsc(auditRunId);
    }
}
