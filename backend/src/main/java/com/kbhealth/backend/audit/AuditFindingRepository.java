package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.entity.AuditFinding;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditFindingRepository extends JpaRepository<AuditFinding, Long> {

    List<AuditFinding> findByAuditRunIdOrderByIdAsc(String auditRunId);

    long countByAuditRunId(String auditRunId);
}
