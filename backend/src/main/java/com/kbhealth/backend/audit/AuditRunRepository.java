package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.entity.AuditRun;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditRunRepository extends JpaRepository<AuditRun, String> {

    List<AuditRun> findBySourceIdOrderByStartedAtDesc(String sourceId);
}
