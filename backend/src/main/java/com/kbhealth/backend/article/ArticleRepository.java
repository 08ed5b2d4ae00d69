package com.kbhealth.backend.article;

import com.kbhealth.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ArticleRepository extends JpaRepository<Article, String> {

    List<Article> findBySourceIdOrderByIdAsc(String sourceId);

    long countBySourceId(String sourceId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Article a SET a.contentHealthScore = :score, a.lastAuditedAt = :auditedAt WHERE a.id = :id")
    int updateHealthScore(@Param("id") String id, @Param("score") int score, @Param("auditedAt") LocalDateTime auditedAt);
}
