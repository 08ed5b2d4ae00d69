package com.kbhealth.backend.article;

import com.kbhealth.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence capability for articles, consumed by the sync orchestrator and the audit engine.
 */
public interface ArticleStore {

    Optional<Article> get(String articleId);

    /**
     * Inserts the article or replaces the stored one with the same id. A {@code null}
     * health score or audit timestamp on the incoming article keeps the stored value, so a
     * re-fetch never erases audit results.
     */
    void upsert(Article article);

    /**
     * Sets only the health score and audit time of a stored article; content written by a
     * concurrent sync is left as is.
     *
     * @return false when no article has this id
     */
    boolean updateHealthScore(String articleId, int score, LocalDateTime auditedAt);

    List<Article> listBySource(String sourceId);

    long countBySource(String sourceId);
}
