package com.kbhealth.backend.article;

import com.kbhealth.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class JpaArticleStore implements ArticleStore {

    private final ArticleRepository articleRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Article> get(String articleId) {
        return articleRepository.findById(articleId);
    }

    @Override
    public void upsert(Article article) {
        Optional<Article> existing = articleRepository.findById(article.getId());
        if (existing.isEmpty()) {
            articleRepository.save(article);
            log.debug("Inserted article {}", article.getId());
            return;
        }

        Article stored = existing.get();
        stored.setSourceId(article.getSourceId());
        stored.setUrl(article.getUrl());
        stored.setTitle(article.getTitle());
        stored.setContent(article.getContent());
        stored.setSummary(article.getSummary());
        stored.setCategory(article.getCategory());
        stored.setTags(article.getTags() != null ? new LinkedHashSet<>(article.getTags()) : new LinkedHashSet<>());
        stored.setLastModifiedAt(article.getLastModifiedAt());
        stored.setAuthor(article.getAuthor());
        stored.setPublicationStatus(article.getPublicationStatus());
        stored.setViewCount(article.getViewCount());
        stored.setHelpfulVotes(article.getHelpfulVotes());
        stored.setLastReviewedAt(article.getLastReviewedAt());
        stored.setFetchedAt(article.getFetchedAt() != null ? article.getFetchedAt() : stored.getFetchedAt());
        if (article.getContentHealthScore() != null) {
            stored.setContentHealthScore(article.getContentHealthScore());
        }
        if (article.getLastAuditedAt() != null) {
            stored.setLastAuditedAt(article.getLastAuditedAt());
        }
        articleRepository.save(stored);
        log.debug("Updated article {}", article.getId());
    }

    @Override
    public boolean updateHealthScore(String articleId, int score, LocalDateTime auditedAt) {
        return articleRepository.updateHealthScore(articleId, score, auditedAt) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Article> listBySource(String sourceId) {
        return articleRepository.findBySourceIdOrderByIdAsc(sourceId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countBySource(String sourceId) {
        return articleRepository.countBySourceId(sourceId);
    }
}
