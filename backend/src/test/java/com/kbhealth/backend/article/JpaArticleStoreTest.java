package com.kbhealth.backend.article;

import com.kbhealth.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaArticleStore.class)
class JpaArticleStoreTest {

    private static final LocalDateTime AUDITED_AT = LocalDateTime.of(2026, 9, 30, 10, 0);

    @Autowired
    private JpaArticleStore articleStore;

    @Autowired
    private ArticleRepository articleRepository;

    @Test
    @DisplayName("Re-fetched article replaces content but keeps its audit results")
    void upsertKeepsAuditResults() {
        // given
        articleStore.upsert(article("kb-1", "Old body.").toBuilder()
                .contentHealthScore(70)
                .lastAuditedAt(AUDITED_AT)
                .build());

        // when
        articleStore.upsert(article("kb-1", "New body."));

        // then
        Article stored = articleStore.get("kb-1").orElseThrow();
        assertThat(stored.getContent()).isEqualTo("New body.");
        assertThat(stored.getContentHealthScore()).isEqualTo(70);
        assertThat(stored.getLastAuditedAt()).isEqualTo(AUDITED_AT);
        assertThat(stored.getTags()).containsExactly("payments");
    }

    @Test
    @DisplayName("Articles are listed and counted per source")
    void listsBySource() {
        // given
        articleStore.upsert(article("kb-2", "Second."));
        articleStore.upsert(article("kb-1", "First."));
        articleStore.upsert(article("other-1", "Elsewhere.").toBuilder()
                .sourceId("other")
                .url("https://other.io/articles/1")
                .build());

        // when / then
        assertThat(articleStore.listBySource("kb")).extracting(Article::getId).containsExactly("kb-1", "kb-2");
        assertThat(articleStore.countBySource("kb")).isEqualTo(2);
        assertThat(articleStore.countBySource("nobody")).isZero();
        assertThat(articleStore.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("Two sources may store the same article URL")
    void sameUrlInTwoSources() {
        // given
        String url = "https://help.acme.io/articles/shared";
        Article first = article(Article.buildId("kb", url), "First copy.").toBuilder().url(url).build();
        Article second = first.toBuilder()
                .id(Article.buildId("mirror", url))
                .sourceId("mirror")
                .content("Second copy.")
                .build();

        // when
        articleStore.upsert(first);
        articleStore.upsert(second);
        articleRepository.flush();

        // then
        assertThat(articleStore.countBySource("kb")).isEqualTo(1);
        assertThat(articleStore.countBySource("mirror")).isEqualTo(1);
        assertThat(articleStore.get(Article.buildId("mirror", url)).orElseThrow().getContent()).isEqualTo("Second copy.");
    }

    @Test
    @DisplayName("Score update changes only the audit fields")
    void updateHealthScoreKeepsContent() {
        // given
        articleStore.upsert(article("kb-1", "Synced body."));
        articleRepository.flush();

        // when
        boolean updated = articleStore.updateHealthScore("kb-1", 65, AUDITED_AT);

        // then
        assertThat(updated).isTrue();
        Article stored = articleStore.get("kb-1").orElseThrow();
        assertThat(stored.getContentHealthScore()).isEqualTo(65);
        assertThat(stored.getLastAuditedAt()).isEqualTo(AUDITED_AT);
        assertThat(stored.getContent()).isEqualTo("Synced body.");
        assertThat(stored.getTags()).containsExactly("payments");
        assertThat(articleStore.updateHealthScore("missing", 50, AUDITED_AT)).isFalse();
    }

    private static Article article(String id, String content) {
        return Article.builder()
                .id(id)
                .sourceId("kb")
                .url("https://help.acme.io/articles/" + id)
                .title("Article " + id)
                .content(content)
                .tags(new LinkedHashSet<>(Set.of("payments")))
                .build();
    }
}
