package com.kbhealth.backend.scraping;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlToMarkdownTest {

    private static final String BASE = "https://help.acme.io/articles/1";

    @Test
    @DisplayName("Headings, paragraphs, links and lists become markdown")
    void convertsBlocks() {
        // given
        Document doc = Jsoup.parse("<div><h2>Setup</h2><p>Open <a href=\"/settings\">settings</a> now.</p>"
                + "<ul><li>One</li><li>Two</li></ul><ol><li>First</li><li>Second</li></ol></div>", BASE);

        // when
        String markdown = HtmlToMarkdown.convert(doc.body());

        // then
        assertThat(markdown).startsWith("## Setup\n\n");
        assertThat(markdown).contains("Open [settings](https://help.acme.io/settings) now.");
        assertThat(markdown).contains("- One\n- Two");
        assertThat(markdown).contains("1. First\n2. Second");
    }

    @Test
    @DisplayName("Images keep their alt text and absolute source")
    void convertsImages() {
        // given
        Document doc = Jsoup.parse("<p><img src=\"/img/a.png\" alt=\" Receipt \"><img src=\"b.png\"></p>", BASE);

        // when
        String markdown = HtmlToMarkdown.convert(doc.body());

        // then
        assertThat(markdown).contains("![Receipt](https://help.acme.io/img/a.png)");
        assertThat(markdown).contains("![](https://help.acme.io/articles/b.png)");
    }

    @Test
    @DisplayName("Scripts and navigation are dropped, code is fenced")
    void dropsChromeAndFencesCode() {
        // given
        Document doc = Jsoup.parse("<nav><a href=\"/\">Home</a></nav><script>var x = 1;</script>"
                + "<p>Run <code>sync --all</code> daily.</p><pre>line one\nline two</pre>", BASE);

        // when
        String markdown = HtmlToMarkdown.convert(doc.body());

        // then
        assertThat(markdown).doesNotContain("Home").doesNotContain("var x");
        assertThat(markdown).contains("Run `sync --all` daily.");
        assertThat(markdown).contains("```\nline one\nline two\n```");
    }

    @Test
    @DisplayName("Null element converts to empty text")
    void nullElement() {
        assertThat(HtmlToMarkdown.convert(null)).isEmpty();
    }
}
