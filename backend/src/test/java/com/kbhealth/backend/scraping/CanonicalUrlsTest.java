package com.kbhealth.backend.scraping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalUrlsTest {

    @Test
    @DisplayName("Query, fragment, default port and trailing slash are dropped")
    void canonicalizeStripsNoise() {
        assertThat(CanonicalUrls.canonicalize("HTTPS://Care.StoreHub.com:443/en/articles/12-setup/?utm_source=x#top"))
                .isEqualTo("https://care.storehub.com/en/articles/12-setup");
    }

    @Test
    @DisplayName("Non-default port is kept")
    void canonicalizeKeepsCustomPort() {
        assertThat(CanonicalUrls.canonicalize("http://kb.local:8080/help/"))
                .isEqualTo("http://kb.local:8080/help");
    }

    @Test
    @DisplayName("Relative, non-http and malformed URLs have no canonical form")
    void canonicalizeRejectsInvalid() {
        assertThat(CanonicalUrls.canonicalize("/articles/1")).isNull();
        assertThat(CanonicalUrls.canonicalize("mailto:help@acme.io")).isNull();
        assertThat(CanonicalUrls.canonicalize("https://bad host/x")).isNull();
        assertThat(CanonicalUrls.canonicalize("  ")).isNull();
    }

    @Test
    @DisplayName("Host is extracted lower-cased")
    void hostOf() {
        assertThat(CanonicalUrls.hostOf("https://Help.Acme.io/a")).isEqualTo("help.acme.io");
        assertThat(CanonicalUrls.hostOf("not a url")).isNull();
    }
}
