package com.kbhealth.backend.scraping;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Dedup keys for article URLs: lower-cased scheme and host, default port dropped, query and
 * fragment stripped, trailing slash removed.
 */
public final class CanonicalUrls {

    private CanonicalUrls() {
    }

    /**
     * @return the canonical form, or {@code null} when the URL is not an absolute http(s) URL
     */
    public static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }

            int port = uri.getPort();
            boolean defaultPort = port == -1
                    || (scheme.equals("http") && port == 80)
                    || (scheme.equals("https") && port == 443);

            String path = uri.getRawPath();
            if (path == null) {
                path = "";
            }
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }

            StringBuilder canonical = new StringBuilder()
                    .append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
            if (!defaultPort) {
                canonical.append(':').append(port);
            }
            return canonical.append(path).toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Lower-cased host of the URL, or {@code null} when it cannot be parsed.
     */
    public static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
