package com.kbhealth.backend.scraping;

import lombok.Value;
import org.jsoup.nodes.Document;

@Value
public class FetchedPage {
    String requestedUrl;
    // Location after redirects
    String url;
    int statusCode;
    Document document;
}
