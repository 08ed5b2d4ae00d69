package com.kbhealth.backend.scraping;

import com.kbhealth.backend.config.ScrapingConfig;
import com.kbhealth.backend.exception.PageFetchException;
import java.io.IOException;
import java.net.MalformedURLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class JsoupPageFetcher implements PageFetcher {

    private final ScrapingConfig scrapingConfig;

    @Override
    public FetchedPage fetch(String url) {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(scrapingConfig.getDefaultHeaders().get("User-Agent"))
                    .timeout(scrapingConfig.getTimeoutMs())
                    .headers(scrapingConfig.getDefaultHeaders())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();

            int status = response.statusCode();
            if (status >= 400) {
                throw PageFetchException.httpStatus(url, status);
            }

            Document doc = response.parse();
            return new FetchedPage(url, response.url().toString(), status, doc);

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw PageFetchException.permanent(url, "Invalid URL " + url + ": " + e.getMessage(), e);
        } catch (UnsupportedMimeTypeException e) {
            throw PageFetchException.permanent(url, "Not an HTML page: " + url + " (" + e.getMimeType() + ")", e);
        } catch (IOException e) {
            log.debug("Transport error fetching {}: {}", url, e.getMessage());
            throw PageFetchException.network(url, e);
        }
    }
}
