package com.kbhealth.backend.scraping;

import com.kbhealth.backend.exception.PageFetchException;

/**
 * HTTP client capability used by the fetch pipeline. Implementations enforce their own
 * request timeout and classify every failure as transient or permanent.
 */
public interface PageFetcher {

    FetchedPage fetch(String url) throws PageFetchException;
}
