package com.pagewatch.monitor.api;

import com.pagewatch.core.model.PageSnapshot;

import java.time.Duration;

public interface PageFetcher {
    /**
     * Retrieves the page and reduces it to a snapshot. Blocks the calling thread and responds to interruption.
     */
    PageSnapshot fetch(String url, Duration timeout) throws FetchException, InterruptedException;
}
