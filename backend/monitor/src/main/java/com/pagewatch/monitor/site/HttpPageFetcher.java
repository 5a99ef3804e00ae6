package com.pagewatch.monitor.site;

import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.core.util.HtmlUtils;
import com.pagewatch.monitor.api.FetchErrorKind;
import com.pagewatch.monitor.api.FetchException;
import com.pagewatch.monitor.api.PageFetcher;

import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plain GET plus regex extraction. Pages that need script execution are out of reach.
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpPageFetcher.class.getName());
    private static final String USER_AGENT = "PageWatch/0.1";

    private final HttpClient httpClient;
    private final Clock clock;

    public HttpPageFetcher(HttpClient httpClient, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public PageSnapshot fetch(String url, Duration timeout) throws FetchException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.UNREACHABLE, "Invalid URL " + url + ": " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw classify(url, e);
        }

        if (response.statusCode() >= 400) {
            throw new FetchException(FetchErrorKind.RENDER_FAILURE,
                    "HTTP status " + response.statusCode() + " from " + url);
        }
        String html = response.body() == null ? "" : response.body();
        String body = HtmlUtils.extractBody(html).orElseThrow(() ->
                new FetchException(FetchErrorKind.RENDER_FAILURE, "No document body in response from " + url));

        PageSnapshot snapshot = PageSnapshot.of(
                url,
                HtmlUtils.extractTitle(html).orElse(""),
                HtmlUtils.extractParagraphs(body),
                HtmlUtils.extractImages(body),
                HtmlUtils.extractLinks(body),
                HtmlUtils.extractHeadings(body),
                clock.instant()
        );
        LOGGER.fine(() -> "Fetched " + url + ": " + snapshot.paragraphs().size() + " paragraphs, "
                + snapshot.images().size() + " images, " + snapshot.links().size() + " links");
        return snapshot;
    }

    private static FetchException classify(String url, IOException error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (error instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return new FetchException(FetchErrorKind.TIMEOUT, "Request timed out while fetching " + url, error);
        }
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("not known")
                || lowered.contains("nodename")) {
            return new FetchException(FetchErrorKind.UNREACHABLE,
                    "DNS/unknown host while fetching " + url + ": " + rootText, error);
        }
        return new FetchException(FetchErrorKind.UNREACHABLE, "Fetch failure for " + url + ": " + rootText, error);
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
