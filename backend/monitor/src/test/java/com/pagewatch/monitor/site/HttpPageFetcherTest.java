package com.pagewatch.monitor.site;

import com.pagewatch.core.model.ImageDescriptor;
import com.pagewatch.core.model.LinkDescriptor;
import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.monitor.api.FetchErrorKind;
import com.pagewatch.monitor.api.FetchException;
import com.pagewatch.monitor.support.MutableClock;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpPageFetcherTest {
    private static final String PAGE = """
            <html><head><title>Our Companies</title></head>
            <body>
              <nav><a href="/">Home</a></nav>
              <h1>Companies</h1>
              <p>We partner with founders building durable companies.</p>
              <img src="/logos/acme.png" alt="Acme Robotics">
              <a href="https://acme.example">Acme Robotics</a>
            </body></html>
            """;

    private HttpServer server;
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    private final HttpPageFetcher fetcher = new HttpPageFetcher(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
            clock
    );

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void buildsSnapshotFromBodyFacets() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, PAGE));

        PageSnapshot snapshot = fetcher.fetch(url(), Duration.ofSeconds(2));

        assertEquals("Our Companies", snapshot.title());
        assertEquals(List.of("H1:Companies"), snapshot.headings());
        assertEquals(List.of(ImageDescriptor.of("/logos/acme.png", "Acme Robotics")), snapshot.images());
        assertEquals(List.of(new LinkDescriptor("https://acme.example", "Acme Robotics", "")), snapshot.links());
        assertEquals(List.of("Companies", "We partner with founders building durable companies.", "Acme Robotics"),
                snapshot.paragraphs());
        assertEquals(clock.instant(), snapshot.fetchedAt());
    }

    @Test
    void contentHashFollowsPageContent() throws Exception {
        AtomicReference<String> body = new AtomicReference<>(PAGE);
        startServer(exchange -> writeResponse(exchange, 200, body.get()));

        PageSnapshot first = fetcher.fetch(url(), Duration.ofSeconds(2));
        clock.setInstant(Instant.parse("2026-03-01T09:05:00Z"));
        PageSnapshot unchanged = fetcher.fetch(url(), Duration.ofSeconds(2));
        body.set(PAGE.replace("durable", "lasting"));
        PageSnapshot changed = fetcher.fetch(url(), Duration.ofSeconds(2));

        assertEquals(first.contentHash(), unchanged.contentHash());
        assertNotEquals(first.contentHash(), changed.contentHash());
    }

    @Test
    void errorStatusIsRenderFailure() throws Exception {
        startServer(exchange -> writeResponse(exchange, 503, "<html><body>down</body></html>"));

        FetchException error = assertThrows(FetchException.class, () -> fetcher.fetch(url(), Duration.ofSeconds(2)));

        assertEquals(FetchErrorKind.RENDER_FAILURE, error.kind());
        assertEquals("HTTP status 503 from " + url(), error.getMessage());
    }

    @Test
    void pageWithoutBodyIsRenderFailure() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "{\"not\":\"html\"}"));

        FetchException error = assertThrows(FetchException.class, () -> fetcher.fetch(url(), Duration.ofSeconds(2)));

        assertEquals(FetchErrorKind.RENDER_FAILURE, error.kind());
    }

    @Test
    void slowServerIsTimeout() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, PAGE);
        });

        FetchException error = assertThrows(FetchException.class, () -> fetcher.fetch(url(), Duration.ofMillis(200)));

        assertEquals(FetchErrorKind.TIMEOUT, error.kind());
    }

    @Test
    void closedPortIsUnreachable() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        int port = server.getAddress().getPort();
        server.stop(0);
        server = null;

        FetchException error = assertThrows(FetchException.class,
                () -> fetcher.fetch("http://localhost:" + port + "/page", Duration.ofSeconds(1)));

        assertEquals(FetchErrorKind.UNREACHABLE, error.kind());
    }

    private String url() {
        return "http://localhost:" + server.getAddress().getPort() + "/page";
    }

    private void startServer(Handler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/page", exchange -> handler.handle(exchange));
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
