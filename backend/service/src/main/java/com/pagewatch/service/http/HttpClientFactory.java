package com.pagewatch.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Shared client for page fetches and annotation calls. Redirects are followed except from
 * https to http; a custom truststore may be supplied through the environment.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        SSLContext sslContext = sslContextFromEnvironment(environment);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        return builder.build();
    }

    private static SSLContext sslContextFromEnvironment(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH);
        if (truststorePath == null || truststorePath.isBlank()) {
            return null;
        }
        String truststorePassword = environment.get(TRUSTSTORE_PASSWORD);
        if (truststorePassword == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(truststorePath);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(truststoreType(path));
            trustStore.load(in, truststorePassword.toCharArray());
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}
