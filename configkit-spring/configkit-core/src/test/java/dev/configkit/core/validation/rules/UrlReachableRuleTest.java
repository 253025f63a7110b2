package dev.configkit.core.validation.rules;

import com.sun.net.httpserver.HttpServer;
import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link UrlReachableRule} against a local HTTP server.
 */
class UrlReachableRuleTest {

    record Endpoint(String baseUrl) {
    }

    private static final PropertyRef<Endpoint, String> BASE_URL = PropertyRef.of("BaseUrl", Endpoint::baseUrl);

    private HttpServer server;
    private ExecutorService handlers;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/health", exchange -> {
            byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/broken", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        handlers = Executors.newCachedThreadPool();
        server.setExecutor(handlers);
        server.start();
        baseUrl = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        handlers.shutdownNow();
    }

    private UrlReachableRule<Endpoint> rule() {
        return new UrlReachableRule<>(BASE_URL, Duration.ofSeconds(2), null);
    }

    @Test
    @DisplayName("Should pass when the URL answers with 2xx")
    void shouldPassForSuccess() {
        assertThat(rule().validate(new Endpoint(baseUrl + "/health"), "ExternalApi")).isEmpty();
    }

    @Test
    @DisplayName("Should report the status code for non-success responses")
    void shouldReportStatusCode() {
        String url = baseUrl + "/broken";

        ConfigValidationError error = rule().validate(new Endpoint(url), "ExternalApi").orElseThrow();

        assertThat(error.message()).isEqualTo("URL returned 503: " + url);
        assertThat(error.suggestions()).containsExactly("Check URL availability and network connectivity");
    }

    @Test
    @DisplayName("Should convert connection failures into an error")
    void shouldReportConnectionFailure() throws IOException {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }

        ConfigValidationError error = rule()
                .validate(new Endpoint("http://127.0.0.1:" + closedPort + "/"), "ExternalApi")
                .orElseThrow();

        assertThat(error.message()).startsWith("Failed to reach URL:");
        assertThat(error.suggestions()).containsExactly("Check URL availability and network connectivity");
    }

    @Test
    @DisplayName("Should fail when the server answers after the timeout")
    void shouldReportTimeout() {
        UrlReachableRule<Endpoint> rule = new UrlReachableRule<>(BASE_URL, Duration.ofMillis(300), null);

        ConfigValidationError error = rule.validate(new Endpoint(baseUrl + "/slow"), "ExternalApi").orElseThrow();

        assertThat(error.message()).startsWith("Failed to reach URL:");
        assertThat(error.currentValue()).isEqualTo(baseUrl + "/slow");
        assertThat(error.suggestions()).containsExactly("Check URL availability and network connectivity");
    }

    @Test
    @DisplayName("Should reuse one HTTP client across repeated validations")
    void shouldReuseClient() {
        UrlReachableRule<Endpoint> rule = rule();
        Endpoint endpoint = new Endpoint(baseUrl + "/health");
        long selectorsBefore = selectorThreads();

        for (int i = 0; i < 20; i++) {
            assertThat(rule.validate(endpoint, "ExternalApi")).isEmpty();
        }

        assertThat(selectorThreads()).isLessThanOrEqualTo(selectorsBefore);
    }

    private static long selectorThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(thread -> thread.getName().startsWith("HttpClient-")
                        && thread.getName().endsWith("-SelectorManager"))
                .count();
    }

    @Test
    @DisplayName("Should report a blank URL as not specified")
    void shouldReportBlankUrl() {
        ConfigValidationError error = rule().validate(new Endpoint(" "), "ExternalApi").orElseThrow();

        assertThat(error.key()).isEqualTo("ExternalApi:BaseUrl");
        assertThat(error.message()).isEqualTo("BaseUrl URL is not specified");
    }

    @ParameterizedTest
    @ValueSource(strings = {"not a url", "/relative/path", "ftp://example.com/file", "http://"})
    @DisplayName("Should report malformed or non-HTTP URLs as invalid format")
    void shouldReportInvalidFormat(String url) {
        ConfigValidationError error = rule().validate(new Endpoint(url), "ExternalApi").orElseThrow();

        assertThat(error.message()).isEqualTo("Invalid URL format: " + url);
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> new UrlReachableRule<>(BASE_URL, Duration.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new UrlReachableRule<>(BASE_URL, UrlReachableRule.DEFAULT_TIMEOUT, null).getTimeout())
                .isEqualTo(Duration.ofSeconds(5));
    }
}
