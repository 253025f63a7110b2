package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fails when a URL property is blank, malformed, or does not answer a GET with a 2xx status
 * within the timeout.
 * <p>
 * Each validation performs a real outbound request and blocks until it completes. One client
 * is shared by all validations of a rule instance.
 */
public final class UrlReachableRule<T> extends PropertyRule<T, String> {

    private static final Logger logger = LoggerFactory.getLogger(UrlReachableRule.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final String CONNECTIVITY_SUGGESTION = "Check URL availability and network connectivity";

    private final Duration timeout;
    private final HttpClient client;

    public UrlReachableRule(PropertyRef<T, String> property, Duration timeout, String customMessage) {
        super(property, customMessage);
        this.timeout = Objects.requireNonNull(timeout, "Timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        String url = valueOf(options);

        if (isBlank(url)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr(propertyName() + " URL is not specified"),
                    url,
                    List.of("Specify a valid URL")));
        }

        Optional<URI> uri = parseAbsolute(url);
        if (uri.isEmpty()) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    "Invalid URL format: " + url,
                    url,
                    List.of("Use format: http://example.com or https://example.com")));
        }

        try {
            int status = get(uri.get());
            if (status < 200 || status > 299) {
                return Optional.of(new ConfigValidationError(
                        key(sectionName),
                        messageOr("URL returned " + status + ": " + url),
                        url,
                        List.of(CONNECTIVITY_SUGGESTION)));
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("URL {} is not reachable", url, e);
            return Optional.of(unreachable(sectionName, url, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of(unreachable(sectionName, url, e));
        }

        return Optional.empty();
    }

    public Duration getTimeout() {
        return timeout;
    }

    private int get(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    private ConfigValidationError unreachable(String sectionName, String url, Exception e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ConfigValidationError(
                key(sectionName),
                messageOr("Failed to reach URL: " + reason),
                url,
                List.of(CONNECTIVITY_SUGGESTION));
    }

    private static Optional<URI> parseAbsolute(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
