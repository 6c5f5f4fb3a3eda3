package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.exception.ErrorKind;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure to an {@link ErrorKind}.
 *
 * <p>Classification order:
 * <ol>
 *   <li>a kind already carried by the failure</li>
 *   <li>well-known network exception types, anywhere in the cause chain</li>
 *   <li>message and name heuristics: navigation, network, scraping, configuration, validation</li>
 *   <li>{@link ErrorKind#SYSTEM}</li>
 * </ol>
 * Navigation and configuration phrases are checked before the generic network and
 * validation words so that {@code "Navigation timeout"} stays SCRAPING and
 * {@code "invalid setting"} stays CONFIGURATION.
 *
 * <p>The result depends only on the failure's content.
 */
@Component
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private static final List<String> NAVIGATION_PATTERNS = List.of(
            "navigation", "page closed", "target closed", "frame was detached");

    private static final List<String> NETWORK_PATTERNS = List.of(
            "econnrefused", "connection refused", "econnreset", "connection reset",
            "enotfound", "host not found", "unknown host", "unknownhost",
            "etimedout", "timed out", "timeout", "socket hang up",
            "network", "fetch", "rate limit", "too many requests", "429");

    private static final List<String> SCRAPING_PATTERNS = List.of(
            "selector", "element not found", "no node found", "xpath", "parse");

    private static final List<String> CONFIGURATION_PATTERNS = List.of(
            "missing variable", "missing environment variable", "invalid setting",
            "missing required setting", "configuration", "config");

    private static final List<String> VALIDATION_PATTERNS = List.of(
            "validation", "invalid", "required field", "schema");

    public ErrorKind classify(Throwable error) {
        ErrorDescription description = ErrorDescription.from(error);
        if (description.kind() != null) {
            return description.kind();
        }
        if (isNetworkType(error)) {
            return ErrorKind.NETWORK;
        }
        return classify(description);
    }

    public ErrorKind classify(ErrorDescription description) {
        if (description.kind() != null) {
            return description.kind();
        }

        String text = (description.message() + " " + description.name()).toLowerCase(Locale.ROOT);

        if (containsAny(text, NAVIGATION_PATTERNS)) return ErrorKind.SCRAPING;
        if (containsAny(text, NETWORK_PATTERNS)) return ErrorKind.NETWORK;
        if (containsAny(text, SCRAPING_PATTERNS)) return ErrorKind.SCRAPING;
        if (containsAny(text, CONFIGURATION_PATTERNS)) return ErrorKind.CONFIGURATION;
        if (containsAny(text, VALIDATION_PATTERNS)) return ErrorKind.VALIDATION;

        return ErrorKind.SYSTEM;
    }

    /**
     * Whether the failure may be retried at all, before any attempt limits.
     */
    public boolean isRetryable(Throwable error) {
        ErrorDescription description = ErrorDescription.from(error);
        if (description.retryableHint() != null) {
            return description.retryableHint();
        }
        return classify(error).isRetryable();
    }

    private boolean isNetworkType(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException
                    || current instanceof SocketTimeoutException
                    || current instanceof SocketException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean containsAny(String text, List<String> patterns) {
        return patterns.stream().anyMatch(text::contains);
    }
}
