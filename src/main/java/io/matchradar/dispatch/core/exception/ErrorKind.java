package io.matchradar.dispatch.core.exception;

import java.util.Locale;

/**
 * Coarse classification of a scraping failure. Drives the retry policy and the log level
 * a failure is reported with.
 */
public enum ErrorKind {
    NETWORK(true, Severity.HIGH, "Connection, DNS or timeout failure talking to the source"),
    SCRAPING(true, Severity.MEDIUM, "Page structure or navigation failure while extracting data"),
    VALIDATION(false, Severity.MEDIUM, "Extracted or submitted data failed validation"),
    CONFIGURATION(false, Severity.CRITICAL, "Missing or invalid setting"),
    SYSTEM(true, Severity.CRITICAL, "Unclassified failure");

    public enum Severity { MEDIUM, HIGH, CRITICAL }

    private final boolean retryable;
    private final Severity severity;
    private final String description;

    ErrorKind(boolean retryable, Severity severity, String description) {
        this.retryable = retryable;
        this.severity = severity;
        this.description = description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Severity severity() {
        return severity;
    }

    public String description() {
        return description;
    }

    /**
     * Key used for this kind in configuration maps, e.g. {@code dispatch.retry.policies.network}.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
