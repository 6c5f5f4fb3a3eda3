package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.exception.ErrorKind;
import io.matchradar.dispatch.core.exception.RetryExhaustedException;
import io.matchradar.dispatch.core.exception.ScrapeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void shouldClassifyConnectionRefusedAsNetwork() {
        assertThat(classifier.classify(new RuntimeException("ECONNREFUSED"))).isEqualTo(ErrorKind.NETWORK);
    }

    @Test
    void shouldClassifyMissingSelectorAsScraping() {
        assertThat(classifier.classify(new RuntimeException("selector not found"))).isEqualTo(ErrorKind.SCRAPING);
    }

    @Test
    void shouldFallBackToSystemWhenNothingMatches() {
        assertThat(classifier.classify(new RuntimeException("unexpected"))).isEqualTo(ErrorKind.SYSTEM);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Navigation timeout of 30000 ms exceeded | SCRAPING",
            "net::ERR_CONNECTION_RESET connection reset by peer | NETWORK",
            "getaddrinfo ENOTFOUND www.flashscore.com | NETWORK",
            "429 Too Many Requests | NETWORK",
            "Failed to parse match row | SCRAPING",
            "invalid setting: scraper.base-url | CONFIGURATION",
            "Missing environment variable DATABASE_URL | CONFIGURATION",
            "invalid match score | VALIDATION",
            "Validation failed for fixture 42 | VALIDATION"
    })
    void shouldPreferSpecificPhrasesOverGenericOnes(String message, ErrorKind expected) {
        assertThat(classifier.classify(ErrorDescription.of("Error", message))).isEqualTo(expected);
    }

    @Test
    void shouldClassifyNetworkExceptionTypesAnywhereInCauseChain() {
        RuntimeException wrapped = new RuntimeException("boom", new ConnectException("refused"));

        assertThat(classifier.classify(wrapped)).isEqualTo(ErrorKind.NETWORK);
    }

    @Test
    void shouldTrustKindCarriedByTheError() {
        ScrapeException tagged = new ScrapeException("connection refused while validating", ErrorKind.VALIDATION);

        assertThat(classifier.classify(tagged)).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    void shouldBeDeterministic() {
        RuntimeException error = new RuntimeException("Timeout waiting for selector .event__match");

        ErrorKind first = classifier.classify(error);
        ErrorKind second = classifier.classify(error);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void shouldLetRetryableHintOverrideKindDefault() {
        assertThat(classifier.isRetryable(ScrapeException.nonRetryable("ECONNREFUSED", ErrorKind.NETWORK))).isFalse();
        assertThat(classifier.isRetryable(ScrapeException.rateLimited("slow down", Duration.ofSeconds(5)))).isTrue();
        assertThat(classifier.isRetryable(new ScrapeException("bad row", null, ErrorKind.VALIDATION, Boolean.TRUE, null)))
                .isTrue();
    }

    @Test
    void shouldNotRetryValidationOrExhaustedErrors() {
        assertThat(classifier.isRetryable(new RuntimeException("invalid match score"))).isFalse();
        assertThat(classifier.isRetryable(
                new RetryExhaustedException("scrape:live-match", 3, ErrorKind.NETWORK, new RuntimeException("x"))))
                .isFalse();
        assertThat(classifier.isRetryable(new RuntimeException("ECONNRESET"))).isTrue();
    }
}
