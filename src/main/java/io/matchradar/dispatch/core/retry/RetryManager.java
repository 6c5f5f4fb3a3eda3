package io.matchradar.dispatch.core.retry;

import io.matchradar.dispatch.core.ScrapeOperation;
import io.matchradar.dispatch.core.breaker.CircuitBreaker;
import io.matchradar.dispatch.core.breaker.CircuitBreakerRegistry;
import io.matchradar.dispatch.core.error.ErrorClassifier;
import io.matchradar.dispatch.core.error.ErrorHandler;
import io.matchradar.dispatch.core.exception.CircuitOpenException;
import io.matchradar.dispatch.core.exception.DispatchException;
import io.matchradar.dispatch.core.exception.ErrorKind;
import io.matchradar.dispatch.core.exception.RetryExhaustedException;
import io.matchradar.dispatch.core.exception.ScrapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

/**
 * Runs scrape operations through the circuit breaker of their operation name and retries
 * failures with exponential back-off. Attempt budgets come from the failure's {@link ErrorKind}
 * unless an explicit {@link RetryPolicy} is given.
 */
@Service
public class RetryManager {

    private static final Logger logger = LoggerFactory.getLogger(RetryManager.class);

    static final String DEFAULT_OPERATION = "operation";

    private final ErrorClassifier classifier;
    private final CircuitBreakerRegistry breakers;
    private final ErrorHandler errorHandler;
    private final RetryPolicies policies;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;

    @Autowired
    public RetryManager(ErrorClassifier classifier,
                        CircuitBreakerRegistry breakers,
                        ErrorHandler errorHandler,
                        RetryPolicies policies,
                        Sleeper sleeper) {
        this(classifier, breakers, errorHandler, policies, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryManager(ErrorClassifier classifier,
                 CircuitBreakerRegistry breakers,
                 ErrorHandler errorHandler,
                 RetryPolicies policies,
                 Sleeper sleeper,
                 DoubleSupplier jitterSource) {
        this.classifier = classifier;
        this.breakers = breakers;
        this.errorHandler = errorHandler;
        this.policies = policies;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public <T> T retry(String operationName, ScrapeOperation<T> operation) {
        return execute(operationName, operation, policies::policyFor);
    }

    public <T> T retry(String operationName, ScrapeOperation<T> operation, RetryPolicy policy) {
        return execute(operationName, operation, kind -> policy);
    }

    public <T> T retry(ScrapeOperation<T> operation, RetryPolicy policy) {
        return retry(DEFAULT_OPERATION, operation, policy);
    }

    /**
     * Whether a failure on the given 1-based attempt earns another attempt under the default policies.
     */
    public boolean shouldRetry(Throwable error, int attemptNumber) {
        return new ClassifyingRetryPolicy(classifier, policies::policyFor).shouldRetry(error, attemptNumber);
    }

    public boolean shouldRetry(Throwable error, int attemptNumber, RetryPolicy policy) {
        return new ClassifyingRetryPolicy(classifier, kind -> policy).shouldRetry(error, attemptNumber);
    }

    /**
     * Delay that would precede the attempt after the given failed one.
     */
    public long computeDelay(Throwable error, int failedAttempt) {
        return backOffPolicy(policies::policyFor).delayFor(error, failedAttempt);
    }

    private <T> T execute(String operationName, ScrapeOperation<T> operation,
                          Function<ErrorKind, RetryPolicy> resolver) {
        CircuitBreaker breaker = breakers.circuitBreaker(operationName);
        AtomicInteger attempts = new AtomicInteger();

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new ClassifyingRetryPolicy(classifier, resolver));
        template.setBackOffPolicy(backOffPolicy(resolver));

        RetryCallback<T, Exception> callback = context -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                Throwable last = context.getLastThrowable();
                errorHandler.recordAttemptFailure(classifier.classify(last), last);
                logger.debug("Retrying {}, attempt {}", operationName, attempt);
            }
            return breaker.execute(operation);
        };
        RecoveryCallback<T> recovery = context -> {
            throw failureOf(operationName, context);
        };

        try {
            T result = template.execute(callback, recovery);
            if (attempts.get() > 1) {
                errorHandler.recordRetrySuccess();
                logger.info("{} succeeded after {} attempts", operationName, attempts.get());
            }
            return result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ScrapeException(operationName + " failed", e, classifier.classify(e));
        }
    }

    private JitteredBackOffPolicy backOffPolicy(Function<ErrorKind, RetryPolicy> resolver) {
        return new JitteredBackOffPolicy(classifier, resolver, sleeper, jitterSource, errorHandler::recordRetryAttempt);
    }

    private RuntimeException failureOf(String operationName, RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last instanceof CircuitOpenException open) {
            logger.debug("{} rejected by open circuit {}", operationName, open.getBreakerName());
            return open;
        }
        ErrorKind kind = classifier.classify(last);
        int attempts = context.getRetryCount();
        if (Boolean.TRUE.equals(context.getAttribute(ClassifyingRetryPolicy.NON_RETRYABLE))) {
            logger.warn("{} failed with non-retryable {} error on attempt {}: {}",
                    operationName, kind, attempts, last.getMessage());
            return last instanceof DispatchException dispatch
                    ? dispatch
                    : new ScrapeException(last.getMessage(), last, kind, Boolean.FALSE, null);
        }
        errorHandler.recordRetryFailure();
        logger.error("{} failed after {} attempts: {}", operationName, attempts, last.getMessage());
        return new RetryExhaustedException(operationName, attempts, kind, last);
    }
}
