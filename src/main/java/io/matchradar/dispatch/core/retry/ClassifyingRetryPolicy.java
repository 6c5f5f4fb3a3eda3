package io.matchradar.dispatch.core.retry;

import io.matchradar.dispatch.core.error.ErrorClassifier;
import io.matchradar.dispatch.core.exception.CircuitOpenException;
import io.matchradar.dispatch.core.exception.ErrorKind;
import org.springframework.retry.RetryContext;
import org.springframework.retry.context.RetryContextSupport;

import java.util.function.Function;

/**
 * Spring Retry policy that looks up the attempt budget by the kind of the last failure.
 * Open circuits and non-retryable errors end the loop immediately.
 */
class ClassifyingRetryPolicy implements org.springframework.retry.RetryPolicy {

    static final String NON_RETRYABLE = "dispatch.retry.non-retryable";

    private final ErrorClassifier classifier;
    private final Function<ErrorKind, RetryPolicy> policyResolver;

    ClassifyingRetryPolicy(ErrorClassifier classifier, Function<ErrorKind, RetryPolicy> policyResolver) {
        this.classifier = classifier;
        this.policyResolver = policyResolver;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return true;
        }
        if (last instanceof CircuitOpenException) {
            return false;
        }
        if (!isRetryable(last)) {
            context.setAttribute(NON_RETRYABLE, Boolean.TRUE);
            return false;
        }
        return context.getRetryCount() < policyResolver.apply(classifier.classify(last)).maxAttempts();
    }

    boolean shouldRetry(Throwable error, int attemptNumber) {
        if (error instanceof CircuitOpenException || !isRetryable(error)) {
            return false;
        }
        return attemptNumber < policyResolver.apply(classifier.classify(error)).maxAttempts();
    }

    private boolean isRetryable(Throwable error) {
        if (!classifier.isRetryable(error)) {
            return false;
        }
        RetryPolicy policy = policyResolver.apply(classifier.classify(error));
        return policy.retryCondition() == null || policy.retryCondition().test(error);
    }

    @Override
    public RetryContext open(RetryContext parent) {
        return new RetryContextSupport(parent);
    }

    @Override
    public void close(RetryContext context) {
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }
}
