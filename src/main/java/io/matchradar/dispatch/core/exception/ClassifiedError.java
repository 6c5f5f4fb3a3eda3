package io.matchradar.dispatch.core.exception;

/**
 * Implemented by failures that already know their {@link ErrorKind}; the classifier
 * returns the carried kind unchanged.
 */
public interface ClassifiedError {

    ErrorKind errorKind();

    /**
     * @return {@code Boolean.FALSE} when the failure must never be retried,
     * {@code null} when the kind decides
     */
    default Boolean retryableHint() {
        return null;
    }
}
