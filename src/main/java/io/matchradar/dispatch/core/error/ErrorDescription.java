package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.exception.ClassifiedError;
import io.matchradar.dispatch.core.exception.ErrorKind;

/**
 * The observable content of a failure that classification looks at.
 *
 * @param name          simple class name of the failure
 * @param message       failure message, never {@code null}
 * @param kind          kind the failure already carries, or {@code null}
 * @param retryableHint explicit retry verdict carried by the failure, or {@code null}
 */
public record ErrorDescription(
        String name,
        String message,
        ErrorKind kind,
        Boolean retryableHint
) {
    public ErrorDescription {
        if (name == null) name = "";
        if (message == null) message = "";
    }

    public static ErrorDescription of(String name, String message) {
        return new ErrorDescription(name, message, null, null);
    }

    public static ErrorDescription from(Throwable error) {
        if (error == null) {
            return of("", "");
        }
        if (error instanceof ClassifiedError classified) {
            return new ErrorDescription(error.getClass().getSimpleName(), error.getMessage(),
                    classified.errorKind(), classified.retryableHint());
        }
        return of(error.getClass().getSimpleName(), error.getMessage());
    }
}
