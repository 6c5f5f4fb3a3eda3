package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.dto.ErrorRecord;

/**
 * Best-effort reaction to a handled error of one kind, such as rotating the user agent after
 * network failures. Failures of the hook are logged and dropped.
 */
@FunctionalInterface
public interface RecoveryHook {

    void recover(ErrorRecord record) throws Exception;
}
