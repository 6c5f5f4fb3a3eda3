package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.dto.ErrorRecord;

/**
 * Destination for handled error records, e.g. a log shipper.
 */
@FunctionalInterface
public interface ErrorRecordSink {

    void emit(ErrorRecord record);
}
