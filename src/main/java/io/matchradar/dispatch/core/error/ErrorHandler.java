package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.ErrorAlertConfig;
import io.matchradar.dispatch.core.dto.ErrorContext;
import io.matchradar.dispatch.core.dto.ErrorMetricsSnapshot;
import io.matchradar.dispatch.core.dto.ErrorRecord;
import io.matchradar.dispatch.core.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Terminal sink for reported failures.
 *
 * <p>{@link #handle} classifies the failure, records it in the process-wide metrics, emits an
 * {@link ErrorRecord} to the configured sinks (or the log when there are none) and runs the
 * recovery hook registered for its kind. It never throws.
 */
@Service
public class ErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);

    private static final int MAX_STACK_LENGTH = 4000;

    private final ErrorClassifier classifier;
    private final List<ErrorRecordSink> sinks;
    private final ErrorAlertConfig alertConfig;
    private final Clock clock;
    private final ErrorMetrics metrics = new ErrorMetrics();

    private final Map<ErrorKind, RecoveryHook> recoveryHooks = new ConcurrentHashMap<>();
    private final List<AlertCallback> alertCallbacks = new CopyOnWriteArrayList<>();

    @Autowired
    public ErrorHandler(ErrorClassifier classifier,
                        ObjectProvider<ErrorRecordSink> sinks,
                        DispatchConfig dispatchConfig,
                        Clock clock) {
        this(classifier, sinks.orderedStream().toList(), dispatchConfig.errors(), clock);
    }

    public ErrorHandler(ErrorClassifier classifier,
                        List<ErrorRecordSink> sinks,
                        ErrorAlertConfig alertConfig,
                        Clock clock) {
        this.classifier = classifier;
        this.sinks = List.copyOf(sinks);
        this.alertConfig = alertConfig;
        this.clock = clock;
    }

    public void handle(Throwable error, ErrorContext context) {
        try {
            ErrorRecord record = toRecord(error, context);
            long hourlyCount = metrics.recordError(record.kind(), record.timestamp());

            emit(record);
            runRecoveryHook(record);
            checkAlertThreshold(record.kind(), hourlyCount);
        } catch (RuntimeException e) {
            logger.error("Failed to handle error from {}: {}", context, e.getMessage(), e);
        }
    }

    /**
     * Counts a failed attempt that is about to be retried. Not logged above debug.
     */
    public void recordAttemptFailure(ErrorKind kind, Throwable error) {
        metrics.recordError(kind, clock.instant());
        logger.debug("Attempt failed ({}): {}", kind, error.getMessage());
    }

    public void recordRetryAttempt(long delayMs) {
        metrics.recordRetryAttempt(delayMs);
    }

    public void recordRetrySuccess() {
        metrics.recordRetrySuccess();
    }

    public void recordRetryFailure() {
        metrics.recordRetryFailure();
    }

    public ErrorMetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
        logger.info("Error metrics reset");
    }

    public void registerRecoveryHook(ErrorKind kind, RecoveryHook hook) {
        recoveryHooks.put(kind, hook);
    }

    public void registerAlertCallback(AlertCallback callback) {
        alertCallbacks.add(callback);
    }

    private ErrorRecord toRecord(Throwable error, ErrorContext context) {
        ErrorKind kind = classifier.classify(error);
        return new ErrorRecord(
                kind,
                error != null ? String.valueOf(error.getMessage()) : "unknown error",
                context != null ? context : ErrorContext.of("unknown", "unknown"),
                clock.instant(),
                error != null && classifier.isRetryable(error),
                error != null ? error.getClass().getName() : "",
                stackTraceOf(error)
        );
    }

    private void emit(ErrorRecord record) {
        if (sinks.isEmpty()) {
            logFallback(record);
            return;
        }

        for (ErrorRecordSink sink : sinks) {
            try {
                sink.emit(record);
            } catch (RuntimeException e) {
                logger.warn("Error sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage());
                logFallback(record);
            }
        }
    }

    private void logFallback(ErrorRecord record) {
        String format = "kind={} component={} operation={} retryable={} timestamp={} message=\"{}\" metadata={}";
        Object[] args = {
                record.kind(), record.context().component(), record.context().operation(),
                record.retryable(), record.timestamp(), record.message(), record.context().metadata()
        };

        switch (record.kind().severity()) {
            case CRITICAL -> logger.error(format, args);
            case HIGH, MEDIUM -> logger.warn(format, args);
        }
    }

    private void runRecoveryHook(ErrorRecord record) {
        RecoveryHook hook = recoveryHooks.get(record.kind());
        if (hook == null) {
            return;
        }

        try {
            hook.recover(record);
        } catch (Exception e) {
            logger.warn("Recovery hook for {} failed: {}", record.kind(), e.getMessage());
        }
    }

    private void checkAlertThreshold(ErrorKind kind, long hourlyCount) {
        int threshold = alertConfig.thresholdFor(kind.configKey());
        if (hourlyCount != threshold) {
            return;
        }

        var alert = new AlertCallback.Alert(kind, hourlyCount, threshold, kind.severity(), clock.instant());
        logger.error("Error threshold breached for {}: {} errors this hour (threshold {}, severity {})",
                kind, hourlyCount, threshold, kind.severity());

        for (AlertCallback callback : alertCallbacks) {
            try {
                callback.onAlert(alert);
            } catch (RuntimeException e) {
                logger.error("Alert callback failed for {}: {}", kind, e.getMessage());
            }
        }
    }

    private static String stackTraceOf(Throwable error) {
        if (error == null) {
            return "";
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        String trace = writer.toString();
        return trace.length() > MAX_STACK_LENGTH ? trace.substring(0, MAX_STACK_LENGTH) : trace;
    }
}
