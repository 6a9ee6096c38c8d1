package com.z254.butterfly.drift.notify;

import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.observability.DriftMetrics;
import com.z254.butterfly.drift.observability.DriftStructuredLogger;
import com.z254.butterfly.drift.observability.DriftStructuredLogger.ChangeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fans a committed change out to every configured notifier.
 * A failing notifier never affects the others or the caller.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final List<ChangeNotifier> notifiers;
    private final DriftMetrics metrics;
    private final DriftStructuredLogger structuredLogger;

    @Autowired
    public NotificationDispatcher(ObjectProvider<ChangeNotifier> notifiers,
                                  DriftMetrics metrics,
                                  DriftStructuredLogger structuredLogger) {
        this(notifiers.orderedStream().toList(), metrics, structuredLogger);
    }

    NotificationDispatcher(List<ChangeNotifier> notifiers,
                           DriftMetrics metrics,
                           DriftStructuredLogger structuredLogger) {
        this.notifiers = List.copyOf(notifiers);
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        log.info("Change notifiers configured: {}", notifiers.stream().map(ChangeNotifier::name).toList());
    }

    /**
     * @return number of notifiers that failed
     */
    public int dispatch(Change change) {
        int failures = 0;
        for (ChangeNotifier notifier : notifiers) {
            try {
                notifier.post(change);
            } catch (RuntimeException e) {
                failures++;
                metrics.recordNotificationFailure(notifier.name());
                structuredLogger.logChangeEvent(ChangeEventType.NOTIFICATION_FAILED,
                        "Issue sending notification", Map.of(
                                "notifier", notifier.name(),
                                "file", change.filePath(),
                                "error", String.valueOf(e.getMessage())));
                log.debug("{} notification failure", notifier.name(), e);
            }
        }
        return failures;
    }
}
