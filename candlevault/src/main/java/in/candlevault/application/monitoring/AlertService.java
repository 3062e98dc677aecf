package in.candlevault.application.monitoring;

import in.candlevault.domain.monitoring.Alert;
import in.candlevault.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Alert notification service.
 *
 * Logs every alert at a level matching its severity and forwards it to
 * registered listeners (the monitoring server keeps the recent ones).
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final List<Consumer<Alert>> listeners = new CopyOnWriteArrayList<>();

    public void addListener(Consumer<Alert> listener) {
        listeners.add(listener);
    }

    /**
     * Send alert to configured channels.
     */
    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}", alert.alertType(), alert.message());
            case HIGH -> log.warn("[ALERT-HIGH] {} - {}", alert.alertType(), alert.message());
            case MEDIUM -> log.warn("[ALERT-MEDIUM] {} - {}", alert.alertType(), alert.message());
            case INFO -> log.info("[ALERT-INFO] {} - {}", alert.alertType(), alert.message());
        }

        if (!alert.details().isEmpty()) {
            log.info("[ALERT-DETAILS] {}", alert.details());
        }

        for (Consumer<Alert> listener : listeners) {
            try {
                listener.accept(alert);
            } catch (RuntimeException e) {
                log.error("[AlertService] Listener failed for {}: {}", alert.alertType(), e.getMessage(), e);
            }
        }
    }

    public void sendHighAlert(String alertType, String message) {
        sendAlert(Alert.builder()
            .alertType(alertType)
            .level(AlertLevel.HIGH)
            .message(message)
            .build());
    }

    public void sendMediumAlert(String alertType, String message) {
        sendAlert(Alert.builder()
            .alertType(alertType)
            .level(AlertLevel.MEDIUM)
            .message(message)
            .build());
    }
}
