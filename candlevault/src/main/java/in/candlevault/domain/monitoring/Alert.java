package in.candlevault.domain.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An operational alert raised by the ingestion engine.
 */
public record Alert(
    String alertType,
    AlertLevel level,
    String message,
    Instant timestamp,
    Map<String, Object> details
) {
    public Alert {
        details = Map.copyOf(details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String alertType;
        private AlertLevel level;
        private String message;
        private Instant timestamp = Instant.now();
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Alert build() {
            if (alertType == null || level == null || message == null) {
                throw new IllegalStateException("alertType, level, and message are required");
            }
            return new Alert(alertType, level, message, timestamp, details);
        }
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", level, alertType, message, timestamp);
    }
}
