package in.candlevault.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-adapter settings.
 *
 * @param requestsPerWindow quota for the rate limiter's rolling window
 * @param maxPagesPerCall   upper bound on provider pages fetched for one task attempt
 */
public record SourceConfig(
    String id,
    boolean enabled,
    String baseUrl,
    String apiKey,
    int requestsPerWindow,
    Duration requestTimeout,
    int maxPagesPerCall
) {
    public SourceConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "SourceConfig[id=" + id + ", enabled=" + enabled + ", baseUrl=" + baseUrl
            + ", apiKey=" + (hasApiKey() ? "***" : "none") + ", requestsPerWindow=" + requestsPerWindow
            + ", requestTimeout=" + requestTimeout + ", maxPagesPerCall=" + maxPagesPerCall + "]";
    }
}
