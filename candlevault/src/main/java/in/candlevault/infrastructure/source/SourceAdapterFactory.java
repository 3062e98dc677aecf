package in.candlevault.infrastructure.source;

import in.candlevault.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Creates source adapters from configuration.
 *
 * Usage:
 * <pre>
 * List&lt;SourceAdapter&gt; adapters = SourceAdapterFactory.createAll(config.getEnabledSources());
 * </pre>
 */
public final class SourceAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(SourceAdapterFactory.class);

    public static final Set<String> SUPPORTED = Set.of(BinanceSourceAdapter.ID, BybitSourceAdapter.ID);

    private SourceAdapterFactory() {}

    public static boolean isSupported(String sourceId) {
        return SUPPORTED.contains(sourceId);
    }

    /**
     * @throws IllegalArgumentException for an unknown source id
     */
    public static SourceAdapter create(SourceConfig config) {
        ProviderHttpClient http = new ProviderHttpClient(config.requestTimeout());
        return switch (config.id()) {
            case BinanceSourceAdapter.ID -> new BinanceSourceAdapter(config, http);
            case BybitSourceAdapter.ID -> new BybitSourceAdapter(config, http);
            default -> throw new IllegalArgumentException("Unknown source: " + config.id());
        };
    }

    /**
     * Adapters for the given sources, in the given order.
     */
    public static List<SourceAdapter> createAll(List<SourceConfig> configs) {
        List<SourceAdapter> adapters = new ArrayList<>();
        for (SourceConfig config : configs) {
            adapters.add(create(config));
            log.info("[SourceFactory] {} -> {} ({} req/window, API key {})", config.id(), config.baseUrl(),
                config.requestsPerWindow(), config.hasApiKey() ? "configured" : "missing");
        }
        return adapters;
    }
}
