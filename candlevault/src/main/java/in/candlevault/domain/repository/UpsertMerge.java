package in.candlevault.domain.repository;

import in.candlevault.domain.data.DataPoint;

import java.util.Set;
import java.util.TreeSet;

/**
 * Merge rule shared by every {@link DataPointRepository} implementation.
 *
 * <ul>
 *   <li>same values: confirmations are unioned and the higher quality kept</li>
 *   <li>different values: CONFLICT, the stored point is kept whatever the incoming quality</li>
 * </ul>
 * Stored OHLCV values never change once accepted; only validation, quality and
 * confirmations move, and a stored quality score never decreases.
 */
public final class UpsertMerge {

    public record Decision(UpsertResult result, DataPoint point) {
    }

    public static Decision merge(DataPoint existing, DataPoint incoming) {
        if (existing == null) {
            return new Decision(UpsertResult.STORED, incoming);
        }

        if (sameValues(existing, incoming)) {
            Set<String> sources = new TreeSet<>(existing.confirmedBy());
            sources.addAll(incoming.confirmedBy());
            double quality = Math.max(existing.qualityScore(), incoming.qualityScore());
            boolean validated = existing.validated() || incoming.validated();

            if (sources.equals(existing.confirmedBy())
                && quality == existing.qualityScore()
                && validated == existing.validated()) {
                return new Decision(UpsertResult.UNCHANGED, existing);
            }
            DataPoint merged = new DataPoint(existing.symbol(), existing.interval(), existing.timestamp(),
                existing.open(), existing.high(), existing.low(), existing.close(), existing.volume(),
                existing.sourceId(), sources, quality, validated);
            return new Decision(UpsertResult.STORED, merged);
        }

        return new Decision(UpsertResult.CONFLICT, existing);
    }

    public static boolean sameValues(DataPoint a, DataPoint b) {
        return a.open().compareTo(b.open()) == 0
            && a.high().compareTo(b.high()) == 0
            && a.low().compareTo(b.low()) == 0
            && a.close().compareTo(b.close()) == 0
            && a.volume().compareTo(b.volume()) == 0;
    }

    private UpsertMerge() {}
}
