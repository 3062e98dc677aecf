package in.candlevault.service.validation;

import in.candlevault.config.IngestionConfig;
import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskOrigin;
import in.candlevault.domain.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates a fetched batch before anything from it is persisted.
 *
 * The whole batch is rejected when any point:
 * - breaks strict timestamp order or is off the interval grid
 * - has a negative price or volume
 * - violates high >= max(open, close, low) or low <= min(open, close, high)
 * - differs beyond tolerance from an already stored point
 *
 * Same-source duplicates compare OHLC and volume; cross-source duplicates
 * compare OHLC only. A cross-source match keeps the stored values and raises
 * quality to {@code q + (1 - q) * confirmationBoost}. During reconciliation a
 * cross-source mismatch skips that point instead of rejecting the batch.
 */
public class DataValidator {
    private static final Logger log = LoggerFactory.getLogger(DataValidator.class);

    private final double tolerance;
    private final double baseQuality;
    private final double confirmationBoost;

    public DataValidator(double tolerance, double baseQuality, double confirmationBoost) {
        this.tolerance = tolerance;
        this.baseQuality = baseQuality;
        this.confirmationBoost = confirmationBoost;
    }

    public static DataValidator fromConfig(IngestionConfig config) {
        return new DataValidator(config.getValidationTolerance(), config.getBaseQuality(),
            config.getConfirmationBoost());
    }

    /**
     * @param existing stored points in the task range, keyed by timestamp
     * @throws ValidationException if the batch is rejected
     */
    public ValidationResult validate(FetchTask task, String sourceId, List<RawPoint> batch,
                                     Map<Instant, DataPoint> existing) {
        SeriesKey series = task.series();
        List<String> violations = checkStructure(series.interval(), batch);
        if (!violations.isEmpty()) {
            throw new ValidationException(sourceId, violations);
        }

        List<DataPoint> toStore = new ArrayList<>();
        int newPoints = 0;
        int confirmations = 0;
        int unchanged = 0;
        int disputed = 0;

        for (RawPoint raw : batch) {
            DataPoint stored = existing.get(raw.timestamp());
            if (stored == null) {
                toStore.add(DataPoint.fromRaw(series, raw, sourceId, baseQuality));
                newPoints++;
                continue;
            }

            if (stored.sourceId().equals(sourceId)) {
                if (matches(stored, raw, true)) {
                    unchanged++;
                } else {
                    violations.add(raw.timestamp() + ": values from " + sourceId + " changed since stored");
                }
                continue;
            }

            if (matches(stored, raw, false)) {
                if (stored.confirmedBy().contains(sourceId)) {
                    unchanged++;
                } else {
                    toStore.add(stored.withConfirmation(sourceId, boosted(stored.qualityScore())));
                    confirmations++;
                }
            } else if (task.origin() == TaskOrigin.RECONCILIATION) {
                log.warn("[Validator] {} {} disputed: {} close={} vs stored {} close={}, skipped",
                    series, raw.timestamp(), sourceId, raw.close(), stored.sourceId(), stored.close());
                disputed++;
            } else {
                violations.add(raw.timestamp() + ": " + sourceId + " disagrees with stored point from "
                    + stored.sourceId() + " beyond tolerance");
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(sourceId, violations);
        }
        return new ValidationResult(toStore, newPoints, confirmations, unchanged, disputed);
    }

    /**
     * Quality after one more independent confirmation. Never lower than {@code quality}.
     */
    public double boosted(double quality) {
        return Math.min(1.0, quality + (1.0 - quality) * confirmationBoost);
    }

    List<String> checkStructure(Interval interval, List<RawPoint> batch) {
        List<String> violations = new ArrayList<>();
        Instant previous = null;
        for (RawPoint p : batch) {
            if (p.timestamp() == null || p.open() == null || p.high() == null || p.low() == null
                || p.close() == null || p.volume() == null) {
                violations.add("point with missing field: " + p);
                continue;
            }
            Instant ts = p.timestamp();
            if (previous != null && !ts.isAfter(previous)) {
                violations.add(ts + ": not after previous " + previous);
            }
            previous = ts;
            if (!interval.isAligned(ts)) {
                violations.add(ts + ": not aligned to " + interval.getCode());
            }
            if (p.open().signum() < 0 || p.high().signum() < 0 || p.low().signum() < 0 || p.close().signum() < 0) {
                violations.add(ts + ": negative price");
            }
            if (p.volume().signum() < 0) {
                violations.add(ts + ": negative volume");
            }
            BigDecimal maxBody = p.open().max(p.close()).max(p.low());
            BigDecimal minBody = p.open().min(p.close()).min(p.high());
            if (p.high().compareTo(maxBody) < 0) {
                violations.add(ts + ": high " + p.high() + " below max(open, close, low)");
            }
            if (p.low().compareTo(minBody) > 0) {
                violations.add(ts + ": low " + p.low() + " above min(open, close, high)");
            }
        }
        return violations;
    }

    private boolean matches(DataPoint stored, RawPoint raw, boolean includeVolume) {
        return within(stored.open(), raw.open())
            && within(stored.high(), raw.high())
            && within(stored.low(), raw.low())
            && within(stored.close(), raw.close())
            && (!includeVolume || within(stored.volume(), raw.volume()));
    }

    private boolean within(BigDecimal a, BigDecimal b) {
        double x = a.doubleValue();
        double y = b.doubleValue();
        double scale = Math.max(Math.abs(x), Math.abs(y));
        if (scale == 0.0) {
            return true;
        }
        return Math.abs(x - y) <= tolerance * scale + 1e-12;
    }
}
