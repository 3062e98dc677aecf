package in.candlevault.application.service;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskOrigin;
import in.candlevault.domain.error.ValidationException;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.UpsertResult;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.service.source.SourceSelector;
import in.candlevault.service.source.SourceSelector.FetchResult;
import in.candlevault.service.validation.DataValidator;
import in.candlevault.service.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one attempt of a fetch task: select a source, fetch, validate, persist.
 *
 * Validation and persistence are serialised per series so that two batches
 * for the same series never interleave their read-validate-write steps.
 */
public class FetchTaskHandler implements TaskScheduler.TaskRunner {
    private static final Logger log = LoggerFactory.getLogger(FetchTaskHandler.class);

    private final SourceSelector selector;
    private final DataValidator validator;
    private final DataPointRepository points;
    private final IngestionMetrics metrics;
    private final Map<SeriesKey, ReentrantLock> seriesLocks = new ConcurrentHashMap<>();

    public FetchTaskHandler(SourceSelector selector, DataValidator validator,
                            DataPointRepository points, IngestionMetrics metrics) {
        this.selector = selector;
        this.validator = validator;
        this.points = points;
        this.metrics = metrics;
    }

    @Override
    public TaskOutcome run(FetchTask task) {
        SeriesKey series = task.series();
        FetchResult fetched = selector.fetch(task, excludedSources(task));
        List<RawPoint> batch = trimToRange(task, fetched);

        ReentrantLock lock = seriesLocks.computeIfAbsent(series, k -> new ReentrantLock());
        lock.lock();
        try {
            Map<Instant, DataPoint> existing = new HashMap<>();
            for (DataPoint p : points.queryRange(series.symbol(), series.interval(),
                    task.range().start(), task.range().end())) {
                existing.put(p.timestamp(), p);
            }

            ValidationResult result;
            try {
                result = validator.validate(task, fetched.sourceId(), batch, existing);
            } catch (ValidationException e) {
                metrics.recordValidationRejected(series, fetched.sourceId());
                log.error("[FetchTask] {} batch from {} rejected: {}", task, fetched.sourceId(), e.getViolations());
                throw e;
            }

            int stored = 0;
            int conflicts = 0;
            for (UpsertResult r : points.upsertAll(result.toStore())) {
                if (r == UpsertResult.STORED) {
                    stored++;
                } else if (r == UpsertResult.CONFLICT) {
                    conflicts++;
                }
            }
            if (conflicts > 0) {
                log.warn("[FetchTask] {} {} point(s) kept existing higher-quality values", task, conflicts);
            }

            metrics.recordPointsStored(series, fetched.sourceId(), stored);
            if (result.confirmations() > 0) {
                metrics.recordConfirmations(series, fetched.sourceId(), result.confirmations());
            }
            if (result.disputed() > 0) {
                metrics.recordDisputedSkipped(series, fetched.sourceId(), result.disputed());
            }

            TaskOutcome outcome = new TaskOutcome(fetched.sourceId(), batch.size(), task.expectedPoints(),
                stored, result.confirmations(), result.unchanged(), result.disputed());
            log.info("[FetchTask] {} via {}: received {}/{}, new {}, confirmed {}, unchanged {}{}",
                task, fetched.sourceId(), batch.size(), task.expectedPoints(), result.newPoints(),
                result.confirmations(), result.unchanged(),
                result.disputed() > 0 ? ", disputed " + result.disputed() : "");
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reconciliation should be answered by a source other than the one that
     * stored the range.
     */
    private Set<String> excludedSources(FetchTask task) {
        if (task.origin() != TaskOrigin.RECONCILIATION) {
            return Set.of();
        }
        Set<String> origins = points.queryRange(task.series().symbol(), task.series().interval(),
                task.range().start(), task.range().end()).stream()
            .map(DataPoint::sourceId)
            .collect(Collectors.toSet());
        return origins.size() == 1 ? origins : Set.of();
    }

    private List<RawPoint> trimToRange(FetchTask task, FetchResult fetched) {
        List<RawPoint> inRange = fetched.points().stream()
            .filter(p -> p.timestamp() != null && task.range().contains(p.timestamp()))
            .toList();
        if (inRange.size() != fetched.points().size()) {
            log.warn("[FetchTask] {} dropped {} point(s) outside {} from {}",
                task.series(), fetched.points().size() - inRange.size(), task.range(), fetched.sourceId());
        }
        return inRange;
    }
}
