package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.repository.GapRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory gap store keyed by gap id.
 */
public final class InMemoryGapRepository implements GapRepository {

    private static final Comparator<Gap> BY_START = Comparator.comparing(Gap::start).thenComparing(Gap::id);

    private final Map<String, Gap> gaps = new ConcurrentHashMap<>();

    @Override
    public List<Gap> listGaps(String symbol, Interval interval, GapStatus status) {
        return gaps.values().stream()
            .filter(g -> g.symbol().equals(symbol) && g.interval() == interval)
            .filter(g -> status == null || g.status() == status)
            .sorted(BY_START)
            .toList();
    }

    @Override
    public List<Gap> findByStatus(GapStatus status) {
        return gaps.values().stream()
            .filter(g -> g.status() == status)
            .sorted(BY_START)
            .toList();
    }

    @Override
    public Optional<Gap> findById(String id) {
        return Optional.ofNullable(gaps.get(id));
    }

    @Override
    public void saveGap(Gap gap) {
        gaps.put(gap.id(), gap);
    }
}
