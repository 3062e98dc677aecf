package in.candlevault.domain.repository;

import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;

import java.util.List;
import java.util.Optional;

/**
 * Repository for detected gaps.
 */
public interface GapRepository {

    /**
     * Gaps for a series ordered by start, optionally filtered by status.
     *
     * @param status filter, or null for all statuses
     */
    List<Gap> listGaps(String symbol, Interval interval, GapStatus status);

    /**
     * Gaps across all series with the given status, oldest start first.
     */
    List<Gap> findByStatus(GapStatus status);

    Optional<Gap> findById(String id);

    /**
     * Insert or replace by id.
     */
    void saveGap(Gap gap);
}
