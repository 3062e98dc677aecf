package in.candlevault.domain.market;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Top of an order book at one instant.
 *
 * @param bidDepth summed quantity over the captured bid levels
 * @param askDepth summed quantity over the captured ask levels
 * @param levels   levels captured per side
 */
public record OrderBookSnapshot(
    String symbol,
    Instant timestamp,
    BigDecimal bestBid,
    BigDecimal bestAsk,
    BigDecimal bidDepth,
    BigDecimal askDepth,
    int levels
) {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public OrderBookSnapshot {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(bestBid, "bestBid");
        Objects.requireNonNull(bestAsk, "bestAsk");
        Objects.requireNonNull(bidDepth, "bidDepth");
        Objects.requireNonNull(askDepth, "askDepth");
    }

    public BigDecimal mid() {
        return bestBid.add(bestAsk).divide(TWO, Math.max(bestBid.scale(), bestAsk.scale()) + 1, RoundingMode.HALF_EVEN);
    }

    public BigDecimal spread() {
        return bestAsk.subtract(bestBid);
    }

    /**
     * Problems that make this snapshot unusable; empty when it is sound.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (bestBid.signum() <= 0) {
            problems.add("best bid must be positive (" + bestBid + ")");
        }
        if (bestAsk.signum() <= 0) {
            problems.add("best ask must be positive (" + bestAsk + ")");
        }
        if (bestAsk.compareTo(bestBid) < 0) {
            problems.add("crossed book: ask " + bestAsk + " < bid " + bestBid);
        }
        if (bidDepth.signum() < 0 || askDepth.signum() < 0) {
            problems.add("negative depth");
        }
        if (levels < 1) {
            problems.add("no levels captured");
        }
        return problems;
    }
}
