package in.candlevault.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One forced liquidation reported by an exchange.
 *
 * @param price    average fill price of the force order
 * @param quantity filled base-asset quantity
 */
public record LiquidationEvent(
    String symbol,
    LiquidationSide side,
    BigDecimal price,
    BigDecimal quantity,
    Instant tradeTime
) {
    public LiquidationEvent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(tradeTime, "tradeTime");
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Liquidation price must be positive: " + price);
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Liquidation quantity must be positive: " + quantity);
        }
    }

    public BigDecimal notional() {
        return price.multiply(quantity);
    }
}
