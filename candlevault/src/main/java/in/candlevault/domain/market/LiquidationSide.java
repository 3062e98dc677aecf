package in.candlevault.domain.market;

/**
 * Position side that was forcibly closed.
 */
public enum LiquidationSide {
    LONG,
    SHORT;

    /**
     * A liquidated long is closed by a SELL force order, a short by a BUY.
     */
    public static LiquidationSide fromOrderSide(String orderSide) {
        if ("SELL".equalsIgnoreCase(orderSide)) {
            return LONG;
        }
        if ("BUY".equalsIgnoreCase(orderSide)) {
            return SHORT;
        }
        throw new IllegalArgumentException("Unknown order side: " + orderSide);
    }
}
