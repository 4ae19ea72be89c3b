package in.tradepulse.service.execution;

import java.math.BigDecimal;

/**
 * Outcome of a market order with its protective levels.
 */
public record OrderResult(
    boolean success,
    String orderId,
    String symbol,
    TradeSide side,
    BigDecimal size,
    BigDecimal price,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String errorMessage,
    String errorCode
) {
    public static OrderResult success(String orderId, String symbol, TradeSide side, BigDecimal size,
                                      BigDecimal price, BigDecimal stopLoss, BigDecimal takeProfit) {
        return new OrderResult(true, orderId, symbol, side, size, price, stopLoss, takeProfit, null, null);
    }

    public static OrderResult failure(String errorMessage, String errorCode) {
        return new OrderResult(false, null, null, null, null, null, null, null, errorMessage, errorCode);
    }
}
