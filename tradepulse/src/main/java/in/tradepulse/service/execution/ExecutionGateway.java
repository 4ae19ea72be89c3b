package in.tradepulse.service.execution;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Order placement at the exchange.
 */
public interface ExecutionGateway {

    /**
     * Place a market order and its stop-loss / take-profit orders.
     *
     * @param symbol instrument id
     * @param side   BUY or SELL
     * @param size   contract size
     * @return result; a failed placement completes normally with success=false
     */
    CompletableFuture<OrderResult> placeOrder(String symbol, TradeSide side, BigDecimal size);

    /**
     * Set leverage for the instrument.
     *
     * @param mode margin mode, "cross" or "isolated"
     * @return true if the exchange accepted the setting
     */
    CompletableFuture<Boolean> setLeverage(String symbol, int leverage, String mode);
}
