package in.tradepulse.service.execution;

import in.tradepulse.service.MarketDataCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper execution: fills at the last cached price and only logs.
 *
 * Protective levels:
 * - BUY:  stop 0.5% below, take-profit 1% above
 * - SELL: stop 0.5% above, take-profit 1% below
 */
public final class PaperExecutionGateway implements ExecutionGateway {
    private static final Logger log = LoggerFactory.getLogger(PaperExecutionGateway.class);

    static final BigDecimal STOP_LOSS_PCT = new BigDecimal("0.005");
    static final BigDecimal TAKE_PROFIT_PCT = new BigDecimal("0.01");

    private final MarketDataCache marketDataCache;
    private final AtomicLong orderSeq = new AtomicLong(0);

    public PaperExecutionGateway(MarketDataCache marketDataCache) {
        this.marketDataCache = marketDataCache;
    }

    @Override
    public CompletableFuture<OrderResult> placeOrder(String symbol, TradeSide side, BigDecimal size) {
        Optional<BigDecimal> lastPrice = marketDataCache.getLastPrice(symbol);
        if (lastPrice.isEmpty()) {
            log.warn("[PAPER] No price for {}, rejecting {} order", symbol, side);
            return CompletableFuture.completedFuture(
                OrderResult.failure("No market price for " + symbol, "NO_PRICE"));
        }

        BigDecimal price = lastPrice.get();
        BigDecimal stopLoss = stopLoss(side, price);
        BigDecimal takeProfit = takeProfit(side, price);
        String orderId = "PAPER-" + orderSeq.incrementAndGet();

        log.info("[PAPER] Market order {}: {} {} of {} at {}", orderId, side, size.toPlainString(), symbol, price);
        log.info("[PAPER] Stop-loss set at {}, take-profit at {}", stopLoss, takeProfit);

        return CompletableFuture.completedFuture(
            OrderResult.success(orderId, symbol, side, size, price, stopLoss, takeProfit));
    }

    @Override
    public CompletableFuture<Boolean> setLeverage(String symbol, int leverage, String mode) {
        log.info("[PAPER] Leverage for {} set to {}x ({})", symbol, leverage, mode);
        return CompletableFuture.completedFuture(true);
    }

    static BigDecimal stopLoss(TradeSide side, BigDecimal price) {
        BigDecimal factor = side == TradeSide.BUY
            ? BigDecimal.ONE.subtract(STOP_LOSS_PCT)
            : BigDecimal.ONE.add(STOP_LOSS_PCT);
        return price.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal takeProfit(TradeSide side, BigDecimal price) {
        BigDecimal factor = side == TradeSide.BUY
            ? BigDecimal.ONE.add(TAKE_PROFIT_PCT)
            : BigDecimal.ONE.subtract(TAKE_PROFIT_PCT);
        return price.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }
}
