package in.tradepulse.service.execution;

import in.tradepulse.domain.signal.Signal;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns published signals into orders.
 *
 * At most one order is in flight, and accepted trades are at least
 * {@code cooldown} apart. Signals arriving during either window are skipped,
 * not queued.
 */
public final class SignalExecutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SignalExecutionOrchestrator.class);

    private final ExecutionGateway gateway;
    private final String symbol;
    private final BigDecimal tradeSize;
    private final Duration cooldown;
    private final StreamMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean trading = new AtomicBoolean(false);
    private volatile Instant lastTradeTime;

    public SignalExecutionOrchestrator(ExecutionGateway gateway, String symbol, BigDecimal tradeSize,
                                       Duration cooldown, StreamMetrics metrics, Clock clock) {
        this.gateway = gateway;
        this.symbol = symbol;
        this.tradeSize = tradeSize;
        this.cooldown = cooldown;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Set leverage once at startup. Failure is logged, not fatal.
     */
    public CompletableFuture<Boolean> initializeLeverage(int leverage, String mode) {
        return gateway.setLeverage(symbol, leverage, mode)
            .handle((ok, error) -> {
                if (error != null) {
                    log.error("[EXECUTION] Failed to set leverage {}x ({}) for {}: {}",
                        leverage, mode, symbol, error.getMessage());
                    return false;
                }
                if (Boolean.TRUE.equals(ok)) {
                    log.info("[EXECUTION] Leverage set to {}x ({}) for {}", leverage, mode, symbol);
                } else {
                    log.error("[EXECUTION] Exchange rejected leverage {}x ({}) for {}", leverage, mode, symbol);
                }
                return Boolean.TRUE.equals(ok);
            });
    }

    /**
     * Handle one published signal.
     *
     * @return the pending order, or null if the signal was skipped
     * @throws IllegalArgumentException for a HOLD signal
     */
    public CompletableFuture<OrderResult> onSignal(Signal signal) {
        log.info("[EXECUTION] Received signal: {} at {}", signal.action(), signal.price());
        TradeSide side = TradeSide.fromAction(signal.action());

        Instant now = clock.instant();
        Instant last = lastTradeTime;
        if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
            log.info("[EXECUTION] Trade cooldown in effect, skipping {} signal", signal.action());
            metrics.recordTradeSkipped("COOLDOWN");
            return null;
        }

        if (!trading.compareAndSet(false, true)) {
            log.info("[EXECUTION] Trade in progress, skipping {} signal", signal.action());
            metrics.recordTradeSkipped("IN_FLIGHT");
            return null;
        }

        CompletableFuture<OrderResult> order;
        try {
            order = gateway.placeOrder(symbol, side, tradeSize);
        } catch (RuntimeException e) {
            trading.set(false);
            log.error("[EXECUTION] Error executing {} trade: {}", side, e.getMessage(), e);
            metrics.recordOrder(side.name(), false, Duration.between(now, clock.instant()));
            return CompletableFuture.completedFuture(OrderResult.failure(e.getMessage(), "GATEWAY_ERROR"));
        }

        return order.whenComplete((result, error) -> {
            try {
                Duration latency = Duration.between(now, clock.instant());
                if (error != null) {
                    log.error("[EXECUTION] Error executing {} trade: {}", side, error.getMessage());
                    metrics.recordOrder(side.name(), false, latency);
                } else if (!result.success()) {
                    log.error("[EXECUTION] Order rejected: {} ({})", result.errorMessage(), result.errorCode());
                    metrics.recordOrder(side.name(), false, latency);
                } else {
                    lastTradeTime = clock.instant();
                    log.info("[EXECUTION] Order {} filled: {} {} {} at {}",
                        result.orderId(), side, tradeSize.toPlainString(), symbol, result.price());
                    metrics.recordOrder(side.name(), true, latency);
                }
            } finally {
                trading.set(false);
            }
        });
    }

    public boolean isTrading() {
        return trading.get();
    }

    public Instant getLastTradeTime() {
        return lastTradeTime;
    }
}
