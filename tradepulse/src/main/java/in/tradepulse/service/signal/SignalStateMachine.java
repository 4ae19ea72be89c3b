package in.tradepulse.service.signal;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.signal.Signal;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Position-aware, edge-triggered signal engine.
 *
 * For each completed bar: append to history, evaluate the strategy, and
 * publish only when the action is BUY or SELL and differs from the last
 * published action. HOLD is never published. Position bias moves only when
 * a signal is published.
 *
 * A strategy that throws costs that bar's signal and nothing else.
 */
public final class SignalStateMachine {
    private static final Logger log = LoggerFactory.getLogger(SignalStateMachine.class);

    private final TradingState state;
    private final SignalStrategy strategy;
    private final String timeframeLabel;
    private final Consumer<Signal> publisher;
    private final StreamMetrics metrics;
    private final Clock clock;

    public SignalStateMachine(TradingState state, SignalStrategy strategy, String timeframeLabel,
                              Consumer<Signal> publisher, StreamMetrics metrics, Clock clock) {
        this.state = state;
        this.strategy = strategy;
        this.timeframeLabel = timeframeLabel;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Process one completed bar.
     *
     * @return the published signal, if this bar produced one
     */
    public Optional<Signal> onBar(Bar bar) {
        if (!state.appendBar(bar)) {
            log.debug("[SIGNAL] Dropping bar {} (last appended {})", bar.openTime(), state.lastAppendedOpenTime());
            return Optional.empty();
        }

        Optional<StrategyDecision> decision;
        try {
            decision = strategy.evaluate(state);
        } catch (RuntimeException e) {
            log.error("[SIGNAL] {} evaluation failed for bar {}: {}", strategy.tag(), bar.openTime(), e.getMessage(), e);
            metrics.recordStrategyFault(strategy.tag());
            return Optional.empty();
        }

        if (decision.isEmpty()) {
            log.debug("[SIGNAL] {} insufficient history ({}/{} bars)",
                strategy.tag(), state.barCount(), strategy.minimumHistory());
            return Optional.empty();
        }

        SignalAction action = decision.get().action();
        if (!action.isDirectional() || action == state.lastAction()) {
            log.debug("[SIGNAL] {} {} at {} (last {}, bias {})",
                strategy.tag(), action, bar.close(), state.lastAction(), state.bias());
            return Optional.empty();
        }

        Signal signal = new Signal(
            action,
            bar.close(),
            clock.instant(),
            strategy.tag(),
            timeframeLabel,
            decision.get().indicators(),
            bar
        );

        state.recordPublished(action, decision.get().targetBias());
        metrics.recordSignal(strategy.tag(), action.name());
        log.info("[SIGNAL] {} {} @ {} (bar {}, bias now {})",
            strategy.tag(), action, bar.close(), bar.openTime(), state.bias());

        publisher.accept(signal);
        return Optional.of(signal);
    }

    public TradingState state() {
        return state;
    }

    public SignalStrategy strategy() {
        return strategy;
    }
}
