package in.tradepulse.service.signal;

import java.util.Optional;

/**
 * A signal rule evaluated once per completed bar.
 */
public interface SignalStrategy {

    /**
     * Short name stamped on published signals.
     */
    String tag();

    /**
     * Bars of history needed before {@link #evaluate} can decide.
     */
    int minimumHistory();

    /**
     * Decide on the latest bar in {@code state}.
     *
     * @return the decision, or empty when history is too short
     */
    Optional<StrategyDecision> evaluate(TradingState state);
}
