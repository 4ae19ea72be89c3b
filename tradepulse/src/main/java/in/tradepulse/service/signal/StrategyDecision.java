package in.tradepulse.service.signal;

import in.tradepulse.domain.signal.PositionBias;
import in.tradepulse.domain.signal.SignalAction;

import java.util.Map;

/**
 * What a strategy wants for the latest bar.
 *
 * @param action     BUY, SELL or HOLD
 * @param targetBias position bias to adopt if the signal is published
 * @param indicators indicator values that supported the decision
 */
public record StrategyDecision(
    SignalAction action,
    PositionBias targetBias,
    Map<String, Object> indicators
) {
    public StrategyDecision {
        indicators = indicators == null ? Map.of() : Map.copyOf(indicators);
    }

    public static StrategyDecision hold(PositionBias currentBias, Map<String, Object> indicators) {
        return new StrategyDecision(SignalAction.HOLD, currentBias, indicators);
    }
}
