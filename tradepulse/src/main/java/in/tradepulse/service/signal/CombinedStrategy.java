package in.tradepulse.service.signal;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.indicator.FractalTrend;
import in.tradepulse.domain.indicator.FractalTrendSnapshot;
import in.tradepulse.domain.indicator.SupertrendSnapshot;
import in.tradepulse.domain.signal.PositionBias;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.service.indicator.FractalTrendDetector;
import in.tradepulse.service.indicator.SupertrendCalculator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Supertrend combined with fractal/Bollinger trend classification.
 *
 * Rules, first match wins:
 * <pre>
 *   LONG  and classification bearish                 -> SELL, exit to FLAT
 *   SHORT and classification bullish                 -> BUY,  exit to FLAT
 *   Supertrend UP   and STRONGLY_BULLISH, not LONG   -> BUY,  enter LONG
 *   Supertrend DOWN and STRONGLY_BEARISH, not SHORT  -> SELL, enter SHORT
 *   otherwise                                        -> HOLD
 * </pre>
 */
public final class CombinedStrategy implements SignalStrategy {

    private final SupertrendCalculator supertrend;
    private final FractalTrendDetector fractalDetector;
    private final int minimumHistory;

    public CombinedStrategy(SupertrendCalculator supertrend, FractalTrendDetector fractalDetector, int minimumHistory) {
        this.supertrend = supertrend;
        this.fractalDetector = fractalDetector;
        this.minimumHistory = minimumHistory;
    }

    @Override
    public String tag() {
        return "COMBINED";
    }

    @Override
    public int minimumHistory() {
        return minimumHistory;
    }

    @Override
    public Optional<StrategyDecision> evaluate(TradingState state) {
        List<Bar> bars = state.bars();
        if (bars.size() < minimumHistory) {
            return Optional.empty();
        }

        Optional<SupertrendSnapshot> st = supertrend.calculate(bars);
        Optional<FractalTrendSnapshot> fractal = fractalDetector.detect(bars);
        if (st.isEmpty() || fractal.isEmpty()) {
            return Optional.empty();
        }

        SupertrendSnapshot trend = st.get();
        FractalTrend classification = fractal.get().trend();
        PositionBias bias = state.bias();

        Map<String, Object> indicators = new LinkedHashMap<>();
        indicators.put("supertrend", trend.trend().name());
        indicators.put("atr", trend.atr());
        indicators.put("stUpper", trend.upperBand());
        indicators.put("stLower", trend.lowerBand());
        indicators.put("fractalTrend", classification.name());
        indicators.put("bbUpper", fractal.get().bands().upper());
        indicators.put("bbMiddle", fractal.get().bands().middle());
        indicators.put("bbLower", fractal.get().bands().lower());

        if (bias == PositionBias.LONG && classification.isBearish()) {
            return Optional.of(new StrategyDecision(SignalAction.SELL, PositionBias.FLAT, indicators));
        }
        if (bias == PositionBias.SHORT && classification.isBullish()) {
            return Optional.of(new StrategyDecision(SignalAction.BUY, PositionBias.FLAT, indicators));
        }
        if (trend.isUp() && classification == FractalTrend.STRONGLY_BULLISH
                && bias != PositionBias.LONG) {
            return Optional.of(new StrategyDecision(SignalAction.BUY, PositionBias.LONG, indicators));
        }
        if (trend.isDown() && classification == FractalTrend.STRONGLY_BEARISH
                && bias != PositionBias.SHORT) {
            return Optional.of(new StrategyDecision(SignalAction.SELL, PositionBias.SHORT, indicators));
        }
        return Optional.of(StrategyDecision.hold(bias, indicators));
    }
}
