package in.tradepulse.service.signal;

import in.tradepulse.domain.indicator.EmaCrossSnapshot;
import in.tradepulse.domain.signal.PositionBias;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.service.indicator.MovingAverages;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * EMA crossover: BUY while EMA(short) is above EMA(long), SELL while below.
 *
 * The state machine only publishes on change, so the level turns into
 * crossover signals.
 */
public final class EmaCrossoverStrategy implements SignalStrategy {

    private final int shortPeriod;
    private final int longPeriod;

    public EmaCrossoverStrategy(int shortPeriod, int longPeriod) {
        if (shortPeriod <= 0 || longPeriod <= 0) {
            throw new IllegalArgumentException("EMA periods must be positive");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short EMA period must be less than long period");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    public String tag() {
        return "EMA";
    }

    @Override
    public int minimumHistory() {
        return longPeriod + 1;
    }

    @Override
    public Optional<StrategyDecision> evaluate(TradingState state) {
        List<BigDecimal> closes = state.closes();
        if (closes.size() < minimumHistory()) {
            return Optional.empty();
        }

        List<BigDecimal> previous = closes.subList(0, closes.size() - 1);
        EmaCrossSnapshot snapshot = new EmaCrossSnapshot(
            MovingAverages.ema(closes, shortPeriod).orElseThrow(),
            MovingAverages.ema(closes, longPeriod).orElseThrow(),
            MovingAverages.ema(previous, shortPeriod).orElseThrow(),
            MovingAverages.ema(previous, longPeriod).orElseThrow()
        );

        Map<String, Object> indicators = new LinkedHashMap<>();
        indicators.put("emaShort", snapshot.shortNow());
        indicators.put("emaLong", snapshot.longNow());
        indicators.put("emaShortPrev", snapshot.shortPrev());
        indicators.put("emaLongPrev", snapshot.longPrev());
        indicators.put("crossover", snapshot.isBullishCross() ? "BULLISH"
            : snapshot.isBearishCross() ? "BEARISH" : "NONE");

        int cmp = snapshot.shortNow().compareTo(snapshot.longNow());
        if (cmp > 0) {
            return Optional.of(new StrategyDecision(SignalAction.BUY, PositionBias.LONG, indicators));
        }
        if (cmp < 0) {
            return Optional.of(new StrategyDecision(SignalAction.SELL, PositionBias.SHORT, indicators));
        }
        return Optional.of(StrategyDecision.hold(state.bias(), indicators));
    }
}
