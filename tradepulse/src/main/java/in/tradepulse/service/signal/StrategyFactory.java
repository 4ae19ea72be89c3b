package in.tradepulse.service.signal;

import in.tradepulse.config.BotConfig;
import in.tradepulse.service.indicator.FractalTrendDetector;
import in.tradepulse.service.indicator.SupertrendCalculator;

/**
 * Builds the strategy selected by configuration.
 */
public final class StrategyFactory {

    public static SignalStrategy create(BotConfig config) {
        return switch (config.strategy()) {
            case EMA -> new EmaCrossoverStrategy(config.emaShortPeriod(), config.emaLongPeriod());
            case COMBINED -> new CombinedStrategy(
                new SupertrendCalculator(config.stPeriod(), config.stMultiplier()),
                new FractalTrendDetector(config.fractalPeriod(), config.bbLength(), config.bbDeviation()),
                config.combinedLookback()
            );
        };
    }

    private StrategyFactory() {}
}
