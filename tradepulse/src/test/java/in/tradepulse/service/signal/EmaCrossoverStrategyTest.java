package in.tradepulse.service.signal;

import in.tradepulse.config.BotConfig;
import in.tradepulse.domain.signal.PositionBias;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.domain.signal.StrategyType;
import org.junit.jupiter.api.Test;

import static in.tradepulse.testutil.TestBars.bar;
import static org.junit.jupiter.api.Assertions.*;

class EmaCrossoverStrategyTest {

    @Test
    void testNeedsLongPeriodPlusOneCloses() {
        EmaCrossoverStrategy strategy = new EmaCrossoverStrategy(2, 4);
        TradingState state = new TradingState(50, 50);
        for (int i = 0; i < 4; i++) {
            state.appendBar(bar(i, 101, 99, 100));
        }

        assertEquals(5, strategy.minimumHistory());
        assertTrue(strategy.evaluate(state).isEmpty());

        state.appendBar(bar(4, 101, 99, 100));
        assertEquals(SignalAction.HOLD, strategy.evaluate(state).orElseThrow().action(), "Equal EMAs hold");
    }

    @Test
    void testShortAboveLongIsBuy() {
        EmaCrossoverStrategy strategy = new EmaCrossoverStrategy(2, 4);
        TradingState state = new TradingState(50, 50);
        for (int i = 0; i < 5; i++) {
            state.appendBar(bar(i, 101, 99, 100));
        }
        state.appendBar(bar(5, 111, 109, 110));

        StrategyDecision decision = strategy.evaluate(state).orElseThrow();
        assertEquals(SignalAction.BUY, decision.action());
        assertEquals(PositionBias.LONG, decision.targetBias());
        assertEquals(4, decision.indicators().size());
    }

    @Test
    void testShortBelowLongIsSell() {
        EmaCrossoverStrategy strategy = new EmaCrossoverStrategy(2, 4);
        TradingState state = new TradingState(50, 50);
        for (int i = 0; i < 5; i++) {
            state.appendBar(bar(i, 101, 99, 100));
        }
        state.appendBar(bar(5, 91, 89, 90));

        assertEquals(SignalAction.SELL, strategy.evaluate(state).orElseThrow().action());
    }

    @Test
    void testPeriodValidation() {
        assertThrows(IllegalArgumentException.class, () -> new EmaCrossoverStrategy(5, 5));
        assertThrows(IllegalArgumentException.class, () -> new EmaCrossoverStrategy(0, 5));
    }

    @Test
    void testFactorySelectsStrategy() {
        BotConfig config = BotConfig.defaults();

        assertEquals("EMA", StrategyFactory.create(config.withStrategy(StrategyType.EMA)).tag());
        SignalStrategy combined = StrategyFactory.create(config.withStrategy(StrategyType.COMBINED));
        assertEquals("COMBINED", combined.tag());
        assertEquals(config.combinedLookback(), combined.minimumHistory());
    }
}
