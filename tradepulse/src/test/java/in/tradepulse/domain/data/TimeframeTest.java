package in.tradepulse.domain.data;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeTest {

    @Test
    void testParse() {
        assertEquals(Duration.ofMinutes(30), Timeframe.parse("30m").duration());
        assertEquals(Duration.ofHours(4), Timeframe.parse("4H").duration());
        assertEquals(Duration.ofDays(1), Timeframe.parse("1d").duration());
        assertEquals("30m", Timeframe.parse(" 30m ").label());
        assertEquals(Timeframe.parse("60m"), Timeframe.parse("1h"), "Equal durations are equal timeframes");
    }

    @Test
    void testParseRejectsMalformedLabels() {
        assertThrows(IllegalArgumentException.class, () -> Timeframe.parse("30x"));
        assertThrows(IllegalArgumentException.class, () -> Timeframe.parse("0m"));
        assertThrows(IllegalArgumentException.class, () -> Timeframe.parse("m"));
        assertThrows(IllegalArgumentException.class, () -> Timeframe.parse(null));
    }

    @Test
    void testFloorAlignsToEpoch() {
        Timeframe tf = Timeframe.parse("30m");

        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), tf.floor(Instant.parse("2024-01-01T10:47:12Z")));
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), tf.floor(Instant.parse("2024-01-01T10:30:00Z")));
        assertTrue(tf.isAligned(Instant.parse("2024-01-01T11:00:00Z")));
        assertFalse(tf.isAligned(Instant.parse("2024-01-01T11:07:00Z")));
    }

    @Test
    void testCandleChannel() {
        assertEquals("candle30m", Timeframe.parse("30m").candleChannel());
        assertEquals("candle1H", Timeframe.parse("1h").candleChannel());
        assertEquals("candle1D", Timeframe.parse("1d").candleChannel());
    }
}
