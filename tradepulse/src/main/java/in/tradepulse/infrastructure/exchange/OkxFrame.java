package in.tradepulse.infrastructure.exchange;

import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.Tick;

import java.util.List;

/**
 * One decoded OKX WebSocket frame.
 *
 * @param kind       what the frame carries
 * @param channel    channel name from {@code arg.channel}, if any
 * @param message    error text for ERROR frames
 * @param ticks      ticker updates (TICKERS only)
 * @param barUpdates candle snapshots (CANDLES only)
 */
public record OkxFrame(
    Kind kind,
    String channel,
    String message,
    List<Tick> ticks,
    List<BarUpdate> barUpdates
) {
    public enum Kind {
        PONG,
        SUBSCRIBED,
        ERROR,
        TICKERS,
        CANDLES,
        /** Recognised JSON we do not act on (login, unsubscribe, other channels). */
        IGNORED
    }

    public OkxFrame {
        ticks = ticks == null ? List.of() : List.copyOf(ticks);
        barUpdates = barUpdates == null ? List.of() : List.copyOf(barUpdates);
    }

    static OkxFrame pong() {
        return new OkxFrame(Kind.PONG, null, null, null, null);
    }

    static OkxFrame subscribed(String channel) {
        return new OkxFrame(Kind.SUBSCRIBED, channel, null, null, null);
    }

    static OkxFrame error(String message) {
        return new OkxFrame(Kind.ERROR, null, message, null, null);
    }

    static OkxFrame ignored(String channel) {
        return new OkxFrame(Kind.IGNORED, channel, null, null, null);
    }

    static OkxFrame tickers(String channel, List<Tick> ticks) {
        return new OkxFrame(Kind.TICKERS, channel, null, ticks, null);
    }

    static OkxFrame candles(String channel, List<BarUpdate> updates) {
        return new OkxFrame(Kind.CANDLES, channel, null, null, updates);
    }
}
