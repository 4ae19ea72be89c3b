package in.tradepulse.infrastructure.exchange;

import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.Tick;

/**
 * Synchronous downstream of the exchange connector.
 *
 * Callbacks run on the WebSocket listener thread, one frame at a time.
 */
public interface MarketDataListener {

    void onTick(Tick tick);

    void onBarUpdate(BarUpdate update);
}
