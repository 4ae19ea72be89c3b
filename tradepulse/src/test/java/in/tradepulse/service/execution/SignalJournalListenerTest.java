package in.tradepulse.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.signal.Signal;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.testutil.TestBars;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalJournalListenerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SignalJournalListener listener = new SignalJournalListener(objectMapper);

    @Test
    void testJsonLine() throws Exception {
        Bar bar = TestBars.bar(2, 102, 100, 101.5);
        Map<String, Object> indicators = new LinkedHashMap<>();
        indicators.put("emaShort", new BigDecimal("1E+2"));
        indicators.put("supertrend", "UP");
        Signal signal = new Signal(SignalAction.BUY, new BigDecimal("101.5"),
            Instant.parse("2024-01-01T01:30:00.250Z"), "EMA", "30m", indicators, bar);

        String line = listener.toJson(signal);
        assertFalse(line.contains("\n"), "One signal per line");

        JsonNode json = objectMapper.readTree(line);
        assertEquals("BUY", json.get("action").asText());
        assertEquals("101.5", json.get("price").asText());
        assertEquals("2024-01-01T01:30:00.250Z", json.get("timestamp").asText());
        assertEquals("EMA", json.get("strategy").asText());
        assertEquals("30m", json.get("timeframe").asText());
        assertEquals(TestBars.openTime(2).toString(), json.get("barOpenTime").asText());
        assertEquals("100", json.get("indicators").get("emaShort").asText(), "Decimals are written plain");
        assertEquals("UP", json.get("indicators").get("supertrend").asText());
    }

    @Test
    void testSignalWithoutBar() throws Exception {
        Signal signal = new Signal(SignalAction.SELL, BigDecimal.TEN, Instant.EPOCH, "COMBINED", "1h", null, null);

        JsonNode json = objectMapper.readTree(listener.toJson(signal));

        assertFalse(json.has("barOpenTime"));
        assertEquals(0, json.get("indicators").size());
        assertDoesNotThrow(() -> listener.onSignal(signal));
    }
}
