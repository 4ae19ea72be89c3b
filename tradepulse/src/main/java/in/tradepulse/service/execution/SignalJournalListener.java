package in.tradepulse.service.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradepulse.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Writes every published signal as one JSON line to the SIGNALS logger.
 */
public final class SignalJournalListener {
    private static final Logger log = LoggerFactory.getLogger(SignalJournalListener.class);
    private static final Logger journal = LoggerFactory.getLogger("SIGNALS");

    private final ObjectMapper objectMapper;

    public SignalJournalListener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void onSignal(Signal signal) {
        try {
            journal.info(toJson(signal));
        } catch (JsonProcessingException e) {
            log.error("[JOURNAL] Failed to serialize {} signal: {}", signal.action(), e.getMessage());
        }
    }

    String toJson(Signal signal) throws JsonProcessingException {
        ObjectNode o = objectMapper.createObjectNode();
        o.put("action", signal.action().name());
        o.put("price", signal.price().toPlainString());
        o.put("timestamp", signal.timestamp().toString());
        o.put("strategy", signal.strategyTag());
        o.put("timeframe", signal.timeframe());
        if (signal.bar() != null) {
            o.put("barOpenTime", signal.bar().openTime().toString());
        }

        ObjectNode indicators = o.putObject("indicators");
        for (Map.Entry<String, Object> e : signal.supportingIndicators().entrySet()) {
            Object v = e.getValue();
            if (v instanceof BigDecimal) {
                indicators.put(e.getKey(), ((BigDecimal) v).toPlainString());
            } else {
                indicators.put(e.getKey(), String.valueOf(v));
            }
        }
        return objectMapper.writeValueAsString(o);
    }
}
