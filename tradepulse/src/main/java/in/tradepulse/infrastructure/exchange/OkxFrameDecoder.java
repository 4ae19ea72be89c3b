package in.tradepulse.infrastructure.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.Tick;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes OKX public WebSocket (v5) frames and builds subscribe requests.
 *
 * Frame shapes:
 * <pre>
 *   pong                                                     plain text reply to "ping"
 *   {"event":"subscribe","arg":{"channel":"tickers","instId":"BTC-USDT-SWAP"}}
 *   {"event":"error","code":"60012","msg":"Invalid request"}
 *   {"arg":{"channel":"tickers",...},"data":[{"instId":..,"last":..,"vol24h":..,"ts":..}]}
 *   {"arg":{"channel":"candle30m",...},"data":[["ts","o","h","l","c","vol",..,"confirm"]]}
 * </pre>
 */
public final class OkxFrameDecoder {

    static final String TICKERS_CHANNEL = "tickers";
    static final String CANDLE_PREFIX = "candle";
    private static final int CONFIRM_INDEX = 8;

    private final ObjectMapper objectMapper;

    public OkxFrameDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode one complete text frame.
     *
     * @param raw        frame text
     * @param receivedAt local time the frame arrived, stamped on ticks
     * @throws FrameDecodeException if the frame is not valid JSON or a data row is malformed
     */
    public OkxFrame decode(String raw, Instant receivedAt) {
        if (raw == null || raw.isBlank()) {
            throw new FrameDecodeException("Empty frame", raw);
        }
        if ("pong".equals(raw.trim())) {
            return OkxFrame.pong();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new FrameDecodeException("Invalid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameDecodeException("Frame is not a JSON object", raw);
        }

        String channel = root.path("arg").path("channel").asText(null);

        if (root.has("event")) {
            String event = root.get("event").asText();
            return switch (event) {
                case "subscribe" -> OkxFrame.subscribed(channel);
                case "error" -> OkxFrame.error(root.path("code").asText("?") + " " + root.path("msg").asText(""));
                default -> OkxFrame.ignored(channel);
            };
        }

        JsonNode data = root.get("data");
        if (data == null || channel == null) {
            return OkxFrame.ignored(channel);
        }
        if (!data.isArray()) {
            throw new FrameDecodeException("Field 'data' is not an array", raw);
        }

        if (TICKERS_CHANNEL.equals(channel)) {
            return OkxFrame.tickers(channel, decodeTickers(data, raw, receivedAt));
        }
        if (channel.startsWith(CANDLE_PREFIX)) {
            return OkxFrame.candles(channel, decodeCandles(data, raw));
        }
        return OkxFrame.ignored(channel);
    }

    /**
     * Subscribe request for one channel on one instrument.
     */
    public String subscribeRequest(String channel, String instId) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("op", "subscribe");
        ArrayNode args = msg.putArray("args");
        ObjectNode arg = args.addObject();
        arg.put("channel", channel);
        arg.put("instId", instId);
        try {
            return objectMapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize subscribe request", e);
        }
    }

    private List<Tick> decodeTickers(JsonNode data, String raw, Instant receivedAt) {
        List<Tick> ticks = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            String instId = item.path("instId").asText(null);
            BigDecimal last = decimal(item.get("last"), "last", raw);
            BigDecimal vol24h = item.hasNonNull("vol24h") ? decimal(item.get("vol24h"), "vol24h", raw) : BigDecimal.ZERO;
            Instant exchangeTs = item.hasNonNull("ts") ? epochMillis(item.get("ts"), raw) : receivedAt;
            ticks.add(new Tick(instId, last, vol24h, exchangeTs, receivedAt));
        }
        return ticks;
    }

    private List<BarUpdate> decodeCandles(JsonNode data, String raw) {
        List<BarUpdate> updates = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            if (!row.isArray() || row.size() < 6) {
                throw new FrameDecodeException("Candle row needs at least 6 fields", raw);
            }
            Boolean confirmed = null;
            if (row.size() > CONFIRM_INDEX) {
                confirmed = "1".equals(row.get(CONFIRM_INDEX).asText());
            }
            updates.add(new BarUpdate(
                epochMillis(row.get(0), raw),
                decimal(row.get(1), "open", raw),
                decimal(row.get(2), "high", raw),
                decimal(row.get(3), "low", raw),
                decimal(row.get(4), "close", raw),
                decimal(row.get(5), "volume", raw),
                confirmed
            ));
        }
        return updates;
    }

    private static BigDecimal decimal(JsonNode node, String field, String raw) {
        if (node == null || node.isNull()) {
            throw new FrameDecodeException("Missing field '" + field + "'", raw);
        }
        String text = node.asText();
        if (text.isBlank()) {
            throw new FrameDecodeException("Empty field '" + field + "'", raw);
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new FrameDecodeException("Field '" + field + "' is not a number: " + text, raw, e);
        }
    }

    private static Instant epochMillis(JsonNode node, String raw) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(node.asText()));
        } catch (NumberFormatException e) {
            throw new FrameDecodeException("Timestamp is not epoch millis: " + node.asText(), raw, e);
        }
    }
}
