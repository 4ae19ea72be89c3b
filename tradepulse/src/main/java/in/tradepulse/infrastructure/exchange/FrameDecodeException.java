package in.tradepulse.infrastructure.exchange;

/**
 * A single inbound frame could not be decoded. The frame is skipped and the
 * stream stays open.
 */
public class FrameDecodeException extends RuntimeException {

    private final String frame;

    public FrameDecodeException(String message, String frame) {
        super(message);
        this.frame = frame;
    }

    public FrameDecodeException(String message, String frame, Throwable cause) {
        super(message, cause);
        this.frame = frame;
    }

    /**
     * @return the raw frame, truncated for logging
     */
    public String getFrame() {
        if (frame == null) return null;
        return frame.length() > 200 ? frame.substring(0, 200) + "..." : frame;
    }
}
