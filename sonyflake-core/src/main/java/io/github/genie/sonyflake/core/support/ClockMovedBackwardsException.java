package io.github.genie.sonyflake.core.support;

/**
 * The clock reports a tick earlier than the one used for the last minted id.
 * The generator state is left untouched, so the call may be retried once the
 * clock has caught up.
 */
public class ClockMovedBackwardsException extends SonyflakeException {

    private final long lastTimestamp;
    private final long currentTimestamp;

    public ClockMovedBackwardsException(long lastTimestamp, long currentTimestamp) {
        super("Clock moved backwards. Refusing to generate id");
        this.lastTimestamp = lastTimestamp;
        this.currentTimestamp = currentTimestamp;
    }

    public long getLastTimestamp() {
        return lastTimestamp;
    }

    public long getCurrentTimestamp() {
        return currentTimestamp;
    }

}
