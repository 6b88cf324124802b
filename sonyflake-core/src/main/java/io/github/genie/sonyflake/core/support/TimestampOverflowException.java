package io.github.genie.sonyflake.core.support;

public class TimestampOverflowException extends SonyflakeException {

    public TimestampOverflowException() {
        super("Timestamp offset overflow");
    }

}
