package io.github.genie.sonyflake.core.support;

public class SonyflakeException extends RuntimeException {

    public SonyflakeException(String message) {
        super(message);
    }

    public SonyflakeException(String message, Throwable cause) {
        super(message, cause);
    }

}
