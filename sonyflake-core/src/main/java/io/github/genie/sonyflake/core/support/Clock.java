package io.github.genie.sonyflake.core.support;

@FunctionalInterface
public interface Clock {

    Clock DEFAULT = System::currentTimeMillis;

    /**
     * @return milliseconds since the Unix epoch
     */
    long now();

}
