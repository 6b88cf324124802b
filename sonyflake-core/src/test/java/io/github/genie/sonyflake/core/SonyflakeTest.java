package io.github.genie.sonyflake.core;

import io.github.genie.sonyflake.core.support.SonyflakeConfig;
import io.github.genie.sonyflake.core.support.SonyflakeId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SonyflakeTest {

    private static final Instant START_TIME = Instant.parse("2014-09-01T00:00:00Z");
    private static final Instant GENERATED_TIME = Instant.parse("2023-09-01T00:00:00Z");

    @Test
    void shouldGenerateNextIdFromSharedInstance() {
        Sonyflake.set(new SonyflakeConfig()
                .withStartTime(START_TIME)
                .withMachineId(1)
                .withClock(GENERATED_TIME::toEpochMilli));

        SonyflakeId expected = new SonyflakeId(
                GENERATED_TIME.toEpochMilli() - START_TIME.toEpochMilli(), 0, 1, START_TIME, GENERATED_TIME);
        assertEquals(expected, Sonyflake.parse(Sonyflake.next()));
        assertEquals(1, Sonyflake.parse(Sonyflake.next()).getSequence());
    }

    @Test
    void shouldReuseSharedInstanceUntilReplaced() {
        Sonyflake.set(SonyflakeConfig.load());
        assertSame(Sonyflake.getInstance(), Sonyflake.getInstance());
        assertEquals(7, Sonyflake.getInstance().getMachineId());

        Sonyflake.set(new SonyflakeConfig().withMachineId(8));
        assertEquals(8, Sonyflake.getInstance().getMachineId());
    }

}
