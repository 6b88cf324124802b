package io.github.genie.sonyflake.core.support;

import io.github.genie.sonyflake.core.IdGenerator;
import io.github.genie.sonyflake.core.log.Log;

import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sonyflake id generator. An id is laid out, from the most significant bit, as
 * <pre>
 * | 1 unused | 39 timestamp (10ms ticks) | 8 sequence | 16 machine id |
 * </pre>
 * {@link #nextId()} is serialized on an internal lock.
 */
public class SonyflakeIdGenerator implements IdGenerator {

    public static final int TIMESTAMP_BITS = 39;
    public static final int SEQUENCE_BITS = 8;
    public static final int MACHINE_ID_BITS = 16;

    public static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + MACHINE_ID_BITS;
    public static final int SEQUENCE_SHIFT = MACHINE_ID_BITS;

    public static final long TIMESTAMP_MASK = (1L << TIMESTAMP_BITS) - 1;
    public static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;
    public static final long MACHINE_ID_MASK = (1L << MACHINE_ID_BITS) - 1;

    public static final long TICK_MILLIS = 10;

    private final Log log = Log.get(SonyflakeIdGenerator.class);
    private final Lock lock = new ReentrantLock();

    private final Instant startTime;
    private final long startStamp;
    private final int machineId;
    private final Clock clock;

    private long lastTimestamp;
    private long sequence;

    public SonyflakeIdGenerator() {
        this(new SonyflakeConfig());
    }

    public SonyflakeIdGenerator(int machineId) {
        this(SonyflakeConfig.DEFAULT_START_TIME, machineId);
    }

    public SonyflakeIdGenerator(Instant startTime, int machineId) {
        this(new SonyflakeConfig(startTime, machineId));
    }

    public SonyflakeIdGenerator(SonyflakeConfig config) {
        this.startTime = config.getStartTime();
        this.startStamp = startTime.toEpochMilli();
        this.clock = config.getClock();
        this.machineId = requireValidMachineId(resolveMachineId(config));
        log.debug(() -> "machine id " + machineId + ", start time " + startTime);
    }

    private static Integer resolveMachineId(SonyflakeConfig config) {
        Integer machineId = config.getMachineId();
        if (machineId == null) {
            machineId = config.getNodeIdResolver().resolveNodeId();
        }
        if (machineId == null) {
            throw new ConfigurationException("Cannot get machine id");
        }
        return machineId;
    }

    private static int requireValidMachineId(int machineId) {
        if (machineId < 0 || machineId > MACHINE_ID_MASK) {
            throw new ConfigurationException("Machine id must be between 0 and 2 ** 16 - 1");
        }
        return machineId;
    }

    @Override
    public long nextId() {
        lock.lock();
        try {
            return computeNext();
        } finally {
            lock.unlock();
        }
    }

    private long computeNext() {
        long timestamp = elapsedTimestamp();
        if (timestamp < lastTimestamp) {
            long last = lastTimestamp;
            log.warn(() -> "clock moved backwards, last tick " + last + ", current tick " + timestamp);
            throw new ClockMovedBackwardsException(last, timestamp);
        }
        long current = timestamp;
        if (current == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                log.trace(() -> "sequence exhausted in tick " + lastTimestamp + ", waiting for next tick");
                current = awaitNextTimestamp();
            }
        } else {
            sequence = 0;
        }
        lastTimestamp = current;
        return current << TIMESTAMP_SHIFT | sequence << SEQUENCE_SHIFT | machineId;
    }

    private long awaitNextTimestamp() {
        long timestamp = elapsedTimestamp();
        while (timestamp <= lastTimestamp) {
            Thread.onSpinWait();
            timestamp = elapsedTimestamp();
        }
        return timestamp;
    }

    private long elapsedTimestamp() {
        long timestamp = (clock.now() - startStamp) / TICK_MILLIS;
        if (timestamp > TIMESTAMP_MASK) {
            throw new TimestampOverflowException();
        }
        return timestamp;
    }

    public SonyflakeId parse(long id) {
        long timestamp = (id >>> TIMESTAMP_SHIFT) * TICK_MILLIS;
        int sequence = (int) ((id >>> SEQUENCE_SHIFT) & SEQUENCE_MASK);
        int machineId = (int) (id & MACHINE_ID_MASK);
        return new SonyflakeId(timestamp, sequence, machineId, startTime, startTime.plusMillis(timestamp));
    }

    /**
     * @param id unsigned decimal form, as produced by {@link #toString(long)}
     */
    public SonyflakeId parse(String id) {
        try {
            return parse(Long.parseUnsignedLong(id));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an unsigned 64-bit id: " + id, e);
        }
    }

    public static String toString(long id) {
        return Long.toUnsignedString(id);
    }

    /**
     * @return epoch milliseconds of the tick the id was minted in
     */
    public long getTime(long id) {
        return (id >>> TIMESTAMP_SHIFT) * TICK_MILLIS + startStamp;
    }

    public int getMachineId() {
        return machineId;
    }

    public Instant getStartTime() {
        return startTime;
    }

}
