package io.github.genie.sonyflake.core.support;

import java.time.Instant;
import java.util.Objects;

/**
 * Fields decoded from a sonyflake id.
 */
public class SonyflakeId {

    private final long timestamp;
    private final int sequence;
    private final int machineId;
    private final Instant startTime;
    private final Instant generatedTime;

    public SonyflakeId(long timestamp, int sequence, int machineId, Instant startTime, Instant generatedTime) {
        this.timestamp = timestamp;
        this.sequence = sequence;
        this.machineId = machineId;
        this.startTime = startTime;
        this.generatedTime = generatedTime;
    }

    /**
     * @return milliseconds between the start time and the tick the id was minted in
     */
    public long getTimestamp() {
        return timestamp;
    }

    public int getSequence() {
        return sequence;
    }

    public int getMachineId() {
        return machineId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getGeneratedTime() {
        return generatedTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SonyflakeId)) {
            return false;
        }
        SonyflakeId that = (SonyflakeId) o;
        return timestamp == that.timestamp
               && sequence == that.sequence
               && machineId == that.machineId
               && startTime.equals(that.startTime)
               && generatedTime.equals(that.generatedTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, sequence, machineId, startTime, generatedTime);
    }

    @Override
    public String toString() {
        return "SonyflakeId{" +
               "timestamp=" + timestamp +
               ", sequence=" + sequence +
               ", machineId=" + machineId +
               ", startTime=" + startTime +
               ", generatedTime=" + generatedTime +
               '}';
    }

}
