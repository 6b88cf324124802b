package io.github.genie.sonyflake.core.support;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

public class SonyflakeConfig {

    public static final Instant DEFAULT_START_TIME = Instant.parse("2014-09-01T00:00:00Z");

    public static final String CONFIG_RESOURCE = "sonyflake.properties";
    public static final String START_TIME_KEY = "sonyflake.start-time";
    public static final String MACHINE_ID_KEY = "sonyflake.machine-id";

    private final Instant startTime;
    private final Integer machineId;
    private final Clock clock;
    private final NodeIdResolver nodeIdResolver;

    public SonyflakeConfig() {
        this(DEFAULT_START_TIME, null);
    }

    public SonyflakeConfig(Instant startTime, @Nullable Integer machineId) {
        this(startTime, machineId, Clock.DEFAULT, new InetAddressNodeIdResolver());
    }

    public SonyflakeConfig(Instant startTime,
                           @Nullable Integer machineId,
                           Clock clock,
                           NodeIdResolver nodeIdResolver) {
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.machineId = machineId;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nodeIdResolver = Objects.requireNonNull(nodeIdResolver, "nodeIdResolver");
    }

    /**
     * Reads {@value #CONFIG_RESOURCE} from the classpath, falling back to defaults
     * when the resource is absent.
     */
    public static SonyflakeConfig load() {
        ClassLoader cl = SonyflakeConfig.class.getClassLoader();
        InputStream inputStream = cl != null
                ? cl.getResourceAsStream(CONFIG_RESOURCE)
                : ClassLoader.getSystemResourceAsStream(CONFIG_RESOURCE);
        if (inputStream == null) {
            return new SonyflakeConfig();
        }
        Properties properties = new Properties();
        try (InputStream in = inputStream) {
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("load " + CONFIG_RESOURCE + " failed", e);
        }
        return from(properties);
    }

    public static SonyflakeConfig from(Properties properties) {
        Instant startTime = DEFAULT_START_TIME;
        String start = trimToNull(properties.getProperty(START_TIME_KEY));
        if (start != null) {
            try {
                startTime = Instant.parse(start);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("invalid " + START_TIME_KEY + ": " + start, e);
            }
        }
        Integer machineId = null;
        String machine = trimToNull(properties.getProperty(MACHINE_ID_KEY));
        if (machine != null) {
            try {
                machineId = Integer.valueOf(machine);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("invalid " + MACHINE_ID_KEY + ": " + machine, e);
            }
        }
        return new SonyflakeConfig(startTime, machineId);
    }

    public SonyflakeConfig withStartTime(Instant startTime) {
        return new SonyflakeConfig(startTime, machineId, clock, nodeIdResolver);
    }

    public SonyflakeConfig withMachineId(@Nullable Integer machineId) {
        return new SonyflakeConfig(startTime, machineId, clock, nodeIdResolver);
    }

    public SonyflakeConfig withClock(Clock clock) {
        return new SonyflakeConfig(startTime, machineId, clock, nodeIdResolver);
    }

    public SonyflakeConfig withNodeIdResolver(NodeIdResolver nodeIdResolver) {
        return new SonyflakeConfig(startTime, machineId, clock, nodeIdResolver);
    }

    @NotNull
    public Instant getStartTime() {
        return startTime;
    }

    @Nullable
    public Integer getMachineId() {
        return machineId;
    }

    @NotNull
    public Clock getClock() {
        return clock;
    }

    @NotNull
    public NodeIdResolver getNodeIdResolver() {
        return nodeIdResolver;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

}
