package io.github.genie.sonyflake.core;

import io.github.genie.sonyflake.core.log.Log;
import io.github.genie.sonyflake.core.support.SonyflakeConfig;
import io.github.genie.sonyflake.core.support.SonyflakeId;
import io.github.genie.sonyflake.core.support.SonyflakeIdGenerator;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide shared generator. The instance is created on first use from
 * {@link SonyflakeConfig#load()} and can be replaced with {@link #set(SonyflakeConfig)}.
 * Prefer owning a {@link SonyflakeIdGenerator} where the lifecycle is under your control.
 */
public final class Sonyflake {

    private static final Log log = Log.get(Sonyflake.class);
    private static final Lock lock = new ReentrantLock();
    private static volatile SonyflakeIdGenerator instance;

    private Sonyflake() {
    }

    public static void set(SonyflakeConfig config) {
        SonyflakeIdGenerator generator = new SonyflakeIdGenerator(config);
        lock.lock();
        try {
            instance = generator;
        } finally {
            lock.unlock();
        }
        log.info(() -> "default generator replaced, machine id " + generator.getMachineId());
    }

    public static long next() {
        return getInstance().nextId();
    }

    public static SonyflakeId parse(long id) {
        return getInstance().parse(id);
    }

    public static SonyflakeIdGenerator getInstance() {
        SonyflakeIdGenerator generator = instance;
        if (generator == null) {
            lock.lock();
            try {
                generator = instance;
                if (generator == null) {
                    generator = new SonyflakeIdGenerator(SonyflakeConfig.load());
                    instance = generator;
                }
            } finally {
                lock.unlock();
            }
        }
        return generator;
    }

}
