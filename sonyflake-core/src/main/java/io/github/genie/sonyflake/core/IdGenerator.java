package io.github.genie.sonyflake.core;

public interface IdGenerator {

    long nextId();

}
