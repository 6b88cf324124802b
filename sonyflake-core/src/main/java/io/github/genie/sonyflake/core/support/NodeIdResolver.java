package io.github.genie.sonyflake.core.support;

import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface NodeIdResolver {

    /**
     * @return a node id in {@code [0, 65536)}, or {@code null} if none can be determined
     */
    @Nullable
    Integer resolveNodeId();

}
