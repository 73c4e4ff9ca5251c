package com.hartwig.wdlc.ir;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * One job the platform starts for an applet.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ExecutionStage {
    String name();

    InstanceType instanceType();

    /**
     * Stage that evaluates the instance type this stage is pinned to. Only set for runtime instance types.
     */
    Optional<String> instanceFrom();

    /**
     * Shell commands that prepare the docker image before the command runs.
     */
    List<String> setupCommands();

    /**
     * Whether this stage runs the command of the task.
     */
    boolean runsCommand();

    static ImmutableExecutionStage.Builder builder() {
        return ImmutableExecutionStage.builder();
    }
}
