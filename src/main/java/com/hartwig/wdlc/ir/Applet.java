package com.hartwig.wdlc.ir;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.hartwig.wdlc.frontend.TaskDefinition;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Applet extends Callable {
    @Override
    String name();

    @Override
    List<CVar> inputs();

    @Override
    List<CVar> outputs();

    InstanceType instanceType();

    DockerImage docker();

    AppletKind kind();

    /**
     * The task this applet was compiled from. Required for task applets.
     */
    Optional<TaskDefinition> task();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitApplet(this);
    }

    @Value.Check
    default void check() {
        Callables.checkNames(this);
        var runsTask = kind().accept(new AppletKind.Visitor<Boolean>() {
            @Override
            public Boolean visitNative(final AppletKindNative kind) {
                return false;
            }

            @Override
            public Boolean visitWfFragment(final AppletKindWfFragment kind) {
                return false;
            }

            @Override
            public Boolean visitTask(final AppletKindTask kind) {
                return true;
            }
        });
        Preconditions.checkArgument(!runsTask || task().isPresent(),
                "Task applet '%s' needs a task definition",
                name());
    }

    static ImmutableApplet.Builder builder() {
        return ImmutableApplet.builder();
    }
}
