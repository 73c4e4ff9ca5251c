package com.hartwig.wdlc.ir;

import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.hartwig.wdlc.wdl.WdlType;
import com.hartwig.wdlc.wdl.WdlValue;

import org.immutables.value.Value;

/**
 * Compile time representation of a variable, also used as an applet argument.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface CVar {
    String name();

    WdlType type();

    /**
     * Platform specific hints for the input/output specification, such as help, suggestions or patterns.
     */
    Map<String, String> attributes();

    Optional<WdlValue> defaultValue();

    /**
     * The platform does not allow dots in variable names, they are replaced by underscores. Two names can map onto
     * the same safe name, see {@link Callables#safeNameCollisions}.
     */
    default String safeName() {
        return name().replace(".", "___");
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(!name().isBlank(), "Variable name must not be empty");
    }

    static CVar of(String name, WdlType type) {
        return builder().name(name).type(type).build();
    }

    static ImmutableCVar.Builder builder() {
        return ImmutableCVar.builder();
    }
}
