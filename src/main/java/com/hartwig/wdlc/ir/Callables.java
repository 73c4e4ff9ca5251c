package com.hartwig.wdlc.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Callables {
    private static final Logger LOGGER = LoggerFactory.getLogger(Callables.class);

    private Callables() {
    }

    static void checkNames(Callable callable) {
        Preconditions.checkArgument(!callable.name().isBlank(), "Callable name must not be empty");
        checkUnique(callable.name(), "input", callable.inputs());
        checkUnique(callable.name(), "output", callable.outputs());
        for (List<String> collision : safeNameCollisions(callable.inputs())) {
            LOGGER.warn("[{}] Inputs {} share the same platform name", callable.name(), collision);
        }
        for (List<String> collision : safeNameCollisions(callable.outputs())) {
            LOGGER.warn("[{}] Outputs {} share the same platform name", callable.name(), collision);
        }
    }

    /**
     * Groups of variable names that map onto the same {@link CVar#safeName()}. Empty if there are no collisions.
     */
    public static List<List<String>> safeNameCollisions(List<CVar> variables) {
        Map<String, List<String>> namesBySafeName = new LinkedHashMap<>();
        for (CVar variable : variables) {
            namesBySafeName.computeIfAbsent(variable.safeName(), key -> new ArrayList<>()).add(variable.name());
        }
        var collisions = new ArrayList<List<String>>();
        for (List<String> names : namesBySafeName.values()) {
            if (names.size() > 1) {
                collisions.add(List.copyOf(names));
            }
        }
        return collisions;
    }

    private static void checkUnique(String callableName, String section, List<CVar> variables) {
        var seen = new HashSet<String>();
        for (CVar variable : variables) {
            if (!seen.add(variable.name())) {
                throw new IllegalArgumentException(String.format("Callable '%s' has duplicate %s '%s'",
                        callableName,
                        section,
                        variable.name()));
            }
        }
    }
}
