package com.hartwig.wdlc.ir;

import java.util.List;

/**
 * A unified type for applets and workflows. Workflows call other workflows and applets with the same syntax.
 */
public interface Callable {
    String name();

    List<CVar> inputs();

    List<CVar> outputs();

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitApplet(Applet applet);

        T visitWorkflow(Workflow workflow);
    }
}
