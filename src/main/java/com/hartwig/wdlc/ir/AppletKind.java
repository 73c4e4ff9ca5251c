package com.hartwig.wdlc.ir;

/**
 * Native: an existing platform applet, referenced by id. WfFragment: a workflow fragment, possibly with nested
 * scatter and conditional blocks. Task: runs the command of a task.
 */
public interface AppletKind {
    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitNative(AppletKindNative kind);

        T visitWfFragment(AppletKindWfFragment kind);

        T visitTask(AppletKindTask kind);
    }
}
