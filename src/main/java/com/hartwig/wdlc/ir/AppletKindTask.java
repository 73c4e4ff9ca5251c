package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable(singleton = true)
@Value.Style(jdkOnly = true)
public interface AppletKindTask extends AppletKind {
    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitTask(this);
    }

    static AppletKindTask instance() {
        return ImmutableAppletKindTask.of();
    }
}
