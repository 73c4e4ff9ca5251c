package com.hartwig.wdlc.ir;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface AppletKindNative extends AppletKind {
    @Value.Parameter
    String id();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitNative(this);
    }

    static AppletKindNative of(String id) {
        return ImmutableAppletKindNative.of(id);
    }
}
