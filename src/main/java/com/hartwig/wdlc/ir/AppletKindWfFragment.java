package com.hartwig.wdlc.ir;

import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface AppletKindWfFragment extends AppletKind {
    /**
     * Call name inside the fragment to the name of the callable it invokes.
     */
    @Value.Parameter
    Map<String, String> calls();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitWfFragment(this);
    }

    static AppletKindWfFragment of(Map<String, String> calls) {
        return ImmutableAppletKindWfFragment.of(calls);
    }
}
