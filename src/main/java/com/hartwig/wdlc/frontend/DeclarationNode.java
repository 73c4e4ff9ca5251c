package com.hartwig.wdlc.frontend;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface DeclarationNode extends GraphNode {
    @Value.Parameter
    String name();

    @Override
    default <T> T accept(final Visitor<T> visitor) {
        return visitor.visitDeclaration(this);
    }

    static DeclarationNode of(String name) {
        return ImmutableDeclarationNode.of(name);
    }
}
