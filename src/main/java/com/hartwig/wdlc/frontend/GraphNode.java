package com.hartwig.wdlc.frontend;

public interface GraphNode {
    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitCall(CallNode node);

        T visitScatter(ScatterNode node);

        T visitConditional(ConditionalNode node);

        T visitDeclaration(DeclarationNode node);
    }
}
