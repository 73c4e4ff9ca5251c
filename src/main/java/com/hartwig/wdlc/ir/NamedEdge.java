package com.hartwig.wdlc.ir;

import org.jgrapht.graph.DefaultEdge;

class NamedEdge extends DefaultEdge {
    private final String name;

    /**
     * @param label name of the call this edge stands for.
     */
    public NamedEdge(String label) {
        this.name = label;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "(" + getSource() + " : " + getTarget() + " : " + name + ")";
    }
}
