package net.littleredcomputer.fudg;

import java.util.Objects;

/**
 * One half of a labeled edge: the node at the other end and the label. A node's child
 * edges hold its children; its parent edges hold its parents.
 */
public final class Edge {
    private final Node node;
    private final EdgeLabel label;

    Edge(Node node, EdgeLabel label) {
        this.node = node;
        this.label = label;
    }

    public Node node() { return node; }
    public EdgeLabel label() { return label; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge e = (Edge) o;
        return node == e.node && label == e.label;
    }

    @Override
    public int hashCode() { return Objects.hash(System.identityHashCode(node), label); }

    @Override
    public String toString() { return "(" + node + ", " + label + ")"; }
}
