package net.littleredcomputer.fudg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A connected component of the graph: its nodes and, among them, the ones with no parent.
 * Every node starts in a fragment of its own; fragments are unified whenever an edge joins
 * them, and never split.
 */
public final class Fragment {
    private final Set<Node> roots = new LinkedHashSet<>();
    private final Set<Node> nodes = new LinkedHashSet<>();

    Fragment(Node n) {
        roots.add(n);
        nodes.add(n);
    }

    public Set<Node> roots() { return Collections.unmodifiableSet(roots); }
    public Set<Node> nodes() { return Collections.unmodifiableSet(nodes); }
    public int size() { return nodes.size(); }

    /**
     * Merge {@code that} fragment into this one. Every node of the absorbed fragment is
     * repointed here before returning.
     * @return this fragment, which survives the merge
     */
    Fragment absorb(Fragment that) {
        if (that != this) {
            roots.addAll(that.roots);
            nodes.addAll(that.nodes);
            for (Node n : that.nodes) n.topology.fragment = this;
            that.roots.clear();
            that.nodes.clear();
        }
        return this;
    }

    /** {@code n} has acquired a parent. */
    void demote(Node n) { roots.remove(n); }

    void remove(Node n) {
        roots.remove(n);
        nodes.remove(n);
    }

    /** Depth is relative to the whole root set, so it is derived afresh for every node. */
    void recomputeDepths() {
        for (Node n : nodes) n.resetDepth();
        for (Node r : roots) r.raiseDepth(0);
    }

    @Override
    public String toString() { return "<Fragment@" + System.identityHashCode(this) + "> " + roots + " " + nodes; }
}
