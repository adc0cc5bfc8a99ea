package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A node of a FUDG graph. Every variant shares the same topology: children, parents,
 * labeled edges in both directions, height, depth and the fragment (connected component)
 * the node belongs to. The topology lives in a separate {@link Topology} record so that
 * an aliased bundle can share its canonical bundle's record outright.
 */
public abstract class Node {
    static final Comparator<Node> BY_NAME = Comparator.comparing(Node::name);
    static final Comparator<Node> BY_HEIGHT = Comparator.comparingInt(Node::height).thenComparing(Node::name);
    static final Comparator<Node> BY_DEPTH = Comparator.comparingInt(Node::depth).thenComparing(Node::name);

    static final class Topology {
        final Set<Node> children = new LinkedHashSet<>();
        final Set<Node> parents = new LinkedHashSet<>();
        final Set<Edge> childEdges = new LinkedHashSet<>();
        final Set<Edge> parentEdges = new LinkedHashSet<>();
        int height = 0;  // length of longest path from this node to a leaf
        int depth = 0;  // length of longest path from a root of the fragment to this node
        Fragment fragment;
        Set<Node> parentCandidates;  // null until the downward pass
    }

    private final String name;
    Topology topology = new Topology();

    Node(String name) {
        this.name = name;
        topology.fragment = new Fragment(this);
    }

    public String name() { return name; }

    public Set<Node> children() { return Collections.unmodifiableSet(topology.children); }
    public Set<Node> parents() { return Collections.unmodifiableSet(topology.parents); }
    public Set<Edge> childEdges() { return Collections.unmodifiableSet(topology.childEdges); }
    public Set<Edge> parentEdges() { return Collections.unmodifiableSet(topology.parentEdges); }
    public int height() { return topology.height; }
    public int depth() { return topology.depth; }
    public Fragment fragment() { return topology.fragment; }

    public boolean isRoot() { return false; }
    public boolean isBundle() { return false; }

    /** Firm nodes are the ones a node can really attach to: anything but a bundle. */
    public boolean isFirm() { return !isBundle(); }

    /**
     * @return the nodes this node might attach to in some full resolution of the graph
     * @throws InvariantViolationException if the downward pass has not run
     */
    public Set<Node> parentCandidates() {
        if (topology.parentCandidates == null) {
            throw new InvariantViolationException("parent candidates of " + this + " have not been computed");
        }
        return topology.parentCandidates;
    }

    public boolean hasParentCandidates() { return topology.parentCandidates != null; }

    void setParentCandidates(Set<Node> candidates) { topology.parentCandidates = candidates; }

    /**
     * The real nodes that might turn out to be this node's head once the graph is resolved.
     * For anything but a bundle, that's just the node itself.
     */
    public Set<Node> possibleTops() { return ImmutableSet.of(this); }

    /** The name under which this node is written to a graph record. */
    public abstract String recordName();

    /** Attach {@code child} to this node as an ordinary dependent. */
    public void addChild(Node child) {
        link(child, EdgeLabel.PLAIN);
    }

    /**
     * Insert an edge from this node to {@code child}. Heights are raised along every path
     * upward from here; the two fragments are unified and all the depths in the unified
     * fragment are recomputed, since the new edge may change which roots reach which nodes.
     */
    void link(Node child, EdgeLabel label) {
        if (name.equals(child.name)) {
            throw new InvariantViolationException("cannot attach " + this + " to itself");
        }
        if (child.isRoot() && !(isBundle() && label.isMember())) {
            throw new InvariantViolationException("the root may only be attached as a bundle member, not as a dependent of " + this);
        }
        if (child.reaches(this)) {
            throw new CycleException("Adding " + child + " as a child of " + this + " would create a cycle!");
        }
        topology.children.add(child);
        topology.childEdges.add(new Edge(child, label));
        child.topology.parentEdges.add(new Edge(this, label));
        child.topology.parents.add(this);
        raiseHeight(child.height() + 1);

        Fragment f = fragment().absorb(child.fragment());
        f.demote(child);
        f.recomputeDepths();
    }

    /**
     * Remove every edge from this node to {@code child}.
     * @return the labels of the edges removed
     */
    List<EdgeLabel> unlink(Node child) {
        List<EdgeLabel> labels = topology.childEdges.stream()
                .filter(e -> e.node() == child)
                .map(Edge::label)
                .collect(Collectors.toList());
        for (EdgeLabel l : labels) {
            topology.childEdges.remove(new Edge(child, l));
            child.topology.parentEdges.remove(new Edge(this, l));
        }
        topology.children.remove(child);
        child.topology.parents.remove(this);
        return labels;
    }

    /** Re-create an edge to {@code child} carrying the given label. */
    void relink(Node child, EdgeLabel label) {
        if (label != EdgeLabel.PLAIN) {
            throw new InvariantViolationException(this + " cannot take a " + label + " edge to " + child);
        }
        addChild(child);
    }

    /** Move every edge from this node to {@code old} over to {@code replacement}, keeping labels. */
    void replaceChild(Node old, Node replacement) {
        for (EdgeLabel l : unlink(old)) relink(replacement, l);
    }

    void raiseHeight(int h) {
        if (topology.height < h) {
            topology.height = h;
            for (Node p : topology.parents) {
                p.raiseHeight(h + 1);
            }
        }
    }

    void raiseDepth(int d) {
        if (topology.depth < d) {
            topology.depth = d;
            for (Node c : topology.children) c.raiseDepth(d + 1);
        }
    }

    void resetDepth() { topology.depth = -1; }

    /** Is {@code target} this node or one of its descendants? */
    boolean reaches(Node target) {
        Deque<Node> stack = new ArrayDeque<>();
        Set<Node> seen = new LinkedHashSet<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            if (n == target) return true;
            if (seen.add(n)) n.topology.children.forEach(stack::push);
        }
        return false;
    }

    /** @return all nodes reachable from this one through child edges, not including this node */
    public Set<Node> descendants() {
        Set<Node> found = new LinkedHashSet<>();
        Deque<Node> stack = new ArrayDeque<>(topology.children);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            if (found.add(n)) n.topology.children.forEach(stack::push);
        }
        return found;
    }

    /** @return the tokens of every lexical node at or below this one */
    public Set<String> yield() {
        Set<String> tokens = new LinkedHashSet<>();
        collectYield(tokens);
        return tokens;
    }

    void collectYield(Set<String> into) {
        for (Node c : topology.children) c.collectYield(into);
    }

    static <T extends Node> List<T> sorted(Iterable<T> nodes, Comparator<? super T> order) {
        return ImmutableList.sortedCopyOf(order, nodes);
    }

    @Override
    public String toString() { return "<" + name + ">"; }
}
