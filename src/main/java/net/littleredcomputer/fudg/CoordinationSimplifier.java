package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Removes coordination nodes from a graph. Each one is replaced by one of its coordinators
 * (the one with the smallest name), which takes the other coordinators, the conjuncts and
 * the modifiers of the structure as ordinary children, and inherits its incoming edges.
 */
public class CoordinationSimplifier {
    private static final Logger log = LogManager.getFormatterLogger(CoordinationSimplifier.class);
    private final FudgGraph graph;
    private final Map<CoordinationNode, Node> heads = new HashMap<>();
    private final Set<CoordinationNode> inProgress = new HashSet<>();

    public CoordinationSimplifier(FudgGraph graph) {
        this.graph = graph;
    }

    /** Simplify every coordination node, in increasing order of height. */
    public void simplify() {
        for (CoordinationNode n : Node.sorted(graph.coordinationNodes(), Node.BY_HEIGHT)) {
            headOf(n);
        }
    }

    /** @return the coordinator chosen to replace {@code n}, simplifying {@code n} if need be */
    public Node headOf(CoordinationNode n) {
        Node h = heads.get(n);
        if (h != null) return h;
        if (!inProgress.add(n)) throw new InvariantViolationException("coordination " + n + " contains itself");

        final int formerDepth = n.depth();
        // Arbitrary but consistent choice.
        final Node newHead = Node.sorted(n.coordinators(), Node.BY_NAME).get(0);
        int maxHeight = Integer.MIN_VALUE;
        boolean reattached = false;

        for (Node c : Node.sorted(Sets.union(n.coordinators(), n.conjuncts()), Node.BY_NAME)) {
            if (c == newHead) continue;
            // A nested coordination is attached through its own head.
            Node d = c instanceof CoordinationNode ? headOf((CoordinationNode) c) : c;
            maxHeight = Math.max(maxHeight, d.height());
            newHead.addChild(d);
            reattached = true;
        }
        for (Node m : Node.sorted(n.children(), Node.BY_NAME)) {  // modifiers
            n.unlink(m);
            maxHeight = Math.max(maxHeight, m.height());
            newHead.addChild(m);
            reattached = true;
        }
        if (reattached && newHead.height() != maxHeight + 1) {
            throw new InvariantViolationException(String.format(
                    "inconsistent coordination %s: head %s has height %d but its tallest new child has height %d",
                    n, newHead, newHead.height(), maxHeight));
        }

        for (Node p : ImmutableList.copyOf(n.parents())) p.replaceChild(n, newHead);
        // Whether n was a root or not, its fragment's root set may have changed.
        Fragment f = n.fragment();
        f.remove(n);
        f.recomputeDepths();
        if (newHead.depth() != formerDepth) {
            // This happens legitimately when the coordinator is also a member of a bundle, and so
            // keeps a greater depth than the coordination node it replaces.
            log.warn("head %s of %s has depth %d, coordination had depth %d", newHead, n, newHead.depth(), formerDepth);
        }

        graph.removeCoordination(n);
        inProgress.remove(n);
        heads.put(n, newHead);
        return newHead;
    }
}
