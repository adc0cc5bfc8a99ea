package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Characterizes the legal resolutions of an underspecified graph in two passes.
 * <p>
 * The upward pass visits bundles bottom-up and computes, for each, the real nodes that
 * might be its head (its <i>top candidates</i>). The downward pass visits every non-root
 * node top-down and computes the real nodes it might attach to (its <i>parent
 * candidates</i>), starting from every firm node that is not a descendant and narrowing by
 * each incoming edge:
 * <ul>
 *     <li>an edge from a firm node pins the attachment to that node;</li>
 *     <li>an edge from a bundle the node modifies leads to one of the bundle's top
 *     candidates;</li>
 *     <li>a member of a bundle either is the bundle's head, and attaches wherever the bundle
 *     does, or is not, and attaches to whichever sibling is.</li>
 * </ul>
 * Coordination must have been simplified away before either pass runs.
 */
public class CandidatePropagation {
    private static final Logger log = LogManager.getFormatterLogger(CandidatePropagation.class);

    public enum Trace {UPWARD, DOWNWARD}

    private final FudgGraph graph;
    private EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);

    public CandidatePropagation(FudgGraph graph) {
        this.graph = graph;
    }

    public CandidatePropagation setTracing(EnumSet<Trace> tracing) {
        this.tracing = EnumSet.copyOf(tracing);
        return this;
    }

    /** Run the upward pass, then the downward pass. */
    public void run() {
        upward();
        downward();
    }

    private static void checkSimplified(Node n) {
        if (n instanceof CoordinationNode) {
            throw new InvariantViolationException("coordination node " + n + " must be simplified before propagating candidates");
        }
    }

    private static Set<Node> ordered(Set<Node> nodes) {
        return Node.sorted(nodes, Node.BY_NAME).stream().collect(ImmutableSet.toImmutableSet());
    }

    /**
     * For each bundle, in increasing order of height, find the real nodes that might be its
     * top in a full analysis. A designated top settles it; otherwise any unspecified member
     * might be the top (or, if the member is a bundle, any of its top candidates).
     */
    public void upward() {
        for (Node n : Node.sorted(graph.nodes(), Node.BY_HEIGHT)) {
            checkSimplified(n);
            if (!(n instanceof CbbNode)) continue;
            CbbNode b = (CbbNode) n;
            List<Node> tops = b.childEdges().stream()
                    .filter(e -> e.label() == EdgeLabel.TOP)
                    .map(Edge::node)
                    .collect(Collectors.toList());
            if (tops.size() > 1) throw new ConstructionException("CBB can only have one specified top: " + b + " has " + tops);

            Set<Node> candidates = new LinkedHashSet<>();
            if (tops.size() == 1) {
                candidates.addAll(tops.get(0).possibleTops());
            } else {
                for (Edge e : b.childEdges()) {
                    if (e.label() == EdgeLabel.UNSPEC) candidates.addAll(e.node().possibleTops());
                }
            }
            if (candidates.contains(b)) throw new InvariantViolationException(b + " is among its own top candidates");
            if (candidates.stream().anyMatch(Node::isBundle)) {
                throw new InvariantViolationException("top candidates of " + b + " include a bundle: " + candidates);
            }
            b.setTopCandidates(ordered(candidates));
            if (tracing.contains(Trace.UPWARD)) log.trace("%s top candidates %s", b, b.topCandidates());
        }
    }

    /**
     * For each non-root node, in increasing order of depth, find the real nodes it might
     * attach to in a full analysis.
     * @throws WellFormednessException if some node could attach nowhere
     */
    public void downward() {
        final Set<Node> firm = graph.firmNodes();
        for (Node n : Node.sorted(graph.nodes(), Node.BY_DEPTH)) {
            checkSimplified(n);
            if (n.isRoot()) continue;
            Set<Node> candidates = new LinkedHashSet<>(firm);
            candidates.remove(n);
            candidates.removeAll(n.descendants());
            if (candidates.isEmpty()) throw new WellFormednessException(n.name());

            for (Edge e : n.parentEdges()) {
                Node p = e.node();
                if (p instanceof CbbNode) {
                    CbbNode b = (CbbNode) p;
                    if (b.members().contains(n)) {
                        Set<Node> ours = n.possibleTops();
                        Set<Node> cands = new LinkedHashSet<>();
                        if (!Sets.intersection(b.topCandidates(), ours).isEmpty()) {
                            // n (or its top) might be the top of the bundle
                            cands.addAll(b.parentCandidates());
                        }
                        if (!b.topCandidates().equals(ours)) {
                            // n might not be the top of the bundle, and so attach to whichever sibling is
                            for (Node sibling : b.members()) {
                                if (sibling != n) cands.addAll(sibling.possibleTops());
                            }
                        }
                        candidates.retainAll(cands);
                    } else if (b.externalChildren().contains(n)) {
                        // The edge modifies the bundle: it lands on whichever node is its top.
                        candidates.retainAll(b.topCandidates());
                    } else {
                        throw new InvariantViolationException(n + " is neither a member nor a dependent of " + b);
                    }
                } else {
                    // An edge from a firm node is for real.
                    candidates.retainAll(ImmutableSet.of(p));
                }
                if (tracing.contains(Trace.DOWNWARD)) log.trace("  %s after %s: %s", n, e, candidates);
            }
            if (candidates.isEmpty()) throw new WellFormednessException(n.name());
            n.setParentCandidates(ordered(candidates));
            if (tracing.contains(Trace.DOWNWARD)) log.trace("%s parent candidates %s", n, n.parentCandidates());
        }
    }
}
