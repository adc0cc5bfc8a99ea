// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A fragmentary unlabeled dependency graph over a tokenized utterance. Nodes are built from
 * a {@link GraphRecord} in a fixed order: lexical nodes, then coordination nodes (whose
 * coordinators are lexical), then the members of multiword bundles, then every edge. Last,
 * bundles with identical members are unified.
 */
public class FudgGraph {
    private static final Logger log = LogManager.getFormatterLogger(FudgGraph.class);
    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<List<String>> EDGE_ORDER = (a, b) -> {
        for (int i = 0; i < 3; ++i) {
            int c = NULLS_FIRST.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return 0;
    };

    private final ImmutableList<String> tokens;
    private final RootNode root = new RootNode();
    private final Map<String, LexicalNode> tokenToLexical = new HashMap<>();
    private final Set<LexicalNode> lexicalNodes = new LinkedHashSet<>();
    private final Set<CoordinationNode> coordinationNodes = new LinkedHashSet<>();
    private final Set<CbbNode> bundles = new LinkedHashSet<>();
    private final Set<Node> nodes = new LinkedHashSet<>();  // the working set: no aliases, no simplified coordination
    private final Map<String, Node> nodesByName = new LinkedHashMap<>();  // names are never reassigned
    private final List<GraphRecord.NodeEdge> anaphoraLinks = new ArrayList<>();

    private FudgGraph(GraphRecord r) {
        tokens = ImmutableList.copyOf(r.tokens());
        register(RootNode.RECORD_NAME, root);

        List<String> coordinationNames = new ArrayList<>();
        List<CbbNode> multiwordBundles = new ArrayList<>();
        for (String name : r.nodes()) {
            if (name.equals(RootNode.RECORD_NAME)) continue;
            if (name.startsWith("MW(")) {
                List<String> words = r.words(name);
                if (words == null) throw new ConstructionException("no tokens recorded for multiword " + name);
                addLexical(name, innerName(name, 3), words);
            } else if (name.startsWith("W(")) {
                String inner = innerName(name, 2);
                List<String> words = r.words(name);
                addLexical(name, inner, words == null ? Collections.singletonList(inner) : words);
            } else if (name.startsWith("$")) {
                coordinationNames.add(name);
            } else if (name.startsWith("CBB")) {
                CbbNode n = new CbbNode(name);
                register(name, n);
                bundles.add(n);
                if (name.startsWith("CBBMW")) multiwordBundles.add(n);
            } else {
                throw new ConstructionException("unrecognized node name: " + name);
            }
        }

        // Coordination nodes depend on the lexical nodes of their coordinators.
        for (String name : coordinationNames) {
            List<List<String>> entries = r.extraWords(name);
            if (entries == null) throw new ConstructionException("no coordinators recorded for " + name);
            Set<Node> coordinators = new LinkedHashSet<>();
            for (List<String> entry : entries) {
                if (entry.size() != 2 || !"Coord".equals(entry.get(1))) {
                    throw new ConstructionException("malformed coordinator entry " + entry + " for " + name);
                }
                String token = entry.get(0);
                LexicalNode coordinator = tokenToLexical.get(token);
                // A coordinator inside a multiword resolves to the whole multiword.
                if (coordinator == null) coordinator = newLexical(token, Collections.singletonList(token));
                coordinators.add(coordinator);
            }
            CoordinationNode n = new CoordinationNode(name, coordinators);
            register(name, n);
            coordinationNodes.add(n);
        }

        for (CbbNode cbb : multiwordBundles) {
            List<String> words = r.words(cbb.name());
            if (words == null || words.isEmpty()) throw new ConstructionException("no tokens recorded for " + cbb);
            for (String w : words) {
                String lexName = "W(" + w + ")";
                if (!nodesByName.containsKey(lexName)) addLexical(lexName, w, Collections.singletonList(w));
                cbb.addMember(nodesByName.get(lexName), false);
            }
        }

        nodes.add(root);
        nodes.addAll(lexicalNodes);
        nodes.addAll(coordinationNodes);
        nodes.addAll(bundles);

        for (GraphRecord.NodeEdge e : r.edges()) {
            Node p = lookup(e.parent());
            Node c = lookup(e.child());
            switch (e.label()) {
                case CONJ:
                    if (!(p instanceof CoordinationNode)) throw new ConstructionException("Conj edge from non-coordination node " + p);
                    ((CoordinationNode) p).addConjunct(c);
                    break;
                case UNSPEC:
                case TOP:
                    if (!(p instanceof CbbNode)) throw new ConstructionException(e.label() + " edge from non-bundle node " + p);
                    ((CbbNode) p).addMember(c, e.label() == EdgeLabel.TOP);
                    break;
                case ANAPH:
                    anaphoraLinks.add(e);  // kept for output only
                    break;
                default:
                    p.addChild(c);
            }
        }

        unifyBundles();
        if (lexicalNodes.isEmpty()) throw new ConstructionException("graph has no lexical nodes");
    }

    public static FudgGraph fromRecord(GraphRecord r) { return new FudgGraph(r); }

    public static FudgGraph parseFrom(Reader r) { return fromRecord(GraphRecord.parseFrom(r)); }

    public static FudgGraph parseFrom(String s) { return fromRecord(GraphRecord.parseFrom(s)); }

    private static String innerName(String name, int prefix) {
        if (!name.endsWith(")") || name.length() <= prefix + 1) throw new ConstructionException("malformed node name: " + name);
        return name.substring(prefix, name.length() - 1);
    }

    private void register(String name, Node n) {
        Node existing = nodesByName.putIfAbsent(name, n);
        if (existing != null) {
            throw new ConstructionException(String.format("cannot reassign node name %s (current: %s, new: %s)", name, existing, n));
        }
    }

    private LexicalNode newLexical(String name, List<String> words) {
        LexicalNode n = new LexicalNode(name, ImmutableSet.copyOf(words));
        for (String t : n.tokens()) {
            if (!tokens.contains(t)) throw new ConstructionException("token " + t + " of " + n + " is not in the utterance");
            LexicalNode owner = tokenToLexical.putIfAbsent(t, n);
            if (owner != null) throw new ConstructionException("token " + t + " belongs to both " + owner + " and " + n);
        }
        lexicalNodes.add(n);
        return n;
    }

    private void addLexical(String recordName, String name, List<String> words) {
        register(recordName, newLexical(name, words));
    }

    private Node lookup(String name) {
        Node n = nodesByName.get(name);
        if (n == null) throw new ConstructionException("unknown node: " + name);
        return n;
    }

    /**
     * Compare bundles pairwise in name order; a bundle whose members equal those of an
     * earlier one becomes its alias and leaves the working set.
     */
    private void unifyBundles() {
        List<CbbNode> cbbs = new ArrayList<>(bundles);
        cbbs.sort(Node.BY_NAME);
        for (int i = 0; i < cbbs.size(); ++i) {
            for (int h = 0; h < i; ++h) {
                CbbNode earlier = cbbs.get(h);
                if (earlier != null && earlier.members().equals(cbbs.get(i).members())) {
                    CbbNode alias = cbbs.get(i);
                    alias.mergeInto(earlier);
                    bundles.remove(alias);
                    nodes.remove(alias);
                    cbbs.set(i, null);
                    break;
                }
            }
        }
    }

    public RootNode root() { return root; }
    public ImmutableList<String> tokens() { return tokens; }
    public Set<Node> nodes() { return Collections.unmodifiableSet(nodes); }
    public Set<LexicalNode> lexicalNodes() { return Collections.unmodifiableSet(lexicalNodes); }
    public Set<CoordinationNode> coordinationNodes() { return Collections.unmodifiableSet(coordinationNodes); }

    /** @return the bundles of the working set (aliases excluded) */
    public Set<CbbNode> bundles() { return Collections.unmodifiableSet(bundles); }

    /** @return every node of the working set that is not a bundle */
    public Set<Node> firmNodes() {
        return nodes.stream().filter(Node::isFirm).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Resolve a node by its declared name. Aliased bundles remain resolvable.
     * @throws IllegalArgumentException if no node was declared under that name
     */
    public Node node(String name) {
        Node n = nodesByName.get(name);
        if (n == null) throw new IllegalArgumentException("unknown node: " + name);
        return n;
    }

    public Optional<LexicalNode> lexicalNodeOf(String token) {
        return Optional.ofNullable(tokenToLexical.get(token));
    }

    void removeCoordination(CoordinationNode n) {
        nodes.remove(n);
        coordinationNodes.remove(n);
    }

    /**
     * Look for a node whose yield is not contiguous. Only tokens belonging to fragments of
     * more than one node take part: a node is projective if the positions of its yield
     * among those tokens form an unbroken range.
     * @return the first non-projective node in name order, if any
     */
    public Optional<Node> nonProjectiveNode() {
        TObjectIntHashMap<String> offsets = new TObjectIntHashMap<>(tokens.size(), 0.5f, -1);
        int k = 0;
        for (String t : tokens) {
            LexicalNode l = tokenToLexical.get(t);
            if (l == null || l.fragment().size() < 2) continue;
            if (!offsets.containsKey(t)) offsets.put(t, k);
            ++k;
        }
        for (Node n : Node.sorted(nodes, Node.BY_NAME)) {
            if (n.isRoot() || n.fragment().size() < 2) continue;
            Set<String> y = n.yield();
            if (y.isEmpty()) continue;
            TIntHashSet positions = new TIntHashSet();
            for (String t : y) positions.add(offsets.get(t));
            int[] ps = positions.toArray();
            int min = Integer.MAX_VALUE, max = Integer.MIN_VALUE;
            for (int p : ps) {
                min = Math.min(min, p);
                max = Math.max(max, p);
            }
            if (max - min != ps.length - 1) {
                log.debug("nonprojective: %s yields offsets %s", n, new TreeSet<>(Ints.asList(ps)));
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public boolean isProjective() { return !nonProjectiveNode().isPresent(); }

    /**
     * Write the graph back out as a record. Aliased bundles report their canonical name,
     * the members of multiword bundles are written as that bundle's tokens rather than as
     * edges, and the root appears only if it is attached to something.
     */
    public GraphRecord toRecord() {
        GraphRecord out = new GraphRecord().addTokens(tokens.toArray(new String[0]));
        Set<List<String>> edges = new LinkedHashSet<>();
        for (Node n : nodes) {
            for (Edge e : n.parentEdges()) {
                if (e.node().name().startsWith("CBBMW")) continue;
                edges.add(new GraphRecord.NodeEdge(e.node().recordName(), n.recordName(), e.label()).toList());
            }
        }
        for (GraphRecord.NodeEdge a : anaphoraLinks) {
            edges.add(new GraphRecord.NodeEdge(lookup(a.parent()).recordName(), lookup(a.child()).recordName(), EdgeLabel.ANAPH).toList());
        }
        boolean rootAttached = !root.children().isEmpty() || !root.parents().isEmpty();
        Set<String> names = new TreeSet<>();
        for (Node n : nodes) {
            if (n == root && !rootAttached) continue;
            names.add(n.recordName());
        }
        for (String name : names) out.addNode(name);

        Comparator<String> byPosition = Comparator.comparingInt(tokens::indexOf);
        for (LexicalNode l : Node.sorted(lexicalNodes, Node.BY_NAME)) {
            out.setWords(l.recordName(), l.tokens().stream().sorted(byPosition).collect(Collectors.toList()));
        }
        if (rootAttached) out.setWords(root.recordName(), Collections.singletonList(RootNode.NAME));
        for (CbbNode cbb : Node.sorted(bundles, Node.BY_NAME)) {
            if (!cbb.name().startsWith("CBBMW")) continue;
            out.setWords(cbb.name(), cbb.members().stream()
                    .flatMap(m -> m.yield().stream())
                    .sorted(byPosition)
                    .collect(Collectors.toList()));
        }
        edges.stream()
                .sorted(EDGE_ORDER)
                .forEach(e -> out.addEdge(e.get(0), e.get(1), EdgeLabel.fromRecord(e.get(2))));
        return out;
    }
}
