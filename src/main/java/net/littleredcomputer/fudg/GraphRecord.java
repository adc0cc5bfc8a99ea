package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import javax.annotation.Nullable;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The exchange form of a FUDG graph: the tokens of the utterance, the declared node names,
 * the tokens of lexical (and multiword bundle) nodes, the coordinators of coordination
 * nodes and a list of labeled edges. Node names follow a convention: {@code W(x)} is a
 * single-token lexical node, {@code MW(x)} a multiword, {@code CBB...} a bundle,
 * {@code CBBMW...} a multiword relaxed to a bundle, {@code $...} a coordination node and
 * {@code W($$)} the root.
 */
public final class GraphRecord {
    private static final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private List<String> tokens = new ArrayList<>();
    private List<String> nodes = new ArrayList<>();
    private Map<String, List<String>> node2words = new LinkedHashMap<>();
    @SerializedName("extra_node2words")
    private Map<String, List<List<String>>> extraNode2words = new LinkedHashMap<>();
    @SerializedName("node_edges")
    private List<List<String>> nodeEdges = new ArrayList<>();

    /** An edge triple as it appears in a record. */
    public static final class NodeEdge {
        private final String parent;
        private final String child;
        private final EdgeLabel label;

        NodeEdge(String parent, String child, EdgeLabel label) {
            this.parent = parent;
            this.child = child;
            this.label = label;
        }

        public String parent() { return parent; }
        public String child() { return child; }
        public EdgeLabel label() { return label; }

        List<String> toList() { return Arrays.asList(parent, child, label.recordName()); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NodeEdge)) return false;
            NodeEdge e = (NodeEdge) o;
            return parent.equals(e.parent) && child.equals(e.child) && label == e.label;
        }

        @Override
        public int hashCode() { return Objects.hash(parent, child, label); }

        @Override
        public String toString() { return toList().toString(); }
    }

    public GraphRecord() {}

    public static GraphRecord parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    public static GraphRecord parseFrom(Reader r) {
        GraphRecord g;
        try {
            g = gson.fromJson(r, GraphRecord.class);
        } catch (JsonParseException e) {
            throw new ConstructionException("malformed graph record: " + e.getMessage(), e);
        }
        if (g == null) throw new ConstructionException("Missing graph record");
        if (g.tokens == null) g.tokens = new ArrayList<>();
        if (g.nodes == null) g.nodes = new ArrayList<>();
        if (g.node2words == null) g.node2words = new LinkedHashMap<>();
        if (g.extraNode2words == null) g.extraNode2words = new LinkedHashMap<>();
        if (g.nodeEdges == null) g.nodeEdges = new ArrayList<>();
        return g;
    }

    public String toJson() { return gson.toJson(this); }

    public List<String> tokens() { return ImmutableList.copyOf(tokens); }
    public List<String> nodes() { return ImmutableList.copyOf(nodes); }

    /** @return the tokens recorded for {@code node}, or null if there are none */
    @Nullable
    public List<String> words(String node) { return node2words.get(node); }

    /**
     * @return the (token, role) pairs recorded for a coordination node, or null if none
     */
    @Nullable
    public List<List<String>> extraWords(String node) { return extraNode2words.get(node); }

    public List<NodeEdge> edges() {
        ImmutableList.Builder<NodeEdge> b = ImmutableList.builder();
        for (List<String> e : nodeEdges) {
            if (e == null || e.size() < 2 || e.size() > 3) throw new ConstructionException("malformed edge " + e);
            if (e.get(0) == null || e.get(1) == null) throw new ConstructionException("edge lacks an endpoint: " + e);
            b.add(new NodeEdge(e.get(0), e.get(1), EdgeLabel.fromRecord(e.size() > 2 ? e.get(2) : null)));
        }
        return b.build();
    }

    public GraphRecord addTokens(String... ts) {
        tokens.addAll(Arrays.asList(ts));
        return this;
    }

    /** Declare a node; any words given are recorded as its tokens. */
    public GraphRecord addNode(String name, String... words) {
        nodes.add(name);
        if (words.length > 0) node2words.put(name, new ArrayList<>(Arrays.asList(words)));
        return this;
    }

    /** Declare a coordination node whose coordinators are the given tokens. */
    public GraphRecord addCoordination(String name, String... coordinatorTokens) {
        nodes.add(name);
        List<List<String>> entries = new ArrayList<>();
        for (String t : coordinatorTokens) entries.add(Arrays.asList(t, "Coord"));
        extraNode2words.put(name, entries);
        return this;
    }

    public GraphRecord addEdge(String parent, String child, EdgeLabel label) {
        nodeEdges.add(new NodeEdge(parent, child, label).toList());
        return this;
    }

    public GraphRecord addEdge(String parent, String child) {
        return addEdge(parent, child, EdgeLabel.PLAIN);
    }

    void setWords(String node, List<String> words) { node2words.put(node, new ArrayList<>(words)); }
}
