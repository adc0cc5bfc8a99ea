package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * A node owning one or more tokens of the utterance. No token belongs to more than one
 * lexical node of a graph.
 */
public final class LexicalNode extends Node {
    private final ImmutableSet<String> tokens;

    LexicalNode(String name, Set<String> tokens) {
        super(name);
        if (name.equals(RootNode.NAME)) throw new ConstructionException("lexical node may not be named " + name);
        if (tokens.isEmpty()) throw new ConstructionException("lexical node " + name + " has no tokens");
        this.tokens = ImmutableSet.copyOf(tokens);
    }

    public ImmutableSet<String> tokens() { return tokens; }

    @Override
    void collectYield(Set<String> into) {
        into.addAll(tokens);
        super.collectYield(into);
    }

    @Override
    public String recordName() { return (tokens.size() > 1 ? "M" : "") + "W(" + name() + ")"; }
}
