package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A coordination structure: its coordinators (the lexical nodes of words like "and") and
 * its conjuncts. Neither is a structural child; ordinary children of a coordination node
 * are modifiers of the whole structure. These nodes only live until
 * {@link CoordinationSimplifier} replaces each with one of its coordinators.
 */
public final class CoordinationNode extends Node {
    private final ImmutableSet<Node> coordinators;
    private final Set<Node> conjuncts = new LinkedHashSet<>();

    CoordinationNode(String name, Set<? extends Node> coordinators) {
        super(name);
        if (coordinators.isEmpty()) throw new ConstructionException("coordination node " + name + " has no coordinator");
        this.coordinators = ImmutableSet.copyOf(coordinators);
    }

    public ImmutableSet<Node> coordinators() { return coordinators; }
    public Set<Node> conjuncts() { return Collections.unmodifiableSet(conjuncts); }

    void addConjunct(Node n) { conjuncts.add(n); }

    @Override
    public String recordName() { return name(); }
}
