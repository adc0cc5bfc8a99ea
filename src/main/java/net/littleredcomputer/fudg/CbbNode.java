// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fudg;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A "can't be bothered" bundle: a set of members with at most one designated top and no
 * fixed internal structure. Members are attached with {@link #addMember}; ordinary
 * children attached with {@link #addChild} modify whichever member turns out to be the
 * bundle's head.
 * <p>
 * A bundle whose members turn out to equal those of another bundle becomes an alias of
 * it: the alias keeps its name but shares every other piece of state with its canonical
 * bundle, so both names answer every query identically.
 */
public final class CbbNode extends Node {
    private static final Logger log = LogManager.getFormatterLogger(CbbNode.class);

    static final class Contents {
        final Set<Node> members = new LinkedHashSet<>();
        final Set<Node> externalChildren = new LinkedHashSet<>();
        Node top;
        Set<Node> topCandidates;  // null until the upward pass
    }

    private Contents contents = new Contents();
    private CbbNode canonical;  // non-null once this bundle is an alias

    CbbNode(String name) { super(name); }

    @Override public boolean isBundle() { return true; }

    public Set<Node> members() { return Collections.unmodifiableSet(contents.members); }
    public Set<Node> externalChildren() { return Collections.unmodifiableSet(contents.externalChildren); }

    @Nullable
    public Node top() { return contents.top; }

    public boolean isAlias() { return canonical != null; }

    /** @return the bundle whose state this one shares (itself, unless it is an alias) */
    public CbbNode canonical() { return canonical == null ? this : canonical; }

    /**
     * @return the real nodes that might be this bundle's head in some full resolution
     * @throws InvariantViolationException if the upward pass has not run
     */
    public Set<Node> topCandidates() {
        if (contents.topCandidates == null) {
            throw new InvariantViolationException("top candidates of " + this + " have not been computed");
        }
        return contents.topCandidates;
    }

    void setTopCandidates(Set<Node> candidates) { contents.topCandidates = candidates; }

    @Override
    public Set<Node> possibleTops() { return topCandidates(); }

    @Override
    public String recordName() { return canonical().name(); }

    /**
     * Add {@code node} to the members of this bundle.
     * @param specifiedTop whether {@code node} is the bundle's designated top
     */
    public void addMember(Node node, boolean specifiedTop) {
        if (specifiedTop && contents.top != null && contents.top != node) {
            throw new ConstructionException("CBB can only have one specified top: " + contents.top + ", " + node);
        }
        link(node, specifiedTop ? EdgeLabel.TOP : EdgeLabel.UNSPEC);
        contents.members.add(node);
        if (specifiedTop) contents.top = node;
    }

    @Override
    public void addChild(Node child) {
        link(child, EdgeLabel.PLAIN);
        contents.externalChildren.add(child);
    }

    @Override
    List<EdgeLabel> unlink(Node child) {
        List<EdgeLabel> labels = super.unlink(child);
        contents.members.remove(child);
        contents.externalChildren.remove(child);
        if (contents.top == child) contents.top = null;
        return labels;
    }

    @Override
    void relink(Node child, EdgeLabel label) {
        switch (label) {
            case PLAIN: addChild(child); break;
            case TOP: addMember(child, true); break;
            case UNSPEC: addMember(child, false); break;
            default: throw new InvariantViolationException(this + " cannot take a " + label + " edge to " + child);
        }
    }

    /**
     * Make {@code member} the designated top, relabelling its member edge to match.
     */
    private void designateTop(Node member) {
        if (!contents.members.contains(member)) {
            throw new InvariantViolationException(member + " is not a member of " + this);
        }
        topology.childEdges.remove(new Edge(member, EdgeLabel.UNSPEC));
        topology.childEdges.add(new Edge(member, EdgeLabel.TOP));
        member.topology.parentEdges.remove(new Edge(this, EdgeLabel.UNSPEC));
        member.topology.parentEdges.add(new Edge(this, EdgeLabel.TOP));
        contents.top = member;
    }

    /**
     * Collapse this bundle into {@code target}, which has exactly the same members. The
     * target takes over this bundle's external children and incoming edges, and adopts its
     * designated top if it has none of its own. Afterwards this bundle is an alias: it keeps
     * its name and forwards everything else to {@code target}.
     * @throws AliasInconsistencyException if the two bundles designate different tops
     */
    void mergeInto(CbbNode target) {
        if (isAlias() || target.isAlias()) {
            throw new InvariantViolationException("cannot merge " + this + " into " + target + ": already merged");
        }
        if (!contents.members.equals(target.contents.members)) {
            throw new InvariantViolationException("cannot merge " + this + " into " + target + ": members differ");
        }
        Node ourTop = contents.top;
        Node theirTop = target.contents.top;
        if (ourTop != null && theirTop != null && ourTop != theirTop) {
            throw new AliasInconsistencyException(String.format(
                    "identical bundles %s and %s specify different tops %s and %s", this, target, ourTop, theirTop));
        }
        log.debug("merging CBB %s into %s", this, target);
        final int ourHeight = height();
        final List<Node> externals = ImmutableList.copyOf(contents.externalChildren);

        // Our incoming edges now lead to the target.
        for (Node p : ImmutableList.copyOf(parents())) {
            if (p == target) target.unlink(this);
            else p.replaceChild(this, target);
        }
        // Members keep their edges from the target only; external children move over.
        for (Node c : ImmutableList.copyOf(children())) unlink(c);
        for (Node c : externals) {
            if (c != target) target.addChild(c);
        }
        if (theirTop == null && ourTop != null) target.designateTop(ourTop);
        target.raiseHeight(ourHeight);

        fragment().remove(this);
        Fragment f = target.fragment();
        topology = target.topology;
        contents = target.contents;
        canonical = target;
        f.recomputeDepths();
    }
}
