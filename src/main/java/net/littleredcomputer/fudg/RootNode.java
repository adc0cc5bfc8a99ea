package net.littleredcomputer.fudg;

/**
 * The single root of a graph, named {@value #NAME}. It never has a parent, except that a
 * bundle may take it as a member.
 */
public final class RootNode extends Node {
    public static final String NAME = "$$";
    public static final String RECORD_NAME = "W($$)";

    RootNode() { super(NAME); }

    @Override public boolean isRoot() { return true; }
    @Override public String recordName() { return RECORD_NAME; }
}
