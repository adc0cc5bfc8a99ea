package net.littleredcomputer.fudg;

/**
 * Two bundles have identical members but disagree about which member is the designated top.
 */
public class AliasInconsistencyException extends IllegalStateException {
    AliasInconsistencyException(String message) { super(message); }
}
