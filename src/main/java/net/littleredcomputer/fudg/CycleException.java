package net.littleredcomputer.fudg;

/**
 * Thrown when inserting an edge would make a node its own descendant.
 */
public class CycleException extends IllegalStateException {
    CycleException(String message) { super(message); }
}
