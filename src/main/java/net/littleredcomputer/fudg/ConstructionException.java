package net.littleredcomputer.fudg;

/**
 * The graph record is malformed: an unknown node is referenced, a reserved name is
 * declared twice, a token belongs to two lexical nodes, a bundle has two tops, etc.
 */
public class ConstructionException extends IllegalArgumentException {
    ConstructionException(String message) { super(message); }
    ConstructionException(String message, Throwable cause) { super(message, cause); }
}
