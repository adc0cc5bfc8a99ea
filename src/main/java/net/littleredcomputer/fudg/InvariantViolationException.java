package net.littleredcomputer.fudg;

public class InvariantViolationException extends IllegalStateException {
    InvariantViolationException(String message) { super(message); }
}
