package net.littleredcomputer.boolexpr;

/**
 * No assignment of the reachable variables makes the expression take the requested value
 * without changing a constant or undoing a value forced elsewhere in the same expression.
 */
public class ConstraintException extends LogicException {
    public ConstraintException(String message) {
        super(message);
    }
}
