package net.littleredcomputer.boolexpr;

/**
 * The value of an expression depends on variables that have not been assigned.
 */
public class IndeterminateException extends LogicException {
    public IndeterminateException(String message) {
        super(message);
    }
}
