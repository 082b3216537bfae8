package net.littleredcomputer.boolexpr;

/**
 * Base of the failures raised by the expression model. Subclasses distinguish an
 * undetermined result, an unsatisfiable constraint, a malformed construction and an
 * inconsistent variable lookup.
 */
public class LogicException extends RuntimeException {
    public LogicException(String message) {
        super(message);
    }
}
