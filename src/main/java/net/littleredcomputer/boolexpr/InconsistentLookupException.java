package net.littleredcomputer.boolexpr;

/**
 * A lookup by variable name found no variable of that name, or found several that disagree.
 */
public class InconsistentLookupException extends LogicException {
    public InconsistentLookupException(String message) {
        super(message);
    }
}
