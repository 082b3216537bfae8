package net.littleredcomputer.boolexpr;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A boolean-valued expression over three-valued logic. A node evaluates to true, false or
 * (when the variables it depends on are unassigned) to nothing at all, and can be asked to
 * adjust the variables beneath it so that it takes a desired value.
 * <p>
 * The variants are fixed: the constructor is package-private, and {@link #kind()} names the
 * variant of any node. Variables may be shared between several expressions; assigning a shared
 * variable through one expression is visible through all of them.
 */
public abstract class Node {
    private static final Logger log = LogManager.getFormatterLogger(Node.class);
    private static final Joiner commaJoiner = Joiner.on(", ");

    public enum Kind {
        VARIABLE("Variable"),
        CONSTANT("Constant"),
        NOT("Not"),
        AND("And"),
        OR("Or"),
        XOR("Xor"),
        IMPLICATION("Implication"),
        EQUIVALENT("Equivalent");

        private final String label;

        Kind(String label) { this.label = label; }

        /** @return the name used for this kind in the canonical form */
        public String label() { return label; }
    }

    Node() {}

    public abstract Kind kind();

    /**
     * @return the value of this expression given the current variable assignments, or empty
     * if that value cannot be determined yet. Never modifies anything.
     */
    public abstract Optional<Boolean> evaluate();

    /**
     * Adjust the variables beneath this node with the aim of making it evaluate to target.
     * Only called when the node does not already evaluate to target.
     */
    abstract void propagate(boolean target);

    /** @return the operands of this node, in order; empty for variables and constants */
    public List<Node> operands() {
        return ImmutableList.of();
    }

    /** @return the expression written with operator symbols, for people to read */
    public abstract String display();

    /**
     * @return the truth value of this expression
     * @throws IndeterminateException if the value depends on unassigned variables
     */
    public boolean state() {
        return evaluate().orElseThrow(() -> new IndeterminateException("cannot determine the value of " + display()));
    }

    public boolean isIndeterminate() {
        return !evaluate().isPresent();
    }

    /**
     * Assign variables beneath this node so that it evaluates to target. Nothing is changed when
     * the node already has that value. Variables assigned before a failure keep their new values.
     *
     * @param target the value this expression should take
     * @throws ConstraintException if target cannot be reached without changing a constant or
     *                             undoing an assignment this same propagation depends on
     */
    public final void setState(boolean target) {
        if (evaluatesTo(target)) return;
        propagate(target);
        if (!evaluatesTo(target)) {
            throw new ConstraintException(String.format("%s could not be made %s", display(), target));
        }
    }

    final boolean evaluatesTo(boolean value) {
        return evaluate().map(v -> v == value).orElse(false);
    }

    /**
     * One alternative of a retry loop: try to force n to target, reporting instead of throwing
     * when that is impossible.
     */
    static boolean attempt(Node n, boolean target) {
        try {
            n.setState(target);
            return true;
        } catch (ConstraintException e) {
            log.debug("alternative rejected: %s", e.getMessage());
            return false;
        }
    }

    public Node and(Object other) {
        return new And(flatten(Kind.AND, this, Operands.toNode(other)));
    }

    public Node or(Object other) {
        return new Or(flatten(Kind.OR, this, Operands.toNode(other)));
    }

    public Node xor(Object other) {
        return new Xor(this, other);
    }

    public Node implies(Object other) {
        return new Implication(this, other);
    }

    public Node equivalentTo(Object other) {
        return new Equivalent(this, other);
    }

    public Node negate() {
        return new Not(this);
    }

    // And(a, b) combined with And(c) is And(a, b, c); kinds are never mixed.
    private static List<Node> flatten(Kind kind, Node left, Node right) {
        List<Node> result = new ArrayList<>();
        for (Node n : ImmutableList.of(left, right)) {
            if (n.kind() == kind) result.addAll(n.operands());
            else result.add(n);
        }
        return result;
    }

    /**
     * @return the fully parenthesized form, e.g. {@code And(Variable("a"), Not(Constant(true)))},
     * which {@link ExpressionParser} reads back
     */
    @Override
    public String toString() {
        return kind().label() + "(" + commaJoiner.join(operands()) + ")";
    }
}
