package net.littleredcomputer.boolexpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * a ↔ b, evaluated and forced through an owned {@code And(Implication(a, b), Implication(b, a))}.
 */
public final class Equivalent extends Node {
    private final Node left;
    private final Node right;
    private final Node backing;

    public Equivalent(Object left, Object right) {
        this.left = Operands.toNode(left);
        this.right = Operands.toNode(right);
        this.backing = new And(new Implication(this.left, this.right), new Implication(this.right, this.left));
    }

    @Override
    public Kind kind() {
        return Kind.EQUIVALENT;
    }

    @Override
    public List<Node> operands() {
        return ImmutableList.of(left, right);
    }

    @Override
    public Optional<Boolean> evaluate() {
        return backing.evaluate();
    }

    @Override
    void propagate(boolean target) {
        backing.setState(target);
    }

    @Override
    public String display() {
        return "(" + left.display() + " ↔ " + right.display() + ")";
    }
}
