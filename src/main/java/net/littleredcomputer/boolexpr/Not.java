package net.littleredcomputer.boolexpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

public final class Not extends Node {
    private Node operand;

    public Not(Object operand) {
        this.operand = Operands.toNode(operand);
    }

    public Node operand() {
        return operand;
    }

    /**
     * Overwrite the operand slot. Used by structural rewrites, which must not make this node
     * reachable from its own operand.
     */
    void replaceOperand(Node replacement) {
        if (Trees.walk(replacement).anyMatch(n -> n == this)) {
            throw new InvalidOperandException("replacing the operand of " + display() + " would create a cycle");
        }
        operand = replacement;
    }

    @Override
    public Kind kind() {
        return Kind.NOT;
    }

    @Override
    public List<Node> operands() {
        return ImmutableList.of(operand);
    }

    @Override
    public Optional<Boolean> evaluate() {
        return operand.evaluate().map(v -> !v);
    }

    @Override
    void propagate(boolean target) {
        operand.setState(!target);
    }

    // Connectives bring their own parentheses, so ~(a ^ b) and ~a both come out right.
    @Override
    public String display() {
        return "~" + operand.display();
    }
}
