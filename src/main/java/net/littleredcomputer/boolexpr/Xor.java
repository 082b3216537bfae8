package net.littleredcomputer.boolexpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

public final class Xor extends Node {
    private final ImmutableList<Node> operands;

    public Xor(Object... operands) {
        if (operands.length != 2) {
            throw new InvalidOperandException("Xor needs exactly two operands, given " + operands.length);
        }
        this.operands = Operands.toNodes(operands);
    }

    @Override
    public Kind kind() {
        return Kind.XOR;
    }

    @Override
    public List<Node> operands() {
        return operands;
    }

    @Override
    public Optional<Boolean> evaluate() {
        Optional<Boolean> a = operands.get(0).evaluate();
        Optional<Boolean> b = operands.get(1).evaluate();
        if (!a.isPresent() || !b.isPresent()) return Optional.empty();
        return Optional.of(a.get() != b.get());
    }

    @Override
    void propagate(boolean target) {
        // First adjust one operand to whatever the other one already is, trying the left first.
        for (List<Node> pair : ImmutableList.of(operands, operands.reverse())) {
            Optional<Boolean> known = pair.get(1).evaluate();
            if (known.isPresent() && attempt(pair.get(0), known.get() != target) && evaluatesTo(target)) return;
        }
        // Neither operand is known: choose both, left operand false before true.
        Node left = operands.get(0);
        Node right = operands.get(1);
        if (left.isIndeterminate() && right.isIndeterminate()) {
            for (boolean v : new boolean[]{false, true}) {
                if (attempt(left, v) && attempt(right, v != target) && evaluatesTo(target)) return;
            }
        }
        throw new ConstraintException(String.format("%s cannot be made %s", display(), target));
    }

    @Override
    public String display() {
        return "(" + operands.get(0).display() + " xor " + operands.get(1).display() + ")";
    }
}
