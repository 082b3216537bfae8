package net.littleredcomputer.boolexpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared structure of the n-ary connectives {@link And} and {@link Or}.
 */
abstract class Junction extends Node {
    private final ImmutableList<Node> operands;
    private final String symbol;

    Junction(String symbol, List<Node> operands) {
        if (operands.isEmpty()) {
            throw new InvalidOperandException(kind().label() + " needs at least one operand");
        }
        this.symbol = symbol;
        this.operands = ImmutableList.copyOf(operands);
    }

    @Override
    public List<Node> operands() {
        return operands;
    }

    /**
     * Force the first operand (from the left) that accepts target.
     */
    void forceAny(boolean target) {
        for (Node operand : operands) {
            if (attempt(operand, target)) return;
        }
        throw new ConstraintException(String.format("no operand of %s can be made %s", display(), target));
    }

    /**
     * Force every operand to target; the first failure propagates.
     */
    void forceAll(boolean target) {
        for (Node operand : operands) operand.setState(target);
    }

    @Override
    public String display() {
        return operands.stream().map(Node::display).collect(Collectors.joining(" " + symbol + " ", "(", ")"));
    }
}
