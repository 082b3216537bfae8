package net.littleredcomputer.boolexpr;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import java.util.function.Function;

/**
 * Conversion of the values accepted wherever an operand is expected into nodes.
 */
public final class Operands {
    private static final CharMatcher notTilde = CharMatcher.isNot('~');

    private Operands() {}

    /**
     * @param operand a {@link Node} (used as is, so variables stay shared), a Boolean or an
     *                integral number (wrapped in a {@link Constant}; nonzero is true), or a
     *                variable name with optional leading {@code ~} characters
     * @return the node for operand
     * @throws InvalidOperandException for null or any other kind of value
     */
    public static Node toNode(Object operand) {
        if (operand instanceof Node) return (Node) operand;
        if (operand instanceof Boolean) return new Constant((Boolean) operand);
        if (operand instanceof Integer || operand instanceof Long || operand instanceof Short || operand instanceof Byte) {
            return new Constant(((Number) operand).longValue() != 0);
        }
        if (operand instanceof String) return fromShorthand((String) operand, Variable::new);
        throw new InvalidOperandException(String.format("%s (%s) cannot be used as an operand",
                operand, operand == null ? "null" : operand.getClass().getSimpleName()));
    }

    static ImmutableList<Node> toNodes(Object[] operands) {
        ImmutableList.Builder<Node> b = ImmutableList.builder();
        for (Object o : operands) b.add(toNode(o));
        return b.build();
    }

    /**
     * Read {@code ~~~name}: pairs of tildes cancel, and one left over negates the variable.
     *
     * @param variables produces the variable for a bare name
     */
    static Node fromShorthand(String s, Function<String, Variable> variables) {
        int tildes = notTilde.indexIn(s);
        if (tildes < 0) throw new InvalidOperandException("no variable name in \"" + s + "\"");
        Variable v = variables.apply(s.substring(tildes));
        return tildes % 2 == 0 ? v : new Not(v);
    }
}
