package net.littleredcomputer.boolexpr;

/**
 * Static factories for building expressions. Each operand may be anything
 * {@link Operands#toNode(Object)} accepts.
 */
public final class Nodes {
    private Nodes() {}

    public static Variable variable(String name) { return new Variable(name); }
    public static Variable variable(String name, boolean value) { return new Variable(name, value); }
    public static Constant constant(boolean value) { return new Constant(value); }
    public static Not not(Object operand) { return new Not(operand); }
    public static And and(Object... operands) { return new And(operands); }
    public static Or or(Object... operands) { return new Or(operands); }
    public static Xor xor(Object a, Object b) { return new Xor(a, b); }
    public static Implication implies(Object a, Object b) { return new Implication(a, b); }
    public static Equivalent equivalent(Object a, Object b) { return new Equivalent(a, b); }

    public static Not nand(Object... operands) { return new Not(new And(operands)); }
    public static Not nor(Object... operands) { return new Not(new Or(operands)); }
}
