package net.littleredcomputer.boolexpr;

import java.util.Optional;

public final class Constant extends Node {
    private final boolean value;

    public Constant(boolean value) {
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.CONSTANT;
    }

    @Override
    public Optional<Boolean> evaluate() {
        return Optional.of(value);
    }

    @Override
    void propagate(boolean target) {
        // Only reached when target differs from value.
        throw new ConstraintException(String.format("constant %s cannot become %s", display(), target));
    }

    @Override
    public String display() {
        return value ? "1" : "0";
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}
