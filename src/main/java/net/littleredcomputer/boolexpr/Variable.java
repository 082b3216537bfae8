package net.littleredcomputer.boolexpr;

import com.google.common.base.CharMatcher;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

import javax.annotation.Nullable;
import java.util.Optional;

public final class Variable extends Node {
    private static final CharMatcher delimiters = CharMatcher.anyOf("\" \t=");
    // Undone by StreamTokenizer when ExpressionParser reads the quoted name back.
    private static final Escaper quotedName = Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('\n', "\\n")
            .addEscape('\r', "\\r")
            .build();
    private final String name;
    @Nullable private Boolean value;  // null until assigned

    public Variable(String name) {
        if (name == null || name.isEmpty()) throw new InvalidOperandException("a variable needs a name");
        if (delimiters.matchesAnyOf(name)) {
            throw new InvalidOperandException("variable name may not contain quote, space, tab or '=': " + name);
        }
        this.name = name;
    }

    public Variable(String name, boolean value) {
        this(name);
        this.value = value;
    }

    public String name() {
        return name;
    }

    @Override
    public Kind kind() {
        return Kind.VARIABLE;
    }

    @Override
    public Optional<Boolean> evaluate() {
        return Optional.ofNullable(value);
    }

    @Override
    void propagate(boolean target) {
        value = target;
    }

    /** Forget the assigned value; the variable becomes indeterminate again. */
    public void reset() {
        value = null;
    }

    void restore(Optional<Boolean> saved) {
        value = saved.orElse(null);
    }

    /** @return e.g. {@code a=1}, {@code a=0} or {@code a=?} */
    public String assignment() {
        return name + '=' + (value == null ? "?" : value ? "1" : "0");
    }

    @Override
    public String display() {
        return name;
    }

    @Override
    public String toString() {
        String quoted = '"' + quotedName.escape(name) + '"';
        return value == null ? "Variable(" + quoted + ")" : "Variable(" + quoted + ", " + value + ")";
    }
}
