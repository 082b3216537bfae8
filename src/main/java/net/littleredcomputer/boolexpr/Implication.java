package net.littleredcomputer.boolexpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * a → b, evaluated and forced through an owned {@code Or(Not(a), b)}.
 */
public final class Implication extends Node {
    private final Node antecedent;
    private final Node consequent;
    private final Node backing;

    public Implication(Object antecedent, Object consequent) {
        this.antecedent = Operands.toNode(antecedent);
        this.consequent = Operands.toNode(consequent);
        this.backing = new Or(new Not(this.antecedent), this.consequent);
    }

    public Node antecedent() {
        return antecedent;
    }

    public Node consequent() {
        return consequent;
    }

    @Override
    public Kind kind() {
        return Kind.IMPLICATION;
    }

    @Override
    public List<Node> operands() {
        return ImmutableList.of(antecedent, consequent);
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
        return "(" + antecedent.display() + " → " + consequent.display() + ")";
    }
}
