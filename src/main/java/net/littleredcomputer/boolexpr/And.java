package net.littleredcomputer.boolexpr;

import java.util.List;
import java.util.Optional;

public final class And extends Junction {
    public And(Object... operands) {
        this(Operands.toNodes(operands));
    }

    And(List<Node> operands) {
        super("^", operands);
    }

    @Override
    public Kind kind() {
        return Kind.AND;
    }

    @Override
    public Optional<Boolean> evaluate() {
        boolean unknown = false;
        for (Node operand : operands()) {
            Optional<Boolean> v = operand.evaluate();
            if (!v.isPresent()) unknown = true;
            else if (!v.get()) return Optional.of(false);  // one false operand decides, whatever the rest are
        }
        return unknown ? Optional.empty() : Optional.of(true);
    }

    @Override
    void propagate(boolean target) {
        if (target) forceAll(true);
        else forceAny(false);
    }
}
