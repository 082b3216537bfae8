package net.littleredcomputer.boolexpr;

import java.util.List;
import java.util.Optional;

public final class Or extends Junction {
    public Or(Object... operands) {
        this(Operands.toNodes(operands));
    }

    Or(List<Node> operands) {
        super("v", operands);
    }

    @Override
    public Kind kind() {
        return Kind.OR;
    }

    @Override
    public Optional<Boolean> evaluate() {
        boolean unknown = false;
        for (Node operand : operands()) {
            Optional<Boolean> v = operand.evaluate();
            if (!v.isPresent()) unknown = true;
            else if (v.get()) return Optional.of(true);
        }
        return unknown ? Optional.empty() : Optional.of(false);
    }

    @Override
    void propagate(boolean target) {
        if (target) forceAny(true);
        else forceAll(false);
    }
}
