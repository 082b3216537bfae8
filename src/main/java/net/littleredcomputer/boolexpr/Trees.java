package net.littleredcomputer.boolexpr;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.stream.Collectors.toList;

/**
 * Operations over whole expression trees: finding variables, reading and assigning them by
 * name, and De Morgan rewriting.
 */
public final class Trees {
    private Trees() {}

    /**
     * @return every node reachable from root, root first, operands left to right. A node
     * reachable along several paths is produced once per path.
     */
    static Stream<Node> walk(Node root) {
        return StreamSupport.stream(new Walk(root), false);
    }

    // Explicit stack, so deep trees cannot exhaust the call stack.
    private static class Walk implements Spliterator<Node> {
        private final Deque<Node> pending = new ArrayDeque<>();

        Walk(Node root) {
            pending.push(root);
        }

        @Override
        public boolean tryAdvance(Consumer<? super Node> action) {
            Node n = pending.poll();
            if (n == null) return false;
            List<Node> operands = n.operands();
            for (int i = operands.size() - 1; i >= 0; --i) pending.push(operands.get(i));
            action.accept(n);
            return true;
        }

        @Override
        public Spliterator<Node> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return ORDERED | NONNULL;
        }
    }

    /**
     * @return the variables of the expression, lazily, in left to right order. A variable
     * occurring twice is produced twice.
     */
    public static Stream<Variable> findVariables(Node root) {
        return walk(root).filter(n -> n.kind() == Node.Kind.VARIABLE).map(Variable.class::cast);
    }

    private static Stream<Variable> named(Node root, String name) {
        return findVariables(root).filter(v -> v.name().equals(name));
    }

    /**
     * @return the value shared by every variable called name in the expression
     * @throws InconsistentLookupException if there is no such variable, or the occurrences disagree
     * @throws IndeterminateException      if the variable is unassigned
     */
    public static boolean findVariableState(Node root, String name) {
        return lookup(root, name).orElseThrow(() -> new IndeterminateException("variable " + name + " is unassigned"));
    }

    /**
     * As {@link #findVariableState(Node, String)}, except that an unassigned variable yields fallback.
     */
    public static boolean findVariableStateOrDefault(Node root, String name, boolean fallback) {
        return lookup(root, name).orElse(fallback);
    }

    private static Optional<Boolean> lookup(Node root, String name) {
        List<Variable> occurrences = named(root, name).collect(toList());
        if (occurrences.isEmpty()) {
            throw new InconsistentLookupException("no variable " + name + " in " + root.display());
        }
        Optional<Boolean> state = occurrences.get(0).evaluate();
        if (occurrences.stream().anyMatch(v -> !v.evaluate().equals(state))) {
            throw new InconsistentLookupException("occurrences disagree: " + occurrences.stream()
                    .map(Variable::assignment).distinct().collect(Collectors.joining(", ")));
        }
        return state;
    }

    /**
     * Assign value to every variable called name, directly and without any constraint search.
     *
     * @throws InconsistentLookupException if the expression has no such variable
     */
    public static void setVariableState(Node root, String name, boolean value) {
        List<Variable> occurrences = named(root, name).collect(toList());
        if (occurrences.isEmpty()) {
            throw new InconsistentLookupException("no variable " + name + " in " + root.display());
        }
        for (Variable v : occurrences) v.setState(value);
    }

    /**
     * Rewrite a conjunction or disjunction, possibly under negations, by De Morgan's laws:
     * {@code And(x, y)} becomes {@code Not(Or(Not(x), Not(y)))} and dually for Or.
     * <p>
     * Without a leading negation the rewritten node is returned. Otherwise the negations
     * are peeled down to the connective, the operand of the outermost negation is overwritten
     * in place, and the outermost negation is returned. Negations between the two are dropped
     * in pairs, so the result is always equivalent to the input.
     *
     * @throws LogicException if the innermost node is neither And nor Or
     */
    @CheckReturnValue
    public static Node deMorgan(Node root) {
        Not outermost = null;
        int negations = 0;
        Node inner = root;
        while (inner.kind() == Node.Kind.NOT) {
            if (outermost == null) outermost = (Not) inner;
            inner = ((Not) inner).operand();
            ++negations;
        }
        List<Node> negated = inner.operands().stream().<Node>map(Not::new).collect(toList());
        Node swapped;
        switch (inner.kind()) {
            case AND:
                swapped = new Or(negated);
                break;
            case OR:
                swapped = new And(negated);
                break;
            default:
                throw new LogicException("De Morgan's laws do not apply to " + inner.display());
        }
        if (outermost == null) return new Not(swapped);
        // Not^(k-1) of the connective is Not^k of swapped.
        outermost.replaceOperand(negations % 2 == 1 ? new Not(swapped) : swapped);
        return outermost;
    }
}
