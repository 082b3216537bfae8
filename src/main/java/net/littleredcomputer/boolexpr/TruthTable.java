package net.littleredcomputer.boolexpr;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.google.common.primitives.Booleans;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.stream.Collectors.toList;

/**
 * The values of one or more statements under every assignment of their variables.
 * Statements are matched up by variable name, so they need not share Variable instances,
 * but they must mention the same names.
 */
public final class TruthTable {
    private static final Logger log = LogManager.getFormatterLogger(TruthTable.class);
    private static final Joiner columnJoiner = Joiner.on(' ');
    private static final int maxVariables = 24;

    public static final class Row {
        private final ImmutableList<Boolean> assignment;
        private final ImmutableList<Boolean> values;

        private Row(List<Boolean> assignment, List<Boolean> values) {
            this.assignment = ImmutableList.copyOf(assignment);
            this.values = ImmutableList.copyOf(values);
        }

        /** @return variable values, in the order of {@link TruthTable#variables()} */
        public List<Boolean> assignment() { return assignment; }

        /** @return statement values, in the order the statements were given */
        public List<Boolean> values() { return values; }

        public boolean agrees() { return values.stream().distinct().count() <= 1; }
    }

    private final ImmutableList<Node> statements;
    private final ImmutableList<String> variables;
    private final ImmutableList<Row> rows;

    private TruthTable(List<Node> statements, List<String> variables, List<Row> rows) {
        this.statements = ImmutableList.copyOf(statements);
        this.variables = ImmutableList.copyOf(variables);
        this.rows = ImmutableList.copyOf(rows);
    }

    /**
     * Evaluate the statements under all 2^n assignments of their n variables. The first
     * variable is the most significant bit of the row number, so it changes slowest. Every
     * variable gets back the value it had before, however this method exits.
     *
     * @throws InvalidOperandException if no statement is given or the statements' variable names differ
     */
    public static TruthTable of(Node... statements) {
        if (statements.length == 0) throw new InvalidOperandException("a truth table needs at least one statement");
        List<String> names = Trees.findVariables(statements[0]).map(Variable::name).distinct().collect(toList());
        ImmutableSet<String> nameSet = ImmutableSet.copyOf(names);
        for (Node s : statements) {
            if (!Trees.findVariables(s).map(Variable::name).collect(ImmutableSet.toImmutableSet()).equals(nameSet)) {
                throw new InvalidOperandException(String.format("%s does not have the variables %s", s.display(), nameSet));
            }
        }
        if (names.size() > maxVariables) {
            throw new IllegalArgumentException("too many variables for a truth table: " + names.size());
        }
        Map<Variable, Optional<Boolean>> saved = new IdentityHashMap<>();
        for (Node s : statements) Trees.findVariables(s).forEach(v -> saved.putIfAbsent(v, v.evaluate()));
        ImmutableListMultimap<String, Variable> byName = Multimaps.index(saved.keySet(), Variable::name);

        final int n = names.size();
        log.debug("enumerating %d rows over %s for %d statements", 1 << n, names, statements.length);
        ImmutableList.Builder<Row> rows = ImmutableList.builder();
        try {
            for (int i = 0; i < 1 << n; ++i) {
                boolean[] bits = new boolean[n];
                for (int j = 0; j < n; ++j) {
                    bits[j] = ((i >> (n - 1 - j)) & 1) != 0;
                    for (Variable v : byName.get(names.get(j))) v.setState(bits[j]);
                }
                boolean[] values = new boolean[statements.length];
                for (int k = 0; k < statements.length; ++k) values[k] = statements[k].state();
                rows.add(new Row(Booleans.asList(bits), Booleans.asList(values)));
            }
        } finally {
            saved.forEach(Variable::restore);
        }
        return new TruthTable(ImmutableList.copyOf(statements), names, rows.build());
    }

    public List<String> variables() { return variables; }
    public List<Row> rows() { return rows; }
    public int size() { return rows.size(); }

    /** @return true if, on every row, all statements have the same value */
    public boolean allAgree() {
        return rows.stream().allMatch(Row::agrees);
    }

    /**
     * @return a plain text table: a header of variable names and statements, then one line
     * of 0s and 1s per row
     */
    public String format() {
        List<String> header = ImmutableList.<String>builder()
                .addAll(variables)
                .add("|")
                .addAll(statements.stream().map(Node::display).collect(toList()))
                .build();
        StringBuilder sb = new StringBuilder(columnJoiner.join(header)).append('\n');
        for (Row r : rows) {
            List<String> cells = r.assignment().stream().map(TruthTable::bit).collect(Collectors.toCollection(ArrayList::new));
            cells.add("|");
            r.values().forEach(v -> cells.add(bit(v)));
            for (int c = 0; c < cells.size(); ++c) cells.set(c, Strings.padEnd(cells.get(c), header.get(c).length(), ' '));
            sb.append(columnJoiner.join(cells).trim()).append('\n');
        }
        return sb.toString();
    }

    private static String bit(boolean b) {
        return b ? "1" : "0";
    }
}
