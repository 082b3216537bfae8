package net.littleredcomputer.boolexpr;

import java.io.IOException;
import java.io.Reader;
import java.io.StreamTokenizer;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads expressions in the canonical form produced by {@link Node#toString()}, e.g.
 * {@code Or(Not(Variable("a")), Variable("b", true), Constant(false))}. A quoted name in
 * operand position, such as {@code "~b"}, is a shorthand for a possibly negated variable.
 * All occurrences of one name within an input denote the same {@link Variable}.
 */
public class ExpressionParser {
    private final StreamTokenizer tz;
    private final Map<String, Variable> variables = new HashMap<>();

    private ExpressionParser(Reader r) {
        tz = new StreamTokenizer(r);
        tz.resetSyntax();
        tz.wordChars('a', 'z');
        tz.wordChars('A', 'Z');
        tz.wordChars('0', '9');
        tz.wordChars('_', '_');
        tz.whitespaceChars(0, ' ');
        tz.quoteChar('"');
    }

    public static Node parse(String expression) {
        return parse(new StringReader(expression));
    }

    public static Node parse(Reader r) {
        ExpressionParser p = new ExpressionParser(r);
        try {
            Node n = p.expression(p.tz.nextToken());
            if (p.tz.nextToken() != StreamTokenizer.TT_EOF) throw p.error("trailing input");
            return n;
        } catch (IOException e) {
            throw new IllegalArgumentException("Parse error", e);
        }
    }

    private Node expression(int token) throws IOException {
        if (token == '"') return Operands.fromShorthand(tz.sval, this::variable);
        if (token != StreamTokenizer.TT_WORD) throw error("expected an expression");
        Node.Kind kind = kindNamed(tz.sval);
        expect('(');
        switch (kind) {
            case VARIABLE: {
                expect('"');
                String name = tz.sval;
                int t = tz.nextToken();
                Optional<Boolean> value = Optional.empty();
                if (t == ',') {
                    value = Optional.of(bool(tz.nextToken()));
                    t = tz.nextToken();
                }
                if (t != ')') throw error("expected )");
                return variable(name, value);
            }
            case CONSTANT: {
                boolean value = bool(tz.nextToken());
                expect(')');
                return new Constant(value);
            }
            case NOT: {
                Node operand = expression(tz.nextToken());
                expect(')');
                return new Not(operand);
            }
            case AND:
                return new And(arguments());
            case OR:
                return new Or(arguments());
            case XOR:
                return new Xor(arguments().toArray());
            case IMPLICATION: {
                List<Node> args = binary(kind);
                return new Implication(args.get(0), args.get(1));
            }
            case EQUIVALENT: {
                List<Node> args = binary(kind);
                return new Equivalent(args.get(0), args.get(1));
            }
            default:
                throw new IllegalStateException("unhandled kind " + kind);
        }
    }

    private Node.Kind kindNamed(String label) {
        for (Node.Kind k : Node.Kind.values()) {
            if (k.label().equals(label)) return k;
        }
        throw error("unknown expression type " + label);
    }

    // One or more comma-separated expressions and the closing parenthesis.
    private List<Node> arguments() throws IOException {
        List<Node> args = new ArrayList<>();
        args.add(expression(tz.nextToken()));
        int t;
        while ((t = tz.nextToken()) == ',') args.add(expression(tz.nextToken()));
        if (t != ')') throw error("expected , or )");
        return args;
    }

    private List<Node> binary(Node.Kind kind) throws IOException {
        List<Node> args = arguments();
        if (args.size() != 2) {
            throw new InvalidOperandException(kind.label() + " needs exactly two operands, given " + args.size());
        }
        return args;
    }

    private boolean bool(int token) {
        if (token == StreamTokenizer.TT_WORD) {
            if (tz.sval.equals("true")) return true;
            if (tz.sval.equals("false")) return false;
        }
        throw error("expected true or false");
    }

    private void expect(int c) throws IOException {
        if (tz.nextToken() != c) throw error("expected " + (char) c);
    }

    private Variable variable(String name) {
        return variables.computeIfAbsent(name, Variable::new);
    }

    private Variable variable(String name, Optional<Boolean> value) {
        Variable v = variables.get(name);
        if (v == null) {
            v = value.isPresent() ? new Variable(name, value.get()) : new Variable(name);
            variables.put(name, v);
        } else if (!v.evaluate().equals(value)) {
            throw new InvalidOperandException("conflicting values given for variable " + name);
        }
        return v;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at " + tz);
    }
}
