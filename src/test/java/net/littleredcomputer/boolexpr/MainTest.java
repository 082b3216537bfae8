package net.littleredcomputer.boolexpr;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {

    private static String run(String... args) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
            Main.run(args, out);
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    public void eval() throws Exception {
        assertThat(run("-task", "eval", "-expr", "And(Variable(\"a\", true), Constant(true))"), is("1\n"));
        assertThat(run("-task", "eval", "-expr", "Or(Variable(\"a\"), Constant(false))"), is("?\n"));
    }

    @Test
    public void solve() throws Exception {
        assertThat(run("-task", "solve", "-target", "true", "-expr", "Xor(Variable(\"x\"), Variable(\"y\"))"),
                is("s SATISFIED\nv x=0 y=1\n"));
    }

    @Test
    public void solveReportsSharedVariablesOnce() throws Exception {
        assertThat(run("-task", "solve", "-target", "false", "-expr", "Or(Variable(\"p\"), Not(Not(Variable(\"p\"))))"),
                is("s SATISFIED\nv p=0\n"));
    }

    @Test
    public void unsatisfiable() throws Exception {
        assertThat(run("-task", "solve", "-expr", "Or(Constant(false), Constant(false))"),
                containsString("s UNSATISFIABLE"));
    }

    @Test
    public void truthTable() throws Exception {
        String out = run("-task", "truthtable",
                "-expr", "Implication(Variable(\"a\"), Variable(\"b\"))",
                "-expr", "Or(\"~a\", Variable(\"b\"))");
        assertThat(out, containsString("a b | (a → b) (~a v b)\n"));
        assertThat(out, containsString("1 0 | 0       0\n"));
        assertThat(out.endsWith("equivalent\n") && !out.contains("not equivalent"), is(true));
    }

    @Test
    public void deMorgan() throws Exception {
        assertThat(run("-task", "demorgan", "-expr", "And(Variable(\"a\"), Variable(\"b\"))"),
                is("Not(Or(Not(Variable(\"a\")), Not(Variable(\"b\"))))\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownTask() throws Exception {
        run("-task", "prove", "-expr", "Constant(true)");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingExpression() throws Exception {
        run("-task", "eval");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badTarget() throws Exception {
        run("-task", "solve", "-target", "maybe", "-expr", "Variable(\"a\")");
    }
}
