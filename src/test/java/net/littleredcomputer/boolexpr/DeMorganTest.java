package net.littleredcomputer.boolexpr;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class DeMorganTest {

    private static boolean equivalent(Node x, Node y) {
        return TruthTable.of(x, y).allAgree();
    }

    @Test
    public void conjunctionBecomesNegatedDisjunction() {
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        And e = new And(a, b);
        Node r = Trees.deMorgan(e);
        assertThat(r.display(), is("~(~a v ~b)"));
        Node or = ((Not) r).operand();
        assertThat(((Not) or.operands().get(0)).operand(), is(sameInstance((Node) a)));
        assertThat(e.display(), is("(a ^ b)"));
        assertThat(equivalent(e, r), is(true));
    }

    @Test
    public void disjunctionBecomesNegatedConjunction() {
        Node e = new Or("a", "b", "~c");
        Node r = Trees.deMorgan(e);
        assertThat(r.display(), is("~(~a ^ ~b ^ ~~c)"));
        assertThat(equivalent(e, r), is(true));
    }

    @Test
    public void singleNegationIsRewrittenInPlace() {
        Not e = new Not(new And("a", "b"));
        Node copy = ExpressionParser.parse(e.toString());
        Node r = Trees.deMorgan(e);
        assertThat(r, is(sameInstance((Node) e)));
        assertThat(e.display(), is("~~(~a v ~b)"));
        assertThat(equivalent(copy, e), is(true));
    }

    @Test
    public void doubleNegationKeepsEquivalence() {
        Not e = new Not(new Not(new Or("a", "b")));
        Node copy = ExpressionParser.parse(e.toString());
        Node r = Trees.deMorgan(e);
        assertThat(r, is(sameInstance((Node) e)));
        assertThat(e.display(), is("~(~a ^ ~b)"));
        assertThat(equivalent(copy, e), is(true));
    }

    @Test
    public void tripleNegationKeepsEquivalence() {
        Not e = new Not(new Not(new Not(new And("a", "b", "c"))));
        Node copy = ExpressionParser.parse(e.toString());
        Trees.deMorgan(e);
        assertThat(e.display(), is("~~(~a v ~b v ~c)"));
        assertThat(equivalent(copy, e), is(true));
    }

    @Test
    public void appliedTwiceIsEquivalent() {
        Node e = new And("a", new Or("b", new Not("c")));
        Node twice = Trees.deMorgan(Trees.deMorgan(e));
        assertThat(equivalent(e, twice), is(true));
    }

    @Test(expected = LogicException.class)
    public void negatedVariableHasNothingToRewrite() {
        Trees.deMorgan(new Not(new Variable("a")));
    }

    @Test(expected = LogicException.class)
    public void exclusiveOrIsNotRewritten() {
        Trees.deMorgan(new Xor("a", "b"));
    }
}
