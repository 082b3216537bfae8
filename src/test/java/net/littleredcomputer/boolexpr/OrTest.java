package net.littleredcomputer.boolexpr;

import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class OrTest {

    @Test
    public void trueOperandDecidesDespiteUnknowns() {
        assertThat(new Or(new Variable("a"), true).evaluate(), isPresentAndIs(true));
        assertThat(new Or(true, new Variable("a")).state(), is(true));
    }

    @Test
    public void falseOnlyWhenEveryOperandIsFalse() {
        assertThat(new Or(false, 0, false).evaluate(), isPresentAndIs(false));
        assertThat(new Or(false, new Variable("a")).evaluate(), isEmpty());
    }

    @Test(expected = InvalidOperandException.class)
    public void needsAnOperand() {
        new Or();
    }

    @Test(expected = IndeterminateException.class)
    public void constantFalseAndUnknownIsIndeterminate() {
        new Or(new Constant(false), new Variable("p")).state();
    }

    @Test
    public void forcingTrueSkipsTheConstant() {
        Variable p = new Variable("p");
        Or e = new Or(new Constant(false), p);
        e.setState(true);
        assertThat(p.state(), is(true));
        assertThat(e.state(), is(true));
    }

    @Test
    public void forcingFalseForcesTheVariableToo() {
        Variable p = new Variable("p");
        Or e = new Or(new Constant(false), p);
        e.setState(false);
        assertThat(p.state(), is(false));
        assertThat(e.state(), is(false));
    }

    @Test
    public void forcingTrueStopsAtTheFirstOperandThatAccepts() {
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        new Or(false, a, b).setState(true);
        assertThat(a.state(), is(true));
        assertThat(b.isIndeterminate(), is(true));
    }

    @Test(expected = ConstraintException.class)
    public void cannotForceTrueWhenAllOperandsAreConstantFalse() {
        new Or(false, false).setState(true);
    }

    @Test(expected = ConstraintException.class)
    public void cannotForceFalseAgainstTrueConstant() {
        new Or(new Variable("a"), true).setState(false);
    }

    @Test
    public void forcingTrueWhenAlreadyTrueIsANoOp() {
        Variable a = new Variable("a", false);
        Variable b = new Variable("b", true);
        new Or(a, b).setState(true);
        assertThat(a.state(), is(false));
        assertThat(b.state(), is(true));
    }
}
