package lamb;

import static lamb.Substitution.subst;
import static lamb.Term.abs;
import static lamb.Term.app;
import static lamb.Term.var;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.Test;

public class SubstitutionTest {
    private final Term x = var("x");
    private final Term y = var("y");

    @Test
    public void replacesFreeVariable() {
        assertThat(subst("x", y, x), is(y));
        assertThat(subst("x", y, var("z")), is(var("z")));
    }

    @Test
    public void binderShadowsTheSubstitutedName() {
        Term identity = abs("x", x);
        assertThat(subst("x", y, identity), is(identity));

        Term body = app(x, abs("z", x));
        assertThat(subst("x", app(var("f"), var("g")), abs("x", body)), is(abs("x", body)));
    }

    @Test
    public void substitutesInBothSidesOfApplication() {
        assertThat(subst("x", y, app(y, x)), is(app(y, y)));
        assertThat(subst("x", abs("z", var("z")), app(x, x)),
                is(app(abs("z", var("z")), abs("z", var("z")))));
    }

    @Test
    public void substitutesUnderUnrelatedBinder() {
        assertThat(subst("x", y, abs("z", app(var("z"), x))), is(abs("z", app(var("z"), y))));
    }

    @Test
    public void freeVariableOfReplacementIsCaptured() {
        // [y := x](\x. y) 得到 \x. x，替换不做重命名。
        Term term = abs("x", y);
        assertThat(subst("y", x, term), is(abs("x", x)));
        assertThat(Substitution.wouldCapture("y", x, term), is(true));
    }

    @Test
    public void captureCheck() {
        assertThat(Substitution.wouldCapture("x", y, abs("z", x)), is(false));
        assertThat(Substitution.wouldCapture("x", y, abs("y", var("z"))), is(false));
        assertThat(Substitution.wouldCapture("x", y, abs("x", abs("y", x))), is(false));
        assertThat(Substitution.wouldCapture("x", app(var("f"), y), abs("a", abs("y", x))), is(true));
    }

    @Test
    public void inputIsNotModified() {
        Term term = Parser.parse("\\z. x (\\x. x) x");
        Term copy = Parser.parse("\\z. x (\\x. x) x");
        Term result = subst("x", y, term);

        assertThat(result, is(Parser.parse("\\z. y (\\x. x) y")));
        assertThat(term, is(copy));
    }
}
