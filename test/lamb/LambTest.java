package lamb;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class LambTest {

    @Test
    public void identity() {
        assertThat(Lamb.run("\\x. x"), is("\\x. x"));
    }

    @Test
    public void constant() {
        assertThat(Lamb.run("\\x. \\y. x"), is("\\x. \\y. x"));
    }

    @Test
    public void identityApplication() {
        assertThat(Lamb.run("(\\x. x) z"), is("z"));
    }

    @Test
    public void nestedApplication() {
        assertThat(Lamb.run("(\\x. \\y. x) a b"), is("a"));
    }

    @Test
    public void resultIsRenamedByDepth() {
        assertThat(Lamb.run("λs. λz. z"), is("\\x. \\y. y"));
        assertThat(Lamb.run("(\\f. \\g. g) a"), is("\\x. x"));
    }

    @Test
    public void resultParsesBack() {
        String result = Lamb.run("(\\k. \\a. \\b. k) c");
        assertThat(result, is("\\x. \\y. c"));
        assertThat(Parser.parse(result), is(Parser.parse("\\x. \\y. c")));
    }

    @Test
    public void errorsReachTheCaller() {
        assertThrows(ScanError.class, () -> Lamb.run("x $ y"));
        assertThrows(ParseError.class, () -> Lamb.run("(x"));
        assertThrows(RuntimeError.class, () -> Lamb.run("f x"));
    }

    @Test
    public void constantFunctionStaysConstant() {
        String result = Lamb.run("\\a. x");
        assertThat(result, is("\\y. x"));
        assertThat(Lamb.run("(" + result + ") p"), is("x"));
    }

    @Test
    public void renderedResultBehavesLikeTheOriginal() {
        String result = Lamb.run("(\\k. \\a. \\b. k) y");
        assertThat(result, is("\\x. \\z. y"));
        assertThat(Lamb.run("(" + result + ") p q"), is("y"));
    }
}
