package lamb;

import static lamb.Term.abs;
import static lamb.Term.app;
import static lamb.Term.var;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.Test;

public class AstPrinterTest {
    private final AstPrinter printer = new AstPrinter();

    @Test
    public void prettyPrint() {
        assertThat(printer.print(var("x")), is("x"));
        assertThat(printer.print(abs("x", var("x"))), is("\\x. x"));
        assertThat(printer.print(app(var("f"), var("x"))), is("f x"));
        assertThat(printer.print(app(abs("x", abs("y", var("x"))), var("a"))), is("(\\x. \\y. x) a"));
    }

    @Test
    public void parenthesizesOnlyWhereNeeded() {
        assertThat(printer.print(app(app(var("f"), var("x")), var("y"))), is("f x y"));
        assertThat(printer.print(app(var("f"), app(var("x"), var("y")))), is("f (x y)"));
        assertThat(printer.print(app(var("f"), abs("x", var("x")))), is("f (\\x. x)"));
        assertThat(printer.print(abs("x", app(var("x"), var("y")))), is("\\x. x y"));
        assertThat(printer.print(app(app(var("f"), abs("x", var("x"))), var("y"))), is("f (\\x. x) y"));
    }

    @Test
    public void toStringIsThePrettyForm() {
        assertThat(abs("x", app(var("x"), var("x"))).toString(), is("\\x. x x"));
    }

    @Test
    public void printedTermsParseBackToTheSameTree() {
        String[] sources = {
                "x",
                "\\x. x",
                "f x y",
                "f (x y)",
                "\\x. x y",
                "(\\x. x) y",
                "f \\x. x y",
                "(\\x. x y) (\\z. z)",
                "(\\f. \\x. f (f x)) (\\y. y) z",
                "λs.λz.s (s z)",
                "((a b) (c (\\d. d e)) f)",
                "(\\x. x x) (\\x. x x)",
        };

        for (String source : sources) {
            Term term = Parser.parse(source);
            assertThat(source, Parser.parse(printer.print(term)), is(term));
        }
    }
}
