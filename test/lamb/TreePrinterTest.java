package lamb;

import static lamb.Term.abs;
import static lamb.Term.app;
import static lamb.Term.var;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.Test;

public class TreePrinterTest {
    private final TreePrinter printer = new TreePrinter();

    @Test
    public void variable() {
        assertThat(printer.print(var("x")), is("└── Var (x)\n"));
    }

    @Test
    public void abstraction() {
        assertThat(printer.print(abs("x", var("y"))),
                is("└── Abs (x)\n"
                        + "  └── Var (y)\n"));
    }

    @Test
    public void application() {
        assertThat(printer.print(app(abs("x", var("x")), var("y"))),
                is("└── App\n"
                        + "│ ├── Abs (x)\n"
                        + "│   └── Var (x)\n"
                        + "  └── Var (y)\n"));
    }

    @Test
    public void nestedApplication() {
        assertThat(printer.print(Parser.parse("f x y")),
                is("└── App\n"
                        + "│ ├── App\n"
                        + "│ │ ├── Var (f)\n"
                        + "│   └── Var (x)\n"
                        + "  └── Var (y)\n"));
    }

    @Test
    public void sameTreeSameDiagram() {
        Term term = Parser.parse("(\\f. \\x. f (f x)) g");
        assertThat(printer.print(term), is(printer.print(Parser.parse("(\\f. \\x. f (f x)) g"))));
    }
}
