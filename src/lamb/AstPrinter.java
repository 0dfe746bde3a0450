package lamb;

// 把语法树重新渲染为源码形式。括号只在省略它们会改变解析结果时才插入：
// 处于函数位置的抽象，以及处于参数位置的应用或抽象。
// 这样打印出来的文本再解析一次，就能得到结构上相同的树。
public class AstPrinter implements Term.Visitor<String> {
    public String print(Term term) {
        return term.accept(this);
    }

    @Override
    public String visitVarTerm(Term.Var term) {
        return term.name;
    }

    @Override
    public String visitAbsTerm(Term.Abs term) {
        return "\\" + term.param + ". " + print(term.body);
    }

    @Override
    public String visitAppTerm(Term.App term) {
        String function = print(term.function);
        // 抽象的主体会尽可能向右延伸，所以函数位置上的抽象必须加括号。
        if (term.function instanceof Term.Abs) function = parenthesize(function);

        // 应用是左结合的，参数位置上的应用也需要括号。
        String argument = print(term.argument);
        if (term.argument instanceof Term.App || term.argument instanceof Term.Abs) {
            argument = parenthesize(argument);
        }

        return function + " " + argument;
    }

    private String parenthesize(String text) {
        return "(" + text + ")";
    }
}
