package lamb;

import java.util.Set;

// 替换：把项中变量var的每个自由出现替换为replacement。
// 遇到绑定了同名参数的抽象时，该子树中的var都是被绑定的，于是替换在那里停止。
// 注意这里不会对replacement中的自由变量做α重命名：如果replacement含有自由变量y，
// 而它被放进了某个λy的主体里，y就会被意外捕获。例如 [x := y](λy. x) 得到 λy. y。
public class Substitution implements Term.Visitor<Term> {
    private final String var;
    private final Term replacement;

    private Substitution(String var, Term replacement) {
        this.var = var;
        this.replacement = replacement;
    }

    public static Term subst(String var, Term replacement, Term term) {
        return term.accept(new Substitution(var, replacement));
    }

    @Override
    public Term visitVarTerm(Term.Var term) {
        if (term.name.equals(var)) return replacement;
        return term;
    }

    @Override
    public Term visitAbsTerm(Term.Abs term) {
        // 参数遮蔽了被替换的名称。
        if (term.param.equals(var)) return term;
        return new Term.Abs(term.param, term.body.accept(this));
    }

    @Override
    public Term visitAppTerm(Term.App term) {
        return new Term.App(term.function.accept(this), term.argument.accept(this));
    }

    // 替换是否会捕获replacement中的某个自由变量。调用方需要一个正确的演算时可以先检查它。
    public static boolean wouldCapture(String var, Term replacement, Term term) {
        return capturing(var, replacement.freeVariables(), term, false);
    }

    private static boolean capturing(String var, Set<String> free, Term term, boolean underCapturingBinder) {
        if (term instanceof Term.Var) {
            return underCapturingBinder && ((Term.Var) term).name.equals(var);
        } else if (term instanceof Term.Abs) {
            Term.Abs abs = (Term.Abs) term;
            if (abs.param.equals(var)) return false;
            return capturing(var, free, abs.body, underCapturingBinder || free.contains(abs.param));
        } else {
            Term.App app = (Term.App) term;
            return capturing(var, free, app.function, underCapturingBinder)
                    || capturing(var, free, app.argument, underCapturingBinder);
        }
    }
}
