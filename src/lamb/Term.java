package lamb;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

// λ演算的语法树只有三种节点：变量、抽象和应用。
// 节点一旦创建就不可变，每个子节点只属于一个父节点。替换之类的变换总是产生新的树。
public abstract class Term {
    interface Visitor<R> {
        R visitVarTerm(Var term);

        R visitAbsTerm(Abs term);

        R visitAppTerm(App term);
    }

    public static Var var(String name) {
        return new Var(name);
    }

    public static Abs abs(String param, Term body) {
        return new Abs(param, body);
    }

    public static App app(Term function, Term argument) {
        return new App(function, argument);
    }

    // x
    public static final class Var extends Term {
        Var(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Var)) return false;
            return name.equals(((Var) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        final String name;
    }

    // λx. M
    public static final class Abs extends Term {
        Abs(String param, Term body) {
            this.param = Objects.requireNonNull(param);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbsTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Abs)) return false;
            Abs abs = (Abs) o;
            return param.equals(abs.param) && body.equals(abs.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(param, body);
        }

        final String param;
        final Term body;
    }

    // M N
    public static final class App extends Term {
        App(Term function, Term argument) {
            this.function = Objects.requireNonNull(function);
            this.argument = Objects.requireNonNull(argument);
        }

        @Override
        <R> R accept(Visitor<R> visitor) {
            return visitor.visitAppTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof App)) return false;
            App app = (App) o;
            return function.equals(app.function) && argument.equals(app.argument);
        }

        @Override
        public int hashCode() {
            return Objects.hash(function, argument);
        }

        final Term function;
        final Term argument;
    }

    abstract <R> R accept(Visitor<R> visitor);

    // 项中所有自由变量的名称，按首次出现的顺序排列。
    public Set<String> freeVariables() {
        Set<String> free = new LinkedHashSet<>();
        collectFree(this, new LinkedHashSet<>(), free);
        return free;
    }

    private static void collectFree(Term term, Set<String> bound, Set<String> free) {
        if (term instanceof Var) {
            String name = ((Var) term).name;
            if (!bound.contains(name)) free.add(name);
        } else if (term instanceof Abs) {
            Abs abs = (Abs) term;
            // 内层的同名绑定已经在外层集合中时，退出时不能把它移除。
            boolean added = bound.add(abs.param);
            collectFree(abs.body, bound, free);
            if (added) bound.remove(abs.param);
        } else {
            App app = (App) term;
            collectFree(app.function, bound, free);
            collectFree(app.argument, bound, free);
        }
    }

    @Override
    public String toString() {
        return new AstPrinter().print(this);
    }
}
