package lamb;

import java.util.HashSet;
import java.util.Set;

// 把求值结果转换回可以显示的语法。
// 变量直接变成变量项。闭包则用一个代表未绑定变量的探针值去调用它，
// 再把结果具体化并包进一个以探针命名的抽象中。返回闭包的闭包会以同样的方式得到嵌套的抽象链。
// 每次探测都会消耗一层抽象，所以对有限的项求值得到的闭包，具体化总会终止。
public class Reifier {
    private static final String PROBE = "x";
    // 占位符的名称无法被扫描器识别为标识符，所以不会与结果中的任何变量冲突。
    private static final String PLACEHOLDER = "#";

    private final boolean freshNames;

    private Reifier(boolean freshNames) {
        this.freshNames = freshNames;
    }

    // 所有的探针都叫x，所以多参数函数的结果会出现同名的绑定，例如 \x. \x. x。
    // 结果中名为x的自由变量也会被探针的绑定捕获。
    public Reifier() {
        this(false);
    }

    // 绑定名称在探测之后才确定：先用占位符探测并具体化内层，再从 x、y、z、aa、ab…… 中
    // 按嵌套深度挑选第一个既不是内层自由变量、也没有被内层绑定使用的名称，替换掉占位符。
    // 于是同一条抽象链中的绑定名称互不相同，也不会捕获结果中的自由变量。
    // 名称只包含字母，所以具体化的结果打印出来后仍然可以被解析。
    public static Reifier withFreshNames() {
        return new Reifier(true);
    }

    public Term reify(Value value) {
        return reify(value, 0);
    }

    private Term reify(Value value, int depth) {
        if (value instanceof Value.Var) {
            return new Term.Var(((Value.Var) value).name);
        }

        Value.Closure closure = (Value.Closure) value;
        if (!freshNames) {
            return new Term.Abs(PROBE, reify(closure.call(new Value.Var(PROBE)), depth + 1));
        }

        String placeholder = PLACEHOLDER + depth;
        Term body = reify(closure.call(new Value.Var(placeholder)), depth + 1);

        Set<String> taken = new HashSet<>(body.freeVariables());
        collectBinders(body, taken);
        int index = depth;
        while (taken.contains(nameAt(index))) index++;

        // 选出的名称不是内层的绑定，所以这次替换不会发生捕获。
        String name = nameAt(index);
        return new Term.Abs(name, Substitution.subst(placeholder, new Term.Var(name), body));
    }

    private static void collectBinders(Term term, Set<String> binders) {
        if (term instanceof Term.Abs) {
            Term.Abs abs = (Term.Abs) term;
            binders.add(abs.param);
            collectBinders(abs.body, binders);
        } else if (term instanceof Term.App) {
            Term.App app = (Term.App) term;
            collectBinders(app.function, binders);
            collectBinders(app.argument, binders);
        }
    }

    private static String nameAt(int index) {
        // 以x为起点的双射26进制。
        StringBuilder name = new StringBuilder();
        int n = index + (PROBE.charAt(0) - 'a');
        do {
            name.insert(0, (char) ('a' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return name.toString();
    }
}
