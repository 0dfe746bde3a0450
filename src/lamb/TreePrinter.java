package lamb;

// 用制表符把语法树画成缩进的树形图，仅用于诊断显示。
//
// └── App
// │ ├── Abs (x)
// │   └── Var (x)
//   └── Var (y)
public class TreePrinter {
    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";

    public String print(Term term) {
        StringBuilder tree = new StringBuilder();
        print(term, "", true, tree);
        return tree.toString();
    }

    private void print(Term term, String indent, boolean isLast, StringBuilder tree) {
        tree.append(indent).append(isLast ? LAST_BRANCH : BRANCH);

        if (term instanceof Term.Var) {
            tree.append("Var (").append(((Term.Var) term).name).append(")\n");
        } else if (term instanceof Term.Abs) {
            Term.Abs abs = (Term.Abs) term;
            tree.append("Abs (").append(abs.param).append(")\n");
            print(abs.body, indent + "  ", true, tree);
        } else {
            Term.App app = (Term.App) term;
            tree.append("App\n");
            print(app.function, indent + "│ ", false, tree);
            print(app.argument, indent + "  ", true, tree);
        }
    }
}
