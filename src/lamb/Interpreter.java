package lamb;

// 按值调用、基于环境的求值器。
// 求值时不做显式的替换：抽象被求值为捕获了当前环境的闭包，应用则直接调用这个闭包。
// 解释器的environment字段会随着进入和退出函数调用而改变，所以一个Interpreter实例只能在一个线程中使用。
public class Interpreter implements Term.Visitor<Value> {
    private Environment environment = Environment.empty();

    public Value evaluate(Term term) {
        return evaluate(term, Environment.empty());
    }

    // 在给定的环境中对项求值，结束后恢复之前的环境。
    public Value evaluate(Term term, Environment environment) {
        Environment previous = this.environment;
        try {
            this.environment = environment;
            return term.accept(this);
        } finally {
            this.environment = previous;
        }
    }

    // 未绑定的标识符被当作它自己，这样开放的项也能求值。
    @Override
    public Value visitVarTerm(Term.Var term) {
        Value value = environment.get(term.name);
        if (value != null) return value;
        return new Value.Var(term.name);
    }

    @Override
    public Value visitAbsTerm(Term.Abs term) {
        return new Value.Closure(new LambFunction(this, term, environment));
    }

    // 先对函数求值，再对参数求值，然后调用。
    @Override
    public Value visitAppTerm(Term.App term) {
        Value callee = term.function.accept(this);
        Value argument = term.argument.accept(this);

        if (!(callee instanceof Value.Closure)) {
            throw new RuntimeError(term, callee,
                    "Can only apply functions, but '" + callee + "' is not a function.");
        }

        return ((Value.Closure) callee).call(argument);
    }
}
