package lamb;

// λ抽象的运行时表示：声明本身加上创建时的环境。
class LambFunction implements LambCallable {
    private final Interpreter interpreter;
    private final Environment closure;
    private final Term.Abs declaration;

    LambFunction(Interpreter interpreter, Term.Abs declaration, Environment closure) {
        this.interpreter = interpreter;
        this.closure = closure;
        this.declaration = declaration;
    }

    // 每次调用都基于捕获的环境创建一个新的环境，并在其中绑定参数。捕获的环境本身不会被修改，
    // 所以用同样的参数重复调用同一个闭包总是得到同样的结果。
    @Override
    public Value call(Value argument) {
        Environment environment = closure.extend(declaration.param, argument);
        return interpreter.evaluate(declaration.body, environment);
    }

    @Override
    public String toString() {
        return "<fn \\" + declaration.param + ">";
    }
}
