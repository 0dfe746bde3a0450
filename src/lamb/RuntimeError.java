package lamb;

// 把一个不是函数的值当作函数应用时抛出。这对正在进行的求值是致命的，不会被强制转换或忽略。
public class RuntimeError extends RuntimeException {
    final Term.App term;
    final Value callee;

    RuntimeError(Term.App term, Value callee, String message) {
        super(message);
        this.term = term;
        this.callee = callee;
    }

    public Term.App getTerm() {
        return term;
    }

    public Value getCallee() {
        return callee;
    }
}
