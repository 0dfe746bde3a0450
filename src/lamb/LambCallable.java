package lamb;

// 一元的函数值。每个λ抽象在运行时都变成一个LambCallable，宿主代码也可以直接用Java的lambda实现它。
@FunctionalInterface
public interface LambCallable {
    Value call(Value argument);
}
