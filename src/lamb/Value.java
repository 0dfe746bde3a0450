package lamb;

import java.util.Objects;

// 求值的结果。函数直接用宿主语言中的一元函数表示，而不是语法树加上显式的替换步骤。
// 要把函数重新显示为语法，需要通过Reifier进行具体化。
public abstract class Value {
    // 求值无法解释为函数的自由标识符，就原样作为值。
    public static final class Var extends Value {
        final String name;

        public Var(String name) {
            this.name = Objects.requireNonNull(name);
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

        @Override
        public String toString() {
            return name;
        }
    }

    // 闭包只按同一性比较：即使两个闭包行为完全相同，它们也永远不相等。
    public static final class Closure extends Value {
        final LambCallable function;

        public Closure(LambCallable function) {
            this.function = Objects.requireNonNull(function);
        }

        public Value call(Value argument) {
            return function.call(argument);
        }

        @Override
        public String toString() {
            return "<closure>";
        }
    }
}
