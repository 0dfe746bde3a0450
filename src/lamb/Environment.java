package lamb;

import java.util.Objects;

// 变量与值之间的绑定关系保存在环境中。
// 这里的环境是不可变的：每个环境只持有一个绑定和一个对外围环境的引用。
// 扩展环境总是产生一个新的环境，原来的环境不受影响，所以闭包捕获的环境在它创建之后永远不会改变。
public class Environment {
    private static final Environment EMPTY = new Environment(null, null, null);

    final Environment enclosing;
    private final String name;
    private final Value value;

    private Environment(Environment enclosing, String name, Value value) {
        this.enclosing = enclosing;
        this.name = name;
        this.value = value;
    }

    // 空环境是环境链的结束点。每次对程序求值都从它开始。
    public static Environment empty() {
        return EMPTY;
    }

    // 新的绑定遮蔽外围环境中的同名绑定。
    public Environment extend(String name, Value value) {
        return new Environment(this, Objects.requireNonNull(name), value);
    }

    // 如果当前环境中没有找到变量，就在外围环境中尝试，直到遍历完整个链路。没有绑定时返回null。
    public Value get(String name) {
        for (Environment environment = this; environment != EMPTY; environment = environment.enclosing) {
            if (environment.name.equals(name)) return environment.value;
        }
        return null;
    }

    public boolean isBound(String name) {
        return get(name) != null;
    }
}
