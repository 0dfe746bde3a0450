package lamb;

// 解析失败时抛出。解析器不做任何恢复，第一个错误就终止整个解析。
public class ParseError extends RuntimeException {
    public enum Kind {
        // 某个结构期望一类标记，却遇到了另一类。
        UNEXPECTED_TOKEN,
        // 结构还没完成，标记就用完了。
        UNEXPECTED_END_OF_INPUT,
        // 无法以当前标记开始一个原子项，例如以')'开头。
        INVALID_EXPRESSION,
        // 完整的项之后还有没被消费的标记。
        TRAILING_INPUT
    }

    final Kind kind;
    final Token token;

    ParseError(Kind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public Kind getKind() {
        return kind;
    }

    public Token getToken() {
        return token;
    }
}
