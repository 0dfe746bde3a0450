package lamb;

import java.util.Objects;

// 我们将词素和它在源码中的位置打包到一个类中，供解析器和错误报告使用。
public class Token {
    final TokenType type;
    final String lexeme;
    // position是词素第一个字符在源码中的偏移量（从0开始）。
    final int position;
    final int line;

    Token(TokenType type, String lexeme, int position, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.position = position;
        this.line = line;
    }

    // 两个标记只要类型和词素相同就相等，位置只用于报告错误。
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return type == token.type && lexeme.equals(token.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme);
    }

    public String toString() {
        return type + " " + lexeme;
    }
}
