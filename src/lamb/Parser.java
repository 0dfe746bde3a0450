package lamb;

import java.util.List;

import static lamb.TokenType.*;

// 自顶向下的递归下降解析器。每条语法规则对应一个方法，除了有限的前瞻之外不做回溯。
//
// term        → application ;
// application → atom atom* ;
// atom        → IDENTIFIER
//             | "\" IDENTIFIER "." term
//             | "(" term ")" ;
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Term parse(String source) {
        return new Parser(new Scanner(source).scanTokens()).parse();
    }

    // 解析器必须消费所有输入。一个完整的项之后还剩下标记，本身就是一个错误，而不是被默默忽略。
    public Term parse() {
        Term term = term();
        if (!isAtEnd()) {
            throw error(ParseError.Kind.TRAILING_INPUT, peek(), "Expect end of input.");
        }
        return term;
    }

    // term → application ;
    private Term term() {
        return application();
    }

    // application → atom atom* ;
    // 应用是左结合的：f x y 会被折叠成 (f x) y。
    // 遇到')'时停下，把它留给外层的括号去匹配。
    private Term application() {
        Term term = atom();

        while (!isAtEnd() && !check(RIGHT_PAREN)) {
            Term argument = atom();
            term = new Term.App(term, argument);
        }

        return term;
    }

    private Term atom() {
        if (match(IDENTIFIER)) {
            return new Term.Var(previous().lexeme);
        }

        if (match(LAMBDA)) {
            return abstraction();
        }

        if (match(LEFT_PAREN)) {
            Term term = term();
            consume(RIGHT_PAREN, "Expect ')' after expression.");
            return term;
        }

        if (isAtEnd()) {
            throw error(ParseError.Kind.UNEXPECTED_END_OF_INPUT, peek(), "Expect expression.");
        }

        // 剩下的')'和'.'都不能作为一个项的开头。
        throw error(ParseError.Kind.INVALID_EXPRESSION, peek(), "Expect expression.");
    }

    // 抽象的主体会尽可能向右延伸：它吞下一个完整的项，而不仅仅是下一个原子。
    // 所以 \x. x y 是 \x. (x y)。要限制主体的范围，必须使用括号。
    private Term abstraction() {
        Token param = consume(IDENTIFIER, "Expect parameter name after '\\'.");
        consume(DOT, "Expect '.' after parameter name.");
        Term body = term();
        return new Term.Abs(param.lexeme, body);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();

        if (isAtEnd()) throw error(ParseError.Kind.UNEXPECTED_END_OF_INPUT, peek(), message);
        throw error(ParseError.Kind.UNEXPECTED_TOKEN, peek(), message);
    }

    private boolean isAtEnd() {
        return peek().type == EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ParseError error(ParseError.Kind kind, Token token, String message) {
        return new ParseError(kind, token, message);
    }
}
