package lamb;

// λ演算的词法非常小：只有四种单字符标记和标识符。
public enum TokenType {
    // Single-character tokens.
    LAMBDA, DOT, LEFT_PAREN, RIGHT_PAREN,

    // Literals.
    IDENTIFIER,

    EOF
}
