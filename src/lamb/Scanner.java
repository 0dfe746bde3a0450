package lamb;

import java.util.ArrayList;
import java.util.List;

import static lamb.TokenType.*;

// 扫描器从源码的第一个字符开始，计算出该字符属于哪个词素，并消费它和属于该词素的任何后续字符。
// 到达词素末尾时输出一个标记，然后从下一个字符开始再做一次，直到输入的终点。
// λ演算的词法语法只有单字符标记和由字母组成的标识符，所以一个字符的前瞻就足够了，扫描器永远不需要回溯。
public class Scanner {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    // start指向被扫描的词素中的第一个字符，current指向当前正在处理的字符。
    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Scanner(String source) {
        this.source = source;
    }

    // 遍历源代码，添加标记，直到遍历完所有字符。然后在最后附加一个EOF标记。
    // 遇到第一个无法识别的字符就抛出ScanError，整个扫描失败，不返回任何标记。
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            // 我们正处于下一个词素的开头。
            start = current;
            scanToken();
        }

        tokens.add(new Token(EOF, "", current, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 反斜杠是λ的ASCII写法，两者等价。
            case '\\':
            case 'λ':
                addToken(LAMBDA);
                break;
            case '.':
                addToken(DOT);
                break;
            case '(':
                addToken(LEFT_PAREN);
                break;
            case ')':
                addToken(RIGHT_PAREN);
                break;
            case ' ':
            case '\r':
            case '\t':
                break;
            case '\n':
                line++;
                break;

            default:
                // 最大匹配原则：连续的字母组成一个标识符。
                if (isAlpha(c)) {
                    processIdentifier();
                } else {
                    throw new ScanError(c, start, line);
                }
                break;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        current++;
        return source.charAt(current - 1);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, start, line));
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    // 标识符只能由字母组成，不允许数字、下划线或连字符。λ本身是一个字母，但它已经被保留为抽象的开头。
    private boolean isAlpha(char c) {
        return c != 'λ' && Character.isLetter(c);
    }

    private void processIdentifier() {
        while (isAlpha(peek())) advance();

        addToken(IDENTIFIER);
    }
}
