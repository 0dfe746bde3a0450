package lamb;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

// 驱动程序：从文件或交互式提示符读取源码，每一行都是一个独立的输入单元。
// 对每个单元依次进行扫描、解析、求值和具体化，最后把结果打印回λ演算的语法。
public class Lamb {
    // 我们将以此来确保不会尝试执行有已知错误的代码。
    static boolean hadError = false;
    static boolean hadRuntimeError = false;
    // 为true时在结果之前打印解析出的语法树。
    static boolean showTree = false;

    public static void main(String[] args) throws IOException {
        int argument = 0;
        if (args.length > 0 && args[0].equals("--tree")) {
            showTree = true;
            argument++;
        }

        if (args.length - argument > 1) {
            System.out.println("Usage: lamb [--tree] [script]");
            System.exit(64);
        } else if (args.length - argument == 1) {
            runFile(args[argument]);
        } else {
            runPrompt();
        }
    }

    private static void runFile(String path) throws IOException {
        List<String> lines = Files.readAllLines(Paths.get(path), StandardCharsets.UTF_8);
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) continue;
            runUnit(line, lineNumber);
        }

        // 在退出代码中指出错误
        if (hadError) System.exit(65);
        if (hadRuntimeError) System.exit(70);
    }

    private static void runPrompt() throws IOException {
        InputStreamReader input = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        BufferedReader reader = new BufferedReader(input);

        while (true) {
            System.out.print("> ");
            // 输入结束时readLine()返回null，退出循环。
            String line = reader.readLine();
            if (line == null) break;
            if (line.isBlank()) continue;

            runUnit(line, 1);
            // 用户输入有误不应终止整个会话。
            hadError = false;
            hadRuntimeError = false;
        }
    }

    private static void runUnit(String source, int line) {
        try {
            Term term = Parser.parse(source);
            if (showTree) System.out.print(new TreePrinter().print(term));
            System.out.println(run(term));
        } catch (ScanError error) {
            error(line, error);
        } catch (ParseError error) {
            error(line, error);
        } catch (RuntimeError error) {
            runtimeError(line, error);
        }
    }

    // 交互式提示符和文件运行工具都是对这个核心函数的简单包装。
    // 每个输入单元都在一个新的空环境中求值，错误以异常的形式抛给调用方。
    public static String run(String source) {
        return run(Parser.parse(source));
    }

    private static String run(Term term) {
        Value value = new Interpreter().evaluate(term, Environment.empty());
        return Reifier.withFreshNames().reify(value).toString();
    }

    static void error(int line, ScanError error) {
        report(line, " at position " + error.position, error.getMessage());
    }

    // 报告给定标记处的错误。它显示了标记的位置和标记本身。
    static void error(int line, ParseError error) {
        if (error.token.type == TokenType.EOF) {
            report(line, " at end", error.getMessage());
        } else {
            report(line, " at '" + error.token.lexeme + "' (position " + error.token.position + ")",
                    error.getMessage());
        }
    }

    static void runtimeError(int line, RuntimeError error) {
        System.err.println(error.getMessage() + "\n[line " + line + "] in '" + error.term + "'");
        hadRuntimeError = true;
    }

    private static void report(int line, String where, String message) {
        System.err.println("[line " + line + "] Error" + where + ": " + message);
        hadError = true;
    }
}
