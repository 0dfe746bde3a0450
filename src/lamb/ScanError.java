package lamb;

// 扫描器遇到无法识别的字符时抛出。我们记录下字符本身和它的位置，由调用方决定如何展示。
public class ScanError extends RuntimeException {
    final char character;
    final int position;
    final int line;

    ScanError(char character, int position, int line) {
        super("Unexpected character '" + character + "'.");
        this.character = character;
        this.position = position;
        this.line = line;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }
}
