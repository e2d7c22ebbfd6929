package org.featuretree.script;

/**
 * 脚本词法/语法错误，携带出错位置（行从 1 开始，列从 0 开始）。
 */
public class ScriptSyntaxException extends RuntimeException {

    private final String reason;
    private final int line;
    private final int column;

    public ScriptSyntaxException(String reason, int line, int column) {
        super(reason + "（第 " + line + " 行，第 " + (column + 1) + " 列）");
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /** 不含位置信息的错误描述。 */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
