package org.featuretree.parse;

import org.featuretree.model.FeatureTreeException;
import org.featuretree.script.ScriptSyntaxException;

/**
 * 脚本无法解析（语法错误）。携带底层语法诊断、出错位置与原始脚本。
 */
public class ScriptParseException extends FeatureTreeException {

    private final String diagnostic;
    private final int line;
    private final int column;
    private final String script;

    public ScriptParseException(ScriptSyntaxException cause, String script) {
        super("脚本语法错误：" + cause.getMessage(), cause);
        this.diagnostic = cause.getReason();
        this.line = cause.getLine();
        this.column = cause.getColumn();
        this.script = script;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getScript() {
        return script;
    }

    /** 出错的那一行源码（找不到时为空串）。 */
    public String getOffendingLine() {
        if (script == null || line < 1) {
            return "";
        }
        String[] lines = script.split("\\r?\\n|\\r", -1);
        return line <= lines.length ? lines[line - 1] : "";
    }
}
