package org.featuretree.params;

import org.featuretree.model.ParameterValues;
import org.featuretree.parse.ScriptParseException;
import org.featuretree.script.ExprPrinter;
import org.featuretree.script.PythonLiterals;
import org.featuretree.script.ScriptModule;
import org.featuretree.script.ScriptParser;
import org.featuretree.script.ScriptSyntaxException;
import org.featuretree.script.SourceSpan;
import org.featuretree.script.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 原位修改脚本中的单个变量赋值。
 * <p>
 * 通过语法树定位第一个对该变量的顶层赋值，只替换这条语句在源码中的范围；
 * 缩进、同一行的其他语句与行尾注释、以及其他所有字节保持不变。
 */
public class ParameterPatcher {

    private static final Logger log = LoggerFactory.getLogger(ParameterPatcher.class);

    /**
     * @param script     原脚本
     * @param sourceName 变量名
     * @param newValue   新值（数值/字符串/布尔/列表）
     * @return 修改后的脚本
     * @throws ParameterPatchException 找不到赋值，或赋值跨越多行
     * @throws ScriptParseException    原脚本无法解析
     */
    public String patch(String script, String sourceName, Object newValue) {
        ScriptModule module;
        try {
            module = ScriptParser.parse(script);
        } catch (ScriptSyntaxException e) {
            throw new ScriptParseException(e, script);
        }
        ParameterExtractor.Assignment assignment = module.body().stream()
                .map(ParameterExtractor.Assignment::of)
                .flatMap(Optional::stream)
                .filter(a -> a.name().equals(sourceName))
                .findFirst()
                .orElseThrow(() -> new ParameterPatchException(sourceName, "脚本中没有对该变量的顶层赋值"));

        SourceSpan span = assignment.statement().span();
        if (!span.isSingleLine()) {
            throw new ParameterPatchException(sourceName, "赋值语句跨越多行（第 " + span.line() + "-"
                    + span.endLine() + " 行），无法原位修改");
        }

        String literal = PythonLiterals.format(ParameterValues.normalize(newValue));
        String replacement = assignment.statement() instanceof Stmt.AnnAssign annotated
                ? sourceName + ": " + ExprPrinter.print(annotated.annotation()) + " = " + literal
                : sourceName + " = " + literal;

        int lineStart = lineOffset(script, span.line());
        int from = lineStart + span.column();
        int to = lineStart + span.endColumn();
        log.debug("修改参数 {}：第 {} 行 [{}, {}) -> {}", sourceName, span.line(), span.column(), span.endColumn(),
                literal);
        return script.substring(0, from) + replacement + script.substring(to);
    }

    /** 第 line 行（从 1 开始）在脚本中的起始偏移；换行符 {@code \r\n}、{@code \n}、{@code \r} 各算一次。 */
    private static int lineOffset(String script, int line) {
        int offset = !script.isEmpty() && script.charAt(0) == '\uFEFF' ? 1 : 0;
        int current = 1;
        while (current < line && offset < script.length()) {
            char c = script.charAt(offset);
            if (c == '\r' && offset + 1 < script.length() && script.charAt(offset + 1) == '\n') {
                offset += 2;
                current++;
            } else if (c == '\n' || c == '\r') {
                offset++;
                current++;
            } else {
                offset++;
            }
        }
        return offset;
    }
}
