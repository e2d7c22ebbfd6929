package org.featuretree.script;

/**
 * 词法单元。行号从 1 开始，列号从 0 开始（与行首的字符偏移），{@code endColumn} 不包含。
 *
 * @param type      类型
 * @param text      源码原文
 * @param value     NUMBER/STRING 的字面量值（Long/Double/String，复数字面量为 null）
 * @param line      起始行
 * @param column    起始列
 * @param endLine   结束行
 * @param endColumn 结束列
 */
public record Token(TokenType type, String text, Object value, int line, int column, int endLine, int endColumn) {

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.NAME && text.equals(keyword);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
