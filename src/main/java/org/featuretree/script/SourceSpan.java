package org.featuretree.script;

/**
 * 语句在源码中的范围：行从 1 开始，列从 0 开始，结束列不包含。
 */
public record SourceSpan(int line, int column, int endLine, int endColumn) {

    public boolean isSingleLine() {
        return line == endLine;
    }
}
