package org.featuretree.script;

/**
 * 词法单元类型。
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    END
}
