package org.featuretree.script;

import java.util.List;

/**
 * 表达式语法树。
 */
public sealed interface Expr {

    record Name(String id) implements Expr {
    }

    /**
     * 字面量。
     *
     * @param value   Long/Double/String/Boolean；None、复数与省略号为 null
     * @param literal 源码原文（相邻字符串拼接时为各段原文以空格连接），打印时优先使用
     */
    record Constant(Object value, String literal) implements Expr {

        public static Constant of(Object value) {
            return new Constant(value, null);
        }
    }

    record Attribute(Expr value, String attr) implements Expr {
    }

    record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
    }

    /** 关键字实参；{@code name == null} 表示 {@code **value}。 */
    record Keyword(String name, Expr value) {
    }

    record Subscript(Expr value, Expr index) implements Expr {
    }

    record Slice(Expr lower, Expr upper, Expr step) implements Expr {
    }

    record BinOp(Expr left, BinaryOperator op, Expr right) implements Expr {
    }

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
    }

    /** {@code and}/{@code or}。 */
    record BoolOp(String op, List<Expr> values) implements Expr {
    }

    record Compare(Expr left, List<String> ops, List<Expr> comparators) implements Expr {
    }

    record IfExp(Expr test, Expr body, Expr orElse) implements Expr {
    }

    record Lambda(List<Param> params, Expr body) implements Expr {
    }

    record ListExpr(List<Expr> elements) implements Expr {
    }

    record TupleExpr(List<Expr> elements) implements Expr {
    }

    record SetExpr(List<Expr> elements) implements Expr {
    }

    /** 字典；{@code keys} 中的 null 表示 {@code **value} 展开。 */
    record DictExpr(List<Expr> keys, List<Expr> values) implements Expr {
    }

    /**
     * 推导式。
     *
     * @param kind    LIST/SET/DICT/GENERATOR
     * @param element 元素（字典推导式为 key）
     * @param value   字典推导式的 value，其他为 null
     * @param clauses for/if 子句
     */
    record Comprehension(ComprehensionKind kind, Expr element, Expr value, List<ComprehensionClause> clauses)
            implements Expr {
    }

    enum ComprehensionKind {
        LIST, SET, DICT, GENERATOR
    }

    record ComprehensionClause(Expr target, Expr iter, List<Expr> conditions) {
    }

    /** {@code *value} 或 {@code **value}。 */
    record Starred(Expr value, boolean doubleStar) implements Expr {
    }

    record NamedExpr(Name target, Expr value) implements Expr {
    }

    record Yield(Expr value, boolean from) implements Expr {
    }

    /**
     * 函数/lambda 形参。
     *
     * @param name         名称；单独的 {@code *} 与 {@code /} 分隔符为 null
     * @param annotation   类型注解（可选）
     * @param defaultValue 默认值（可选）
     * @param kind         ""（普通）、"*"、"**"、"/"
     */
    record Param(String name, Expr annotation, Expr defaultValue, String kind) {
    }
}
