package org.featuretree.script;

import java.util.List;

/**
 * 语句语法树；每条语句都记录源码范围。
 */
public sealed interface Stmt {

    SourceSpan span();

    /** {@code a = b = value}：targets 依次为 a、b。 */
    record Assign(List<Expr> targets, Expr value, SourceSpan span) implements Stmt {
    }

    record AnnAssign(Expr target, Expr annotation, Expr value, SourceSpan span) implements Stmt {
    }

    record AugAssign(Expr target, BinaryOperator op, Expr value, SourceSpan span) implements Stmt {
    }

    record ExprStmt(Expr value, SourceSpan span) implements Stmt {
    }

    record Import(List<Alias> names, SourceSpan span) implements Stmt {
    }

    /** {@code from ..module import a as b}；{@code level} 为前导点数。 */
    record ImportFrom(String module, int level, List<Alias> names, SourceSpan span) implements Stmt {
    }

    record Pass(SourceSpan span) implements Stmt {
    }

    record Break(SourceSpan span) implements Stmt {
    }

    record Continue(SourceSpan span) implements Stmt {
    }

    record Return(Expr value, SourceSpan span) implements Stmt {
    }

    record Delete(List<Expr> targets, SourceSpan span) implements Stmt {
    }

    /** {@code global}/{@code nonlocal}。 */
    record Global(List<String> names, boolean nonlocal, SourceSpan span) implements Stmt {
    }

    record Assert(Expr test, Expr message, SourceSpan span) implements Stmt {
    }

    record Raise(Expr exception, Expr cause, SourceSpan span) implements Stmt {
    }

    record FunctionDef(String name, List<Expr.Param> params, Expr returns, List<Stmt> body,
                       List<Expr> decorators, SourceSpan span) implements Stmt {
    }

    record ClassDef(String name, List<Expr> bases, List<Expr.Keyword> keywords, List<Stmt> body,
                    List<Expr> decorators, SourceSpan span) implements Stmt {
    }

    /** {@code elif} 表示为 orElse 中唯一的 If。 */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, SourceSpan span) implements Stmt {
    }

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, SourceSpan span) implements Stmt {
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, SourceSpan span) implements Stmt {
    }

    record With(List<WithItem> items, List<Stmt> body, SourceSpan span) implements Stmt {
    }

    record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody,
               SourceSpan span) implements Stmt {
    }

    record Alias(String name, String asName) {
    }

    record WithItem(Expr context, Expr target) {
    }

    record ExceptHandler(Expr type, String name, List<Stmt> body) {
    }
}
