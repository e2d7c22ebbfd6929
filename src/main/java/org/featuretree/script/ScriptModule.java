package org.featuretree.script;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个脚本的语法树根。
 *
 * @param body   顶层语句
 * @param source 原始脚本
 */
public record ScriptModule(List<Stmt> body, String source) {

    public ScriptModule {
        body = List.copyOf(body);
    }

    /**
     * 按源码顺序（先序）返回所有语句，包括函数体、类体和各控制块内部的语句。
     */
    public List<Stmt> allStatements() {
        List<Stmt> out = new ArrayList<>();
        collect(body, out);
        return out;
    }

    private static void collect(List<Stmt> statements, List<Stmt> out) {
        for (Stmt stmt : statements) {
            out.add(stmt);
            if (stmt instanceof Stmt.FunctionDef fn) {
                collect(fn.body(), out);
            } else if (stmt instanceof Stmt.ClassDef cls) {
                collect(cls.body(), out);
            } else if (stmt instanceof Stmt.If ifStmt) {
                collect(ifStmt.body(), out);
                collect(ifStmt.orElse(), out);
            } else if (stmt instanceof Stmt.For forStmt) {
                collect(forStmt.body(), out);
                collect(forStmt.orElse(), out);
            } else if (stmt instanceof Stmt.While whileStmt) {
                collect(whileStmt.body(), out);
                collect(whileStmt.orElse(), out);
            } else if (stmt instanceof Stmt.With with) {
                collect(with.body(), out);
            } else if (stmt instanceof Stmt.Try tryStmt) {
                collect(tryStmt.body(), out);
                for (Stmt.ExceptHandler handler : tryStmt.handlers()) {
                    collect(handler.body(), out);
                }
                collect(tryStmt.orElse(), out);
                collect(tryStmt.finalBody(), out);
            }
        }
    }
}
