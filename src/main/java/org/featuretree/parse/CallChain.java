package org.featuretree.parse;

import org.featuretree.script.Expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 方法链分解结果：{@code base.a(..).b(..).c(..)} -> base 与有序调用 [a, b, c]。
 *
 * @param base  链的起点（可能为 null，例如 {@code Workplane("XY")} 直接调用）
 * @param links 按执行顺序排列的调用
 */
public record CallChain(Expr base, List<Link> links) {

    public record Link(String method, Expr.Call call) {
    }

    public static Optional<CallChain> of(Expr expr) {
        if (!(expr instanceof Expr.Call)) {
            return Optional.empty();
        }
        Deque<Link> links = new ArrayDeque<>();
        Expr current = expr;
        while (current instanceof Expr.Call call) {
            if (call.func() instanceof Expr.Attribute attribute) {
                links.addFirst(new Link(attribute.attr(), call));
                current = attribute.value();
            } else if (call.func() instanceof Expr.Name name) {
                links.addFirst(new Link(name.id(), call));
                current = null;
            } else {
                // (f)(x) 之类无法分解的调用：整体作为起点
                break;
            }
        }
        return Optional.of(new CallChain(current, List.copyOf(links)));
    }

    /**
     * 起点表达式的根变量名：{@code parts[0].x} 的根为 {@code parts}，{@code cq.Workplane} 的根为 {@code cq}。
     */
    public Optional<String> rootName() {
        return rootName(base);
    }

    static Optional<String> rootName(Expr expr) {
        Expr current = expr;
        while (current != null) {
            if (current instanceof Expr.Name name) {
                return Optional.of(name.id());
            }
            if (current instanceof Expr.Attribute attribute) {
                current = attribute.value();
            } else if (current instanceof Expr.Subscript subscript) {
                current = subscript.value();
            } else if (current instanceof Expr.Call call) {
                current = call.func();
            } else {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
