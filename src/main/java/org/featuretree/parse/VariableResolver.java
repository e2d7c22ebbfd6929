package org.featuretree.parse;

import org.featuretree.script.Expr;
import org.featuretree.script.ScriptModule;
import org.featuretree.script.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 顶层变量解析：先登记字面量，再做有上限的不动点迭代（最多 {@value #MAX_PASSES} 轮），
 * 每轮只用已解析的变量计算算术表达式。
 * <p>
 * 迭代结束后仍无法求值的算术表达式（变量名、一元/二元运算）退化为 {@value #DEFAULT_VALUE}，
 * 不会让整个解析失败。这是对任意代码求值问题的有意近似。
 */
public class VariableResolver {

    public static final int MAX_PASSES = 3;
    public static final double DEFAULT_VALUE = 1.0;

    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    private record Candidate(String name, Expr value) {
    }

    public ResolvedVariables resolve(ScriptModule module) {
        List<Candidate> candidates = collectCandidates(module.body());
        boolean[] done = new boolean[candidates.size()];
        ResolvedVariables variables = ResolvedVariables.empty();

        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (ExpressionEvaluator.isLiteral(candidate.value())) {
                Object value = ExpressionEvaluator.evaluate(candidate.value(), ResolvedVariables.empty()).orElse(null);
                if (value != null) {
                    variables = variables.with(candidate.name(), value);
                    done[i] = true;
                }
            }
        }

        int pass = 0;
        boolean progress = true;
        while (progress && pass < MAX_PASSES) {
            pass++;
            progress = false;
            for (int i = 0; i < candidates.size(); i++) {
                if (done[i]) {
                    continue;
                }
                Candidate candidate = candidates.get(i);
                Object value = ExpressionEvaluator.evaluate(candidate.value(), variables).orElse(null);
                if (value != null) {
                    variables = variables.with(candidate.name(), value);
                    done[i] = true;
                    progress = true;
                }
            }
        }

        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (!done[i] && !variables.contains(candidate.name()) && ExpressionEvaluator.isArithmetic(candidate.value())) {
                log.debug("变量 {} 在 {} 轮内无法求值，使用默认值 {}", candidate.name(), pass, DEFAULT_VALUE);
                variables = variables.withDefault(candidate.name(), DEFAULT_VALUE);
            }
        }
        return variables;
    }

    private static List<Candidate> collectCandidates(List<Stmt> body) {
        List<Candidate> out = new ArrayList<>();
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.Assign assign) {
                for (Expr target : assign.targets()) {
                    addTarget(out, target, assign.value());
                }
            } else if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.value() != null) {
                addTarget(out, annAssign.target(), annAssign.value());
            } else if (stmt instanceof Stmt.AugAssign augAssign && augAssign.target() instanceof Expr.Name name) {
                out.add(new Candidate(name.id(), new Expr.BinOp(name, augAssign.op(), augAssign.value())));
            }
        }
        return out;
    }

    private static void addTarget(List<Candidate> out, Expr target, Expr value) {
        if (target instanceof Expr.Name name) {
            out.add(new Candidate(name.id(), value));
            return;
        }
        // a, b = 1, 2
        if (target instanceof Expr.TupleExpr tuple && value instanceof Expr.TupleExpr values
                && tuple.elements().size() == values.elements().size()) {
            for (int i = 0; i < tuple.elements().size(); i++) {
                addTarget(out, tuple.elements().get(i), values.elements().get(i));
            }
        }
    }
}
