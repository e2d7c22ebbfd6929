package org.featuretree.params;

import org.featuretree.model.Parameter;
import org.featuretree.model.ParameterType;
import org.featuretree.parse.CadQueryCalls;
import org.featuretree.parse.ExpressionEvaluator;
import org.featuretree.parse.ResolvedVariables;
import org.featuretree.parse.ScriptParseException;
import org.featuretree.script.Expr;
import org.featuretree.script.ScriptModule;
import org.featuretree.script.ScriptParser;
import org.featuretree.script.ScriptSyntaxException;
import org.featuretree.script.Stmt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 提取脚本开头的“设计参数”区：第一个建模调用之前、值为字面量的顶层赋值。
 * <p>
 * import 语句跳过；遇到 {@code def}/{@code class} 或任何包含建模调用的语句即停止。
 * 同名变量只取第一次赋值（与 {@link ParameterPatcher} 修改的位置一致）。
 */
public class ParameterExtractor {

    private static final List<String> LENGTH_HINTS = List.of(
            "radius", "diameter", "width", "height", "thickness", "length",
            "distance", "offset", "spacing", "depth", "size");
    private static final List<String> ANGLE_HINTS = List.of("angle", "rotation");

    public List<Parameter> extract(String script) {
        ScriptModule module;
        try {
            module = ScriptParser.parse(script);
        } catch (ScriptSyntaxException e) {
            throw new ScriptParseException(e, script);
        }
        List<Parameter> parameters = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Stmt stmt : module.body()) {
            if (stmt instanceof Stmt.Import || stmt instanceof Stmt.ImportFrom) {
                continue;
            }
            if (stmt instanceof Stmt.FunctionDef || stmt instanceof Stmt.ClassDef || endsParameterBlock(stmt)) {
                break;
            }
            Optional<Assignment> assignment = Assignment.of(stmt);
            if (assignment.isEmpty() || !ExpressionEvaluator.isLiteral(assignment.get().value())) {
                continue;
            }
            String name = assignment.get().name();
            Optional<Object> value = ExpressionEvaluator.evaluate(assignment.get().value(), ResolvedVariables.empty());
            if (value.isPresent() && seen.add(name)) {
                parameters.add(toParameter(name, value.get()));
            }
        }
        return parameters;
    }

    static Parameter toParameter(String variable, Object value) {
        String displayName = displayName(variable);
        Double min = null;
        Double max = null;
        if (value instanceof Number number && number.doubleValue() > 0) {
            double v = number.doubleValue();
            if (v <= 1) {
                min = 0.1;
                max = 1.0;
            } else if (v <= 10) {
                min = 0.1;
                max = v * 2;
            } else if (v <= 100) {
                min = 1.0;
                max = 100.0;
            } else {
                min = 1.0;
                max = v * 2;
            }
        }
        return new Parameter(displayName, value, ParameterType.infer(value), "Design parameter: " + displayName,
                units(variable, value), min, max, variable);
    }

    /** {@code wall_thickness} -> {@code Wall Thickness}。 */
    static String displayName(String variable) {
        List<String> words = new ArrayList<>();
        for (String word : variable.split("_")) {
            if (!word.isEmpty()) {
                words.add(Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return words.isEmpty() ? variable : String.join(" ", words);
    }

    static String units(String variable, Object value) {
        if (!(value instanceof Number)) {
            return null;
        }
        String lower = variable.toLowerCase(Locale.ROOT);
        if (ANGLE_HINTS.stream().anyMatch(lower::contains)) {
            return "degrees";
        }
        if (LENGTH_HINTS.stream().anyMatch(lower::contains)) {
            return "mm";
        }
        return null;
    }

    private static boolean endsParameterBlock(Stmt stmt) {
        if (stmt instanceof Stmt.Assign assign) {
            return CadQueryCalls.containsFeatureCall(assign.value());
        }
        if (stmt instanceof Stmt.AnnAssign annAssign) {
            return CadQueryCalls.containsFeatureCall(annAssign.value());
        }
        if (stmt instanceof Stmt.AugAssign augAssign) {
            return CadQueryCalls.containsFeatureCall(augAssign.value());
        }
        if (stmt instanceof Stmt.ExprStmt exprStmt) {
            return CadQueryCalls.containsFeatureCall(exprStmt.value());
        }
        // 复合语句视为参数区结束
        return stmt instanceof Stmt.If || stmt instanceof Stmt.For || stmt instanceof Stmt.While
                || stmt instanceof Stmt.With || stmt instanceof Stmt.Try;
    }

    /** 单变量赋值：{@code name = value} 或 {@code name: T = value}。 */
    record Assignment(String name, Expr value, Stmt statement) {

        static Optional<Assignment> of(Stmt stmt) {
            if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1
                    && assign.targets().get(0) instanceof Expr.Name name) {
                return Optional.of(new Assignment(name.id(), assign.value(), stmt));
            }
            if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.value() != null
                    && annAssign.target() instanceof Expr.Name name) {
                return Optional.of(new Assignment(name.id(), annAssign.value(), stmt));
            }
            return Optional.empty();
        }
    }
}
