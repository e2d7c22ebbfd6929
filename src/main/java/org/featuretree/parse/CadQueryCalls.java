package org.featuretree.parse;

import org.featuretree.model.FeatureType;
import org.featuretree.script.Expr;

import java.util.Map;
import java.util.Optional;

/**
 * 脚本调用名 -> 特征类型的固定映射表；表外的调用不会生成特征节点。
 */
public final class CadQueryCalls {

    private static final Map<String, FeatureType> CALLS = Map.ofEntries(
            Map.entry("Workplane", FeatureType.WORKPLANE),
            Map.entry("workplane", FeatureType.WORKPLANE),
            Map.entry("rect", FeatureType.SKETCH),
            Map.entry("circle", FeatureType.SKETCH),
            Map.entry("ellipse", FeatureType.SKETCH),
            Map.entry("polygon", FeatureType.SKETCH),
            Map.entry("polyline", FeatureType.SKETCH),
            Map.entry("spline", FeatureType.SKETCH),
            Map.entry("line", FeatureType.SKETCH),
            Map.entry("arc", FeatureType.SKETCH),
            Map.entry("slot2D", FeatureType.SKETCH),
            Map.entry("extrude", FeatureType.EXTRUDE),
            Map.entry("revolve", FeatureType.REVOLVE),
            Map.entry("loft", FeatureType.LOFT),
            Map.entry("sweep", FeatureType.SWEEP),
            Map.entry("box", FeatureType.BOX),
            Map.entry("cylinder", FeatureType.CYLINDER),
            Map.entry("sphere", FeatureType.SPHERE),
            Map.entry("cone", FeatureType.CONE),
            Map.entry("torus", FeatureType.TORUS),
            Map.entry("union", FeatureType.UNION),
            Map.entry("fuse", FeatureType.UNION),
            Map.entry("cut", FeatureType.DIFFERENCE),
            Map.entry("intersect", FeatureType.INTERSECTION),
            Map.entry("fillet", FeatureType.FILLET),
            Map.entry("chamfer", FeatureType.CHAMFER),
            Map.entry("mirror", FeatureType.MIRROR),
            Map.entry("rarray", FeatureType.PATTERN_LINEAR),
            Map.entry("polarArray", FeatureType.PATTERN_CIRCULAR));

    private CadQueryCalls() {
    }

    public static Optional<FeatureType> featureTypeOf(String call) {
        return Optional.ofNullable(CALLS.get(call));
    }

    /** 调用名（{@code f(...)} 或 {@code x.f(...)} 中的 f），其他形式返回 null。 */
    public static String callName(Expr.Call call) {
        if (call.func() instanceof Expr.Name name) {
            return name.id();
        }
        if (call.func() instanceof Expr.Attribute attribute) {
            return attribute.attr();
        }
        return null;
    }

    /** 表达式中是否包含任何映射表内的调用。 */
    public static boolean containsFeatureCall(Expr expr) {
        if (expr == null) {
            return false;
        }
        if (expr instanceof Expr.Call call) {
            String name = callName(call);
            if (name != null && CALLS.containsKey(name)) {
                return true;
            }
            if (containsFeatureCall(call.func())) {
                return true;
            }
            for (Expr arg : call.args()) {
                if (containsFeatureCall(arg)) {
                    return true;
                }
            }
            for (Expr.Keyword keyword : call.keywords()) {
                if (containsFeatureCall(keyword.value())) {
                    return true;
                }
            }
            return false;
        }
        if (expr instanceof Expr.Attribute attribute) {
            return containsFeatureCall(attribute.value());
        }
        if (expr instanceof Expr.Subscript subscript) {
            return containsFeatureCall(subscript.value()) || containsFeatureCall(subscript.index());
        }
        if (expr instanceof Expr.BinOp binOp) {
            return containsFeatureCall(binOp.left()) || containsFeatureCall(binOp.right());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return containsFeatureCall(unary.operand());
        }
        if (expr instanceof Expr.IfExp ifExp) {
            return containsFeatureCall(ifExp.test()) || containsFeatureCall(ifExp.body())
                    || containsFeatureCall(ifExp.orElse());
        }
        if (expr instanceof Expr.ListExpr list) {
            return list.elements().stream().anyMatch(CadQueryCalls::containsFeatureCall);
        }
        if (expr instanceof Expr.TupleExpr tuple) {
            return tuple.elements().stream().anyMatch(CadQueryCalls::containsFeatureCall);
        }
        if (expr instanceof Expr.Comprehension comprehension) {
            return containsFeatureCall(comprehension.element());
        }
        return false;
    }
}
