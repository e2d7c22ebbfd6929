package org.featuretree.parse;

import org.featuretree.model.ParameterValues;
import org.featuretree.script.BinaryOperator;
import org.featuretree.script.Expr;
import org.featuretree.script.UnaryOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * 静态表达式求值：字面量、已解析变量、{@code + - * / // % **} 与一元 {@code - +}，按 Python 的数值语义计算。
 * <p>
 * 另外支持 {@code math} 模块的常量与常用单参函数、以及 {@code abs/min/max/round/int/float}。
 * 其他任何形式都视为“无法求值”，返回 {@link Optional#empty()}。
 */
public final class ExpressionEvaluator {

    private static final Map<String, Double> MATH_CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E,
            "tau", 2 * Math.PI);

    private static final Map<String, DoubleUnaryOperator> MATH_FUNCTIONS = Map.of(
            "sqrt", Math::sqrt,
            "sin", Math::sin,
            "cos", Math::cos,
            "tan", Math::tan,
            "radians", Math::toRadians,
            "degrees", Math::toDegrees,
            "atan", Math::atan);

    private ExpressionEvaluator() {
    }

    public static Optional<Object> evaluate(Expr expr, ResolvedVariables variables) {
        Object value = eval(expr, variables);
        return Optional.ofNullable(value == null ? null : ParameterValues.normalize(value));
    }

    /**
     * 是否为“算术形式”的表达式（变量名、一元/二元运算）。这类表达式无法求值时按约定退化为默认数值。
     */
    public static boolean isArithmetic(Expr expr) {
        return expr instanceof Expr.Name || expr instanceof Expr.BinOp
                || (expr instanceof Expr.UnaryOp unary && unary.op() != UnaryOperator.NOT);
    }

    /** 字面量（含负数与字面量组成的列表/元组），不依赖任何变量即可求值。 */
    public static boolean isLiteral(Expr expr) {
        if (expr instanceof Expr.Constant constant) {
            return constant.value() != null;
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return (unary.op() == UnaryOperator.NEG || unary.op() == UnaryOperator.POS)
                    && unary.operand() instanceof Expr.Constant c && c.value() instanceof Number;
        }
        if (expr instanceof Expr.ListExpr list) {
            return list.elements().stream().allMatch(ExpressionEvaluator::isLiteral);
        }
        if (expr instanceof Expr.TupleExpr tuple) {
            return tuple.elements().stream().allMatch(ExpressionEvaluator::isLiteral);
        }
        return false;
    }

    private static Object eval(Expr expr, ResolvedVariables variables) {
        if (expr instanceof Expr.Constant constant) {
            return constant.value();
        }
        if (expr instanceof Expr.Name name) {
            return variables.lookup(name.id()).orElse(null);
        }
        if (expr instanceof Expr.ListExpr list) {
            return evalAll(list.elements(), variables);
        }
        if (expr instanceof Expr.TupleExpr tuple) {
            return evalAll(tuple.elements(), variables);
        }
        if (expr instanceof Expr.UnaryOp unary) {
            Object operand = eval(unary.operand(), variables);
            return evalUnary(unary.op(), operand);
        }
        if (expr instanceof Expr.BinOp binOp) {
            Object left = eval(binOp.left(), variables);
            Object right = left == null ? null : eval(binOp.right(), variables);
            return right == null ? null : evalBinary(binOp.op(), left, right);
        }
        if (expr instanceof Expr.Attribute attribute && isName(attribute.value(), "math")) {
            return MATH_CONSTANTS.get(attribute.attr());
        }
        if (expr instanceof Expr.Call call && call.keywords().isEmpty()) {
            return evalCall(call, variables);
        }
        return null;
    }

    private static List<Object> evalAll(List<Expr> elements, ResolvedVariables variables) {
        List<Object> out = new ArrayList<>(elements.size());
        for (Expr element : elements) {
            Object value = eval(element, variables);
            if (value == null) {
                return null;
            }
            out.add(value);
        }
        return out;
    }

    private static Object evalUnary(UnaryOperator op, Object operand) {
        if (operand instanceof Boolean b && op == UnaryOperator.NOT) {
            return !b;
        }
        if (!(operand instanceof Number number)) {
            return null;
        }
        return switch (op) {
            case NEG -> isIntegral(number) ? (Object) (-number.longValue()) : (Object) (-number.doubleValue());
            case POS -> number;
            case INVERT -> isIntegral(number) ? (Object) ~number.longValue() : null;
            case NOT -> number.doubleValue() == 0;
        };
    }

    private static Object evalBinary(BinaryOperator op, Object left, Object right) {
        if (op == BinaryOperator.ADD && left instanceof String a && right instanceof String b) {
            return a + b;
        }
        if (op == BinaryOperator.ADD && left instanceof List<?> a && right instanceof List<?> b) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            return joined;
        }
        if (!(left instanceof Number a) || !(right instanceof Number b)) {
            return null;
        }
        boolean integral = isIntegral(a) && isIntegral(b);
        double x = a.doubleValue();
        double y = b.doubleValue();
        if (y == 0 && (op == BinaryOperator.DIV || op == BinaryOperator.FLOORDIV || op == BinaryOperator.MOD)) {
            return null;
        }
        return switch (op) {
            case ADD -> integral ? exactOrDouble(() -> Math.addExact(a.longValue(), b.longValue()), x + y) : (Object) (x + y);
            case SUB -> integral ? exactOrDouble(() -> Math.subtractExact(a.longValue(), b.longValue()), x - y) : (Object) (x - y);
            case MULT -> integral ? exactOrDouble(() -> Math.multiplyExact(a.longValue(), b.longValue()), x * y) : (Object) (x * y);
            case DIV -> x / y;
            case FLOORDIV -> integral ? (Object) Math.floorDiv(a.longValue(), b.longValue()) : (Object) Math.floor(x / y);
            case MOD -> integral ? (Object) Math.floorMod(a.longValue(), b.longValue()) : (Object) (x - y * Math.floor(x / y));
            case POW -> power(a, b, integral);
            default -> null;
        };
    }

    private static Object power(Number base, Number exponent, boolean integral) {
        double x = base.doubleValue();
        double y = exponent.doubleValue();
        if (x == 0 && y < 0) {
            return null;
        }
        double result = Math.pow(x, y);
        if (Double.isNaN(result)) {
            // 负数的分数次幂在 Python 中是复数
            return null;
        }
        if (integral && exponent.longValue() >= 0 && Math.abs(result) < 9.007199254740992E15) {
            return (long) result;
        }
        return result;
    }

    private static Object evalCall(Expr.Call call, ResolvedVariables variables) {
        List<Object> args = evalAll(call.args(), variables);
        if (args == null || args.isEmpty()) {
            return null;
        }
        if (call.func() instanceof Expr.Attribute attribute && isName(attribute.value(), "math")) {
            DoubleUnaryOperator fn = MATH_FUNCTIONS.get(attribute.attr());
            if (fn == null || args.size() != 1 || !(args.get(0) instanceof Number n)) {
                return null;
            }
            double result = fn.applyAsDouble(n.doubleValue());
            return Double.isNaN(result) ? null : result;
        }
        if (!(call.func() instanceof Expr.Name name)) {
            return null;
        }
        for (Object arg : args) {
            if (!(arg instanceof Number)) {
                return null;
            }
        }
        Number first = (Number) args.get(0);
        boolean single = args.size() == 1;
        return switch (name.id()) {
            case "abs" -> !single ? null
                    : isIntegral(first) ? (Object) Math.abs(first.longValue()) : (Object) Math.abs(first.doubleValue());
            case "float" -> single ? (Object) first.doubleValue() : null;
            case "int" -> single ? (Object) (long) first.doubleValue() : null;
            case "round" -> single ? (Object) Math.round(Math.rint(first.doubleValue())) : null;
            case "min", "max" -> extreme(args, name.id().equals("max"));
            default -> null;
        };
    }

    private static Object extreme(List<Object> args, boolean max) {
        Number best = null;
        for (Object arg : args) {
            Number n = (Number) arg;
            if (best == null || (max ? n.doubleValue() > best.doubleValue() : n.doubleValue() < best.doubleValue())) {
                best = n;
            }
        }
        return best;
    }

    private static boolean isName(Expr expr, String id) {
        return expr instanceof Expr.Name name && name.id().equals(id);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer;
    }

    private static Object exactOrDouble(LongSupplierWithOverflow exact, double fallback) {
        try {
            return exact.get();
        } catch (ArithmeticException overflow) {
            return fallback;
        }
    }

    @FunctionalInterface
    private interface LongSupplierWithOverflow {
        long get();
    }
}
