package org.featuretree.script;

import java.util.ArrayList;
import java.util.List;

/**
 * 把表达式语法树还原为源码文本（按优先级补括号），结果可被 {@link ScriptParser#parseExpression} 重新解析。
 */
public final class ExprPrinter {

    private static final int LAMBDA = 0;
    private static final int IF_EXP = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARE = 5;
    private static final int UNARY = 12;
    private static final int POWER = 13;
    private static final int ATOM = 15;

    private ExprPrinter() {
    }

    public static String print(Expr expr) {
        return print(expr, LAMBDA);
    }

    /** 以方法链片段的形式打印一次调用，例如 {@code .circle(5)}。 */
    public static String printCallFragment(String method, Expr.Call call) {
        return "." + method + "(" + printArguments(call.args(), call.keywords()) + ")";
    }

    public static String printArguments(List<Expr> args, List<Expr.Keyword> keywords) {
        List<String> parts = new ArrayList<>();
        for (Expr arg : args) {
            parts.add(print(arg, LAMBDA));
        }
        for (Expr.Keyword keyword : keywords) {
            parts.add(keyword.name() == null
                    ? "**" + print(keyword.value(), ATOM - 1)
                    : keyword.name() + "=" + print(keyword.value(), LAMBDA));
        }
        return String.join(", ", parts);
    }

    private static String print(Expr expr, int minPrecedence) {
        int precedence = precedenceOf(expr);
        String text = render(expr);
        return precedence < minPrecedence ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expr expr) {
        if (expr instanceof Expr.Lambda || expr instanceof Expr.NamedExpr || expr instanceof Expr.Yield) {
            return LAMBDA;
        }
        if (expr instanceof Expr.IfExp) {
            return IF_EXP;
        }
        if (expr instanceof Expr.BoolOp boolOp) {
            return boolOp.op().equals("or") ? OR : AND;
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return unary.op() == UnaryOperator.NOT ? NOT : UNARY;
        }
        if (expr instanceof Expr.Compare) {
            return COMPARE;
        }
        if (expr instanceof Expr.BinOp binOp) {
            return binOp.op().precedence();
        }
        if (expr instanceof Expr.Constant constant && constant.value() instanceof Number number
                && number.doubleValue() < 0) {
            return UNARY;
        }
        return ATOM;
    }

    private static String render(Expr expr) {
        if (expr instanceof Expr.Name name) {
            return name.id();
        }
        if (expr instanceof Expr.Constant constant) {
            return constant.literal() != null ? constant.literal() : PythonLiterals.format(constant.value());
        }
        if (expr instanceof Expr.Attribute attribute) {
            String base = print(attribute.value(), ATOM);
            // 整数字面量后直接跟 '.' 会被当作小数点
            if (attribute.value() instanceof Expr.Constant c && c.value() instanceof Long) {
                base = "(" + base + ")";
            }
            return base + "." + attribute.attr();
        }
        if (expr instanceof Expr.Call call) {
            return print(call.func(), ATOM) + "(" + printArguments(call.args(), call.keywords()) + ")";
        }
        if (expr instanceof Expr.Subscript subscript) {
            Expr index = subscript.index();
            String inner = index instanceof Expr.TupleExpr tuple && !tuple.elements().isEmpty()
                    ? joinElements(tuple.elements(), tuple.elements().size() == 1)
                    : print(index, LAMBDA);
            return print(subscript.value(), ATOM) + "[" + inner + "]";
        }
        if (expr instanceof Expr.Slice slice) {
            StringBuilder sb = new StringBuilder();
            if (slice.lower() != null) {
                sb.append(print(slice.lower(), LAMBDA));
            }
            sb.append(':');
            if (slice.upper() != null) {
                sb.append(print(slice.upper(), LAMBDA));
            }
            if (slice.step() != null) {
                sb.append(':').append(print(slice.step(), LAMBDA));
            }
            return sb.toString();
        }
        if (expr instanceof Expr.BinOp binOp) {
            int p = binOp.op().precedence();
            // ** 右结合，其余左结合
            boolean rightAssoc = binOp.op() == BinaryOperator.POW;
            String left = print(binOp.left(), rightAssoc ? p + 1 : p);
            String right = print(binOp.right(), rightAssoc ? UNARY : p + 1);
            return left + " " + binOp.op().symbol() + " " + right;
        }
        if (expr instanceof Expr.UnaryOp unary) {
            int p = unary.op() == UnaryOperator.NOT ? NOT : UNARY;
            return unary.op().symbol() + print(unary.operand(), p);
        }
        if (expr instanceof Expr.BoolOp boolOp) {
            int p = boolOp.op().equals("or") ? OR : AND;
            List<String> parts = new ArrayList<>();
            for (Expr value : boolOp.values()) {
                parts.add(print(value, p + 1));
            }
            return String.join(" " + boolOp.op() + " ", parts);
        }
        if (expr instanceof Expr.Compare compare) {
            StringBuilder sb = new StringBuilder(print(compare.left(), COMPARE + 1));
            for (int i = 0; i < compare.ops().size(); i++) {
                sb.append(' ').append(compare.ops().get(i)).append(' ')
                        .append(print(compare.comparators().get(i), COMPARE + 1));
            }
            return sb.toString();
        }
        if (expr instanceof Expr.IfExp ifExp) {
            return print(ifExp.body(), OR) + " if " + print(ifExp.test(), OR) + " else " + print(ifExp.orElse(), IF_EXP);
        }
        if (expr instanceof Expr.Lambda lambda) {
            String params = printParams(lambda.params());
            return params.isEmpty() ? "lambda: " + print(lambda.body(), LAMBDA)
                    : "lambda " + params + ": " + print(lambda.body(), LAMBDA);
        }
        if (expr instanceof Expr.ListExpr list) {
            return "[" + joinElements(list.elements(), false) + "]";
        }
        if (expr instanceof Expr.TupleExpr tuple) {
            return "(" + joinElements(tuple.elements(), tuple.elements().size() == 1) + ")";
        }
        if (expr instanceof Expr.SetExpr set) {
            return "{" + joinElements(set.elements(), false) + "}";
        }
        if (expr instanceof Expr.DictExpr dict) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < dict.keys().size(); i++) {
                Expr key = dict.keys().get(i);
                String value = print(dict.values().get(i), LAMBDA);
                parts.add(key == null ? "**" + value : print(key, LAMBDA) + ": " + value);
            }
            return "{" + String.join(", ", parts) + "}";
        }
        if (expr instanceof Expr.Comprehension comprehension) {
            return renderComprehension(comprehension);
        }
        if (expr instanceof Expr.Starred starred) {
            return (starred.doubleStar() ? "**" : "*") + print(starred.value(), ATOM - 1);
        }
        if (expr instanceof Expr.NamedExpr named) {
            return "(" + named.target().id() + " := " + print(named.value(), LAMBDA) + ")";
        }
        if (expr instanceof Expr.Yield yield) {
            String keyword = yield.from() ? "(yield from" : "(yield";
            return yield.value() == null ? keyword + ")" : keyword + " " + print(yield.value(), LAMBDA) + ")";
        }
        throw new IllegalArgumentException("无法打印的表达式：" + expr);
    }

    private static String renderComprehension(Expr.Comprehension comprehension) {
        StringBuilder sb = new StringBuilder();
        if (comprehension.kind() == Expr.ComprehensionKind.DICT) {
            sb.append(print(comprehension.element(), LAMBDA)).append(": ").append(print(comprehension.value(), LAMBDA));
        } else {
            sb.append(print(comprehension.element(), LAMBDA));
        }
        for (Expr.ComprehensionClause clause : comprehension.clauses()) {
            Expr target = clause.target();
            String targetText = target instanceof Expr.TupleExpr tuple
                    ? joinElements(tuple.elements(), tuple.elements().size() == 1)
                    : print(target, LAMBDA);
            sb.append(" for ").append(targetText).append(" in ").append(print(clause.iter(), OR));
            for (Expr condition : clause.conditions()) {
                sb.append(" if ").append(print(condition, OR));
            }
        }
        return switch (comprehension.kind()) {
            case LIST -> "[" + sb + "]";
            case SET, DICT -> "{" + sb + "}";
            default -> "(" + sb + ")";
        };
    }

    private static String printParams(List<Expr.Param> params) {
        List<String> parts = new ArrayList<>();
        for (Expr.Param param : params) {
            StringBuilder sb = new StringBuilder();
            if (param.name() == null) {
                parts.add(param.kind());
                continue;
            }
            sb.append(param.kind()).append(param.name());
            if (param.defaultValue() != null) {
                sb.append('=').append(print(param.defaultValue(), LAMBDA));
            }
            parts.add(sb.toString());
        }
        return String.join(", ", parts);
    }

    private static String joinElements(List<Expr> elements, boolean trailingComma) {
        List<String> parts = new ArrayList<>();
        for (Expr element : elements) {
            parts.add(print(element, IF_EXP));
        }
        return String.join(", ", parts) + (trailingComma ? "," : "");
    }
}
