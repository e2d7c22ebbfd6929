package org.featuretree.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * CAD 脚本（Python 子集）递归下降语法分析器：{@link ScriptLexer} 的 token 流 -> {@link ScriptModule}。
 * <p>
 * 覆盖 CadQuery 脚本中会出现的全部语句与表达式；不支持 {@code async}/{@code await}、{@code match}。
 * 每条语句记录源码范围（{@link SourceSpan}），参数原位修改依赖这些位置。
 */
public final class ScriptParser {

    private static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=");

    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final String[][] BINARY_LEVELS = {
            {"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"}, {"*", "@", "/", "//", "%"}
    };

    private final List<Token> tokens;
    private final String source;
    private int index;
    private Token previous;

    private ScriptParser(List<Token> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    /**
     * 解析脚本。
     *
     * @throws ScriptSyntaxException 词法或语法错误
     */
    public static ScriptModule parse(String source) {
        String text = source == null ? "" : source;
        return new ScriptParser(ScriptLexer.tokenize(text), text).parseModule();
    }

    /** 只解析单个表达式（例如参数值），整段输入必须恰好是一个表达式。 */
    public static Expr parseExpression(String expression) {
        ScriptParser parser = new ScriptParser(ScriptLexer.tokenize(expression == null ? "" : expression), expression);
        Expr expr = parser.parseTestListStarExpr();
        parser.accept(TokenType.NEWLINE);
        if (!parser.check(TokenType.END)) {
            throw parser.unexpected();
        }
        return expr;
    }

    private ScriptModule parseModule() {
        List<Stmt> body = new ArrayList<>();
        while (!check(TokenType.END)) {
            if (accept(TokenType.NEWLINE)) {
                continue;
            }
            body.addAll(parseStatement());
        }
        return new ScriptModule(body, source);
    }

    // ---------------------------------------------------------------------
    // 语句
    // ---------------------------------------------------------------------

    private List<Stmt> parseStatement() {
        Token t = peek();
        if (t.type() == TokenType.INDENT) {
            throw error("意外的缩进", t);
        }
        if (t.isOp("@")) {
            return List.of(parseDecorated());
        }
        if (t.type() == TokenType.NAME) {
            if (t.text().equals("async")) {
                throw error("不支持 async 语法", t);
            }
            Stmt compound = switch (t.text()) {
                case "if" -> parseIf();
                case "while" -> parseWhile();
                case "for" -> parseFor();
                case "try" -> parseTry();
                case "with" -> parseWith();
                case "def" -> parseFunctionDef(t, List.of());
                case "class" -> parseClassDef(t, List.of());
                default -> null;
            };
            if (compound != null) {
                return List.of(compound);
            }
        }
        return parseSimpleStatements();
    }

    private List<Stmt> parseSimpleStatements() {
        List<Stmt> out = new ArrayList<>();
        out.add(parseSimpleStatement());
        while (acceptOp(";")) {
            if (check(TokenType.NEWLINE) || check(TokenType.END)) {
                break;
            }
            out.add(parseSimpleStatement());
        }
        if (!accept(TokenType.NEWLINE) && !check(TokenType.END)) {
            throw unexpected();
        }
        return out;
    }

    private Stmt parseSimpleStatement() {
        Token start = peek();
        if (start.type() == TokenType.NAME) {
            Stmt keywordStatement = switch (start.text()) {
                case "pass" -> {
                    next();
                    yield new Stmt.Pass(span(start));
                }
                case "break" -> {
                    next();
                    yield new Stmt.Break(span(start));
                }
                case "continue" -> {
                    next();
                    yield new Stmt.Continue(span(start));
                }
                case "return" -> {
                    next();
                    Expr value = atStatementEnd() ? null : parseTestListStarExpr();
                    yield new Stmt.Return(value, span(start));
                }
                case "del" -> {
                    next();
                    Expr targets = parseExprList();
                    List<Expr> list = targets instanceof Expr.TupleExpr tuple ? tuple.elements() : List.of(targets);
                    yield new Stmt.Delete(list, span(start));
                }
                case "global", "nonlocal" -> {
                    next();
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(expectName());
                    } while (acceptOp(","));
                    yield new Stmt.Global(names, start.text().equals("nonlocal"), span(start));
                }
                case "assert" -> {
                    next();
                    Expr test = parseTest();
                    Expr message = acceptOp(",") ? parseTest() : null;
                    yield new Stmt.Assert(test, message, span(start));
                }
                case "raise" -> {
                    next();
                    Expr exception = null;
                    Expr cause = null;
                    if (!atStatementEnd()) {
                        exception = parseTest();
                        if (acceptKeyword("from")) {
                            cause = parseTest();
                        }
                    }
                    yield new Stmt.Raise(exception, cause, span(start));
                }
                case "import" -> parseImport(start);
                case "from" -> parseImportFrom(start);
                default -> null;
            };
            if (keywordStatement != null) {
                return keywordStatement;
            }
        }

        Expr first = parseYieldOrTestList();
        if (acceptOp(":")) {
            checkAssignable(first, start);
            Expr annotation = parseTest();
            Expr value = acceptOp("=") ? parseYieldOrTestList() : null;
            return new Stmt.AnnAssign(first, annotation, value, span(start));
        }
        Token t = peek();
        if (t.type() == TokenType.OP && AUGMENTED.contains(t.text())) {
            next();
            checkAssignable(first, start);
            BinaryOperator op = BinaryOperator.fromSymbol(t.text().substring(0, t.text().length() - 1));
            Expr value = parseYieldOrTestList();
            return new Stmt.AugAssign(first, op, value, span(start));
        }
        if (checkOp("=")) {
            List<Expr> targets = new ArrayList<>();
            targets.add(first);
            while (acceptOp("=")) {
                targets.add(parseYieldOrTestList());
            }
            Expr value = targets.remove(targets.size() - 1);
            for (Expr target : targets) {
                checkAssignable(target, start);
            }
            return new Stmt.Assign(targets, value, span(start));
        }
        return new Stmt.ExprStmt(first, span(start));
    }

    private Stmt parseImport(Token start) {
        next();
        List<Stmt.Alias> names = new ArrayList<>();
        do {
            String name = parseDottedName();
            String asName = acceptKeyword("as") ? expectName() : null;
            names.add(new Stmt.Alias(name, asName));
        } while (acceptOp(","));
        return new Stmt.Import(names, span(start));
    }

    private Stmt parseImportFrom(Token start) {
        next();
        int level = 0;
        while (checkOp(".") || checkOp("...")) {
            level += next().text().length();
        }
        String module = null;
        if (!peek().isKeyword("import")) {
            module = parseDottedName();
        }
        expectKeyword("import");
        List<Stmt.Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Stmt.Alias("*", null));
        } else {
            boolean parenthesized = acceptOp("(");
            do {
                if (parenthesized && checkOp(")")) {
                    break;
                }
                String name = expectName();
                String asName = acceptKeyword("as") ? expectName() : null;
                names.add(new Stmt.Alias(name, asName));
            } while (acceptOp(","));
            if (parenthesized) {
                expectOp(")");
            }
        }
        return new Stmt.ImportFrom(module, level, names, span(start));
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(expectName());
        while (acceptOp(".")) {
            name.append('.').append(expectName());
        }
        return name.toString();
    }

    private Stmt parseIf() {
        Token start = next();
        Expr test = parseNamedExprTest();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = List.of();
        if (peek().isKeyword("elif")) {
            orElse = List.of(parseIf());
        } else if (acceptKeyword("else")) {
            orElse = parseBlock();
        }
        return new Stmt.If(test, body, orElse, span(start));
    }

    private Stmt parseWhile() {
        Token start = next();
        Expr test = parseNamedExprTest();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = acceptKeyword("else") ? parseBlock() : List.of();
        return new Stmt.While(test, body, orElse, span(start));
    }

    private Stmt parseFor() {
        Token start = next();
        Expr target = parseExprList();
        checkAssignable(target, start);
        expectKeyword("in");
        Expr iter = parseTestListStarExpr();
        List<Stmt> body = parseBlock();
        List<Stmt> orElse = acceptKeyword("else") ? parseBlock() : List.of();
        return new Stmt.For(target, iter, body, orElse, span(start));
    }

    private Stmt parseTry() {
        Token start = next();
        List<Stmt> body = parseBlock();
        List<Stmt.ExceptHandler> handlers = new ArrayList<>();
        while (acceptKeyword("except")) {
            Expr type = null;
            String name = null;
            if (!checkOp(":")) {
                type = parseTest();
                if (acceptKeyword("as")) {
                    name = expectName();
                }
            }
            handlers.add(new Stmt.ExceptHandler(type, name, parseBlock()));
        }
        List<Stmt> orElse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orElse = parseBlock();
        }
        List<Stmt> finalBody = acceptKeyword("finally") ? parseBlock() : List.of();
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error("try 语句缺少 except 或 finally", peek());
        }
        return new Stmt.Try(body, handlers, orElse, finalBody, span(start));
    }

    private Stmt parseWith() {
        Token start = next();
        List<Stmt.WithItem> items = new ArrayList<>();
        do {
            Expr context = parseTest();
            Expr target = acceptKeyword("as") ? parseExpr() : null;
            items.add(new Stmt.WithItem(context, target));
        } while (acceptOp(","));
        return new Stmt.With(items, parseBlock(), span(start));
    }

    private Stmt parseDecorated() {
        Token start = peek();
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(parseNamedExprTest());
            expect(TokenType.NEWLINE, "装饰器之后应换行");
        }
        Token t = peek();
        if (t.isKeyword("def")) {
            return parseFunctionDef(start, decorators);
        }
        if (t.isKeyword("class")) {
            return parseClassDef(start, decorators);
        }
        throw error("装饰器之后应为 def 或 class", t);
    }

    private Stmt parseFunctionDef(Token start, List<Expr> decorators) {
        expectKeyword("def");
        String name = expectName();
        expectOp("(");
        List<Expr.Param> params = parseParams(")", true);
        expectOp(")");
        Expr returns = acceptOp("->") ? parseTest() : null;
        List<Stmt> body = parseBlock();
        return new Stmt.FunctionDef(name, params, returns, body, decorators, span(start));
    }

    private Stmt parseClassDef(Token start, List<Expr> decorators) {
        expectKeyword("class");
        String name = expectName();
        List<Expr> bases = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        if (acceptOp("(")) {
            parseArguments(bases, keywords);
        }
        List<Stmt> body = parseBlock();
        return new Stmt.ClassDef(name, bases, keywords, body, decorators, span(start));
    }

    private List<Expr.Param> parseParams(String closing, boolean annotations) {
        List<Expr.Param> params = new ArrayList<>();
        while (!checkOp(closing)) {
            if (acceptOp("/")) {
                params.add(new Expr.Param(null, null, null, "/"));
            } else if (acceptOp("**")) {
                String name = expectName();
                Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                params.add(new Expr.Param(name, annotation, null, "**"));
            } else if (acceptOp("*")) {
                if (peek().type() == TokenType.NAME) {
                    String name = expectName();
                    Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                    params.add(new Expr.Param(name, annotation, null, "*"));
                } else {
                    params.add(new Expr.Param(null, null, null, "*"));
                }
            } else {
                String name = expectName();
                Expr annotation = annotations && acceptOp(":") ? parseTest() : null;
                Expr defaultValue = acceptOp("=") ? parseTest() : null;
                params.add(new Expr.Param(name, annotation, defaultValue, ""));
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        return params;
    }

    private List<Stmt> parseBlock() {
        expectOp(":");
        if (!accept(TokenType.NEWLINE)) {
            return parseSimpleStatements();
        }
        expect(TokenType.INDENT, "代码块应缩进");
        List<Stmt> body = new ArrayList<>();
        while (!accept(TokenType.DEDENT)) {
            if (check(TokenType.END)) {
                throw unexpected();
            }
            if (accept(TokenType.NEWLINE)) {
                continue;
            }
            body.addAll(parseStatement());
        }
        return body;
    }

    // ---------------------------------------------------------------------
    // 表达式
    // ---------------------------------------------------------------------

    private Expr parseYieldOrTestList() {
        if (peek().isKeyword("yield")) {
            return parseYield();
        }
        return parseTestListStarExpr();
    }

    private Expr parseYield() {
        expectKeyword("yield");
        if (acceptKeyword("from")) {
            return new Expr.Yield(parseTest(), true);
        }
        if (atStatementEnd() || checkOp(")") || checkOp("=")) {
            return new Expr.Yield(null, false);
        }
        return new Expr.Yield(parseTestListStarExpr(), false);
    }

    private Expr parseTestListStarExpr() {
        Expr first = parseStarOrTest();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (atTupleEnd()) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        return new Expr.TupleExpr(elements);
    }

    private Expr parseExprList() {
        Expr first = parseStarOrExpr();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (atTupleEnd() || peek().isKeyword("in")) {
                break;
            }
            elements.add(parseStarOrExpr());
        }
        return new Expr.TupleExpr(elements);
    }

    private Expr parseStarOrTest() {
        if (acceptOp("*")) {
            return new Expr.Starred(parseExpr(), false);
        }
        return parseNamedExprTest();
    }

    private Expr parseStarOrExpr() {
        if (acceptOp("*")) {
            return new Expr.Starred(parseExpr(), false);
        }
        return parseExpr();
    }

    private Expr parseNamedExprTest() {
        if (peek().type() == TokenType.NAME && peek(1).isOp(":=")) {
            Expr.Name target = new Expr.Name(expectName());
            next();
            return new Expr.NamedExpr(target, parseTest());
        }
        return parseTest();
    }

    private Expr parseTest() {
        if (peek().isKeyword("lambda")) {
            return parseLambda();
        }
        Expr body = parseOrTest();
        if (acceptKeyword("if")) {
            Expr test = parseOrTest();
            expectKeyword("else");
            Expr orElse = parseTest();
            return new Expr.IfExp(test, body, orElse);
        }
        return body;
    }

    private Expr parseLambda() {
        expectKeyword("lambda");
        List<Expr.Param> params = parseParams(":", false);
        expectOp(":");
        return new Expr.Lambda(params, parseTest());
    }

    private Expr parseOrTest() {
        Expr first = parseAndTest();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) {
            values.add(parseAndTest());
        }
        return new Expr.BoolOp("or", values);
    }

    private Expr parseAndTest() {
        Expr first = parseNotTest();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) {
            values.add(parseNotTest());
        }
        return new Expr.BoolOp("and", values);
    }

    private Expr parseNotTest() {
        if (acceptKeyword("not")) {
            return new Expr.UnaryOp(UnaryOperator.NOT, parseNotTest());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseExpr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op;
            if (t.type() == TokenType.OP && COMPARISONS.contains(t.text())) {
                next();
                op = t.text();
            } else if (t.isKeyword("in")) {
                next();
                op = "in";
            } else if (t.isKeyword("not") && peek(1).isKeyword("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isKeyword("is")) {
                next();
                op = acceptKeyword("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            comparators.add(parseExpr());
        }
        return ops.isEmpty() ? left : new Expr.Compare(left, ops, comparators);
    }

    private Expr parseExpr() {
        return parseBinary(0);
    }

    private Expr parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseFactor();
        }
        Expr left = parseBinary(level + 1);
        while (true) {
            Token t = peek();
            if (t.type() != TokenType.OP || !contains(BINARY_LEVELS[level], t.text())) {
                return left;
            }
            next();
            Expr right = parseBinary(level + 1);
            left = new Expr.BinOp(left, BinaryOperator.fromSymbol(t.text()), right);
        }
    }

    private Expr parseFactor() {
        if (acceptOp("-")) {
            return new Expr.UnaryOp(UnaryOperator.NEG, parseFactor());
        }
        if (acceptOp("+")) {
            return new Expr.UnaryOp(UnaryOperator.POS, parseFactor());
        }
        if (acceptOp("~")) {
            return new Expr.UnaryOp(UnaryOperator.INVERT, parseFactor());
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parseAtomExpr();
        if (acceptOp("**")) {
            return new Expr.BinOp(base, BinaryOperator.POW, parseFactor());
        }
        return base;
    }

    private Expr parseAtomExpr() {
        if (peek().isKeyword("await")) {
            throw error("不支持 await 表达式", peek());
        }
        Expr expr = parseAtom();
        while (true) {
            if (acceptOp("(")) {
                List<Expr> args = new ArrayList<>();
                List<Expr.Keyword> keywords = new ArrayList<>();
                parseArguments(args, keywords);
                expr = new Expr.Call(expr, args, keywords);
            } else if (acceptOp("[")) {
                expr = new Expr.Subscript(expr, parseSubscriptList());
                expectOp("]");
            } else if (acceptOp(".")) {
                Token name = next();
                if (name.type() != TokenType.NAME) {
                    throw error("属性名无效", name);
                }
                expr = new Expr.Attribute(expr, name.text());
            } else {
                return expr;
            }
        }
    }

    /** 解析实参列表（左括号已消费），消费右括号。 */
    private void parseArguments(List<Expr> args, List<Expr.Keyword> keywords) {
        while (!checkOp(")")) {
            if (acceptOp("*")) {
                args.add(new Expr.Starred(parseTest(), false));
            } else if (acceptOp("**")) {
                keywords.add(new Expr.Keyword(null, parseTest()));
            } else if (peek().type() == TokenType.NAME && peek(1).isOp("=")) {
                String name = expectName();
                next();
                keywords.add(new Expr.Keyword(name, parseTest()));
            } else {
                Expr arg = parseNamedExprTest();
                if (peek().isKeyword("for")) {
                    arg = new Expr.Comprehension(Expr.ComprehensionKind.GENERATOR, arg, null, parseComprehensionClauses());
                }
                args.add(arg);
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        expectOp(")");
    }

    private Expr parseSubscriptList() {
        Expr first = parseSubscript();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elements.add(parseSubscript());
        }
        return new Expr.TupleExpr(elements);
    }

    private Expr parseSubscript() {
        Expr lower = null;
        if (!checkOp(":")) {
            lower = parseStarOrTest();
        }
        if (!acceptOp(":")) {
            return lower;
        }
        Expr upper = checkOp(":") || checkOp("]") || checkOp(",") ? null : parseTest();
        Expr step = null;
        if (acceptOp(":")) {
            step = checkOp("]") || checkOp(",") ? null : parseTest();
        }
        return new Expr.Slice(lower, upper, step);
    }

    private Expr parseAtom() {
        Token t = next();
        return switch (t.type()) {
            case NUMBER -> new Expr.Constant(t.value(), t.text());
            case STRING -> parseStrings(t);
            case NAME -> parseNameAtom(t);
            case OP -> switch (t.text()) {
                case "(" -> parseParenthesized();
                case "[" -> parseListDisplay();
                case "{" -> parseBraceDisplay();
                case "..." -> new Expr.Constant(null, "...");
                default -> throw error(describe(t), t);
            };
            default -> throw error(describe(t), t);
        };
    }

    private Expr parseStrings(Token first) {
        StringBuilder value = new StringBuilder((String) first.value());
        StringBuilder literal = new StringBuilder(first.text());
        while (check(TokenType.STRING)) {
            Token t = next();
            value.append((String) t.value());
            literal.append(' ').append(t.text());
        }
        return new Expr.Constant(value.toString(), literal.toString());
    }

    private Expr parseNameAtom(Token t) {
        return switch (t.text()) {
            case "True" -> new Expr.Constant(Boolean.TRUE, "True");
            case "False" -> new Expr.Constant(Boolean.FALSE, "False");
            case "None" -> new Expr.Constant(null, "None");
            default -> {
                if (ScriptKeywords.isKeyword(t.text())) {
                    throw error("意外的关键字 '" + t.text() + "'", t);
                }
                yield new Expr.Name(t.text());
            }
        };
    }

    private Expr parseParenthesized() {
        if (acceptOp(")")) {
            return new Expr.TupleExpr(List.of());
        }
        if (peek().isKeyword("yield")) {
            Expr yield = parseYield();
            expectOp(")");
            return yield;
        }
        Expr first = parseStarOrTest();
        if (peek().isKeyword("for")) {
            Expr comprehension = new Expr.Comprehension(
                    Expr.ComprehensionKind.GENERATOR, first, null, parseComprehensionClauses());
            expectOp(")");
            return comprehension;
        }
        if (acceptOp(")")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (checkOp(")")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOp(")");
        return new Expr.TupleExpr(elements);
    }

    private Expr parseListDisplay() {
        if (acceptOp("]")) {
            return new Expr.ListExpr(List.of());
        }
        Expr first = parseStarOrTest();
        if (peek().isKeyword("for")) {
            Expr comprehension = new Expr.Comprehension(
                    Expr.ComprehensionKind.LIST, first, null, parseComprehensionClauses());
            expectOp("]");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOp("]");
        return new Expr.ListExpr(elements);
    }

    private Expr parseBraceDisplay() {
        if (acceptOp("}")) {
            return new Expr.DictExpr(List.of(), List.of());
        }
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (acceptOp("**")) {
            keys.add(null);
            values.add(parseExpr());
        } else {
            Expr first = parseStarOrTest();
            if (!acceptOp(":")) {
                return parseSetRest(first);
            }
            Expr value = parseTest();
            if (peek().isKeyword("for")) {
                Expr comprehension = new Expr.Comprehension(
                        Expr.ComprehensionKind.DICT, first, value, parseComprehensionClauses());
                expectOp("}");
                return comprehension;
            }
            keys.add(first);
            values.add(value);
        }
        while (acceptOp(",")) {
            if (checkOp("}")) {
                break;
            }
            if (acceptOp("**")) {
                keys.add(null);
                values.add(parseExpr());
            } else {
                keys.add(parseTest());
                expectOp(":");
                values.add(parseTest());
            }
        }
        expectOp("}");
        return new Expr.DictExpr(keys, values);
    }

    private Expr parseSetRest(Expr first) {
        if (peek().isKeyword("for")) {
            Expr comprehension = new Expr.Comprehension(
                    Expr.ComprehensionKind.SET, first, null, parseComprehensionClauses());
            expectOp("}");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (checkOp("}")) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        expectOp("}");
        return new Expr.SetExpr(elements);
    }

    private List<Expr.ComprehensionClause> parseComprehensionClauses() {
        List<Expr.ComprehensionClause> clauses = new ArrayList<>();
        while (acceptKeyword("for")) {
            Expr target = parseExprList();
            expectKeyword("in");
            Expr iter = parseOrTest();
            List<Expr> conditions = new ArrayList<>();
            while (acceptKeyword("if")) {
                conditions.add(parseOrTest());
            }
            clauses.add(new Expr.ComprehensionClause(target, iter, conditions));
        }
        return clauses;
    }

    // ---------------------------------------------------------------------
    // 工具
    // ---------------------------------------------------------------------

    private void checkAssignable(Expr target, Token at) {
        if (target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript) {
            return;
        }
        if (target instanceof Expr.Starred starred) {
            checkAssignable(starred.value(), at);
            return;
        }
        if (target instanceof Expr.TupleExpr tuple) {
            for (Expr element : tuple.elements()) {
                checkAssignable(element, at);
            }
            return;
        }
        if (target instanceof Expr.ListExpr list) {
            for (Expr element : list.elements()) {
                checkAssignable(element, at);
            }
            return;
        }
        throw error("无法对该表达式赋值", at);
    }

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.END) || checkOp(";");
    }

    private boolean atTupleEnd() {
        Token t = peek();
        if (t.type() == TokenType.NEWLINE || t.type() == TokenType.END) {
            return true;
        }
        if (t.type() != TokenType.OP) {
            return false;
        }
        String op = t.text();
        return op.equals(")") || op.equals("]") || op.equals("}") || op.equals(":") || op.equals(";")
                || op.equals("=") || AUGMENTED.contains(op);
    }

    private static boolean contains(String[] options, String value) {
        for (String option : options) {
            if (option.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private SourceSpan span(Token start) {
        Token end = previous == null ? start : previous;
        return new SourceSpan(start.line(), start.column(), end.endLine(), end.endColumn());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peek(int ahead) {
        int i = Math.min(index + ahead, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.type() != TokenType.END) {
            index++;
        }
        if (t.type() != TokenType.NEWLINE && t.type() != TokenType.INDENT
                && t.type() != TokenType.DEDENT && t.type() != TokenType.END) {
            previous = t;
        }
        return t;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOp(String op) {
        return peek().isOp(op);
    }

    private boolean accept(TokenType type) {
        if (check(type)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptOp(String op) {
        if (checkOp(op)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String message) {
        if (!accept(type)) {
            throw error(message, peek());
        }
    }

    private void expectOp(String op) {
        if (!acceptOp(op)) {
            throw error("此处应为 '" + op + "'（" + describe(peek()) + "）", peek());
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("此处应为关键字 '" + keyword + "'（" + describe(peek()) + "）", peek());
        }
    }

    private String expectName() {
        Token t = peek();
        if (t.type() != TokenType.NAME || ScriptKeywords.isKeyword(t.text())) {
            throw error("此处应为标识符（" + describe(t) + "）", t);
        }
        return next().text();
    }

    private ScriptSyntaxException unexpected() {
        Token t = peek();
        return error(describe(t), t);
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case NEWLINE -> "意外的换行";
            case INDENT -> "意外的缩进";
            case DEDENT -> "意外的取消缩进";
            case END -> "意外的脚本结尾";
            default -> "意外的符号 '" + t.text() + "'";
        };
    }

    private static ScriptSyntaxException error(String message, Token at) {
        return new ScriptSyntaxException(message, at.line(), at.column());
    }
}
