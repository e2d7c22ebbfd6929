package org.featuretree.script;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * CAD 脚本（Python 子集）词法分析器。
 * <p>
 * 支持：
 * <ul>
 *   <li>缩进：行首缩进生成 INDENT/DEDENT，Tab 按 8 列对齐；缩进不一致直接报错。</li>
 *   <li>括号内隐式续行、反斜杠显式续行；空行与纯注释行不产生 NEWLINE。</li>
 *   <li>字符串：单/双引号、三引号（可跨行）、{@code r/b/u/f} 前缀（f-string 不做插值，只保留原文）。</li>
 *   <li>数字：整数、浮点、指数、{@code _} 分隔符、十六/八/二进制；复数字面量只保留原文。</li>
 * </ul>
 */
public final class ScriptLexer {

    private static final String[] OPERATORS_3 = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] OPERATORS_2 = {
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@="
    };
    private static final String OPERATORS_1 = "+-*/%@&|^~<>()[]{},:.;=";

    private final String src;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;
    private boolean atLineStart = true;

    private ScriptLexer(String source) {
        this.src = source;
        this.length = source.length();
        this.indents.push(0);
    }

    public static List<Token> tokenize(String source) {
        return new ScriptLexer(source == null ? "" : source).run();
    }

    private List<Token> run() {
        // 跳过 UTF-8 BOM
        if (length > 0 && src.charAt(0) == '\uFEFF') {
            pos = 1;
            lineStart = 1;
        }
        while (pos < length) {
            if (atLineStart && depth == 0) {
                if (!handleIndentation()) {
                    continue;
                }
            }
            if (pos >= length) {
                break;
            }
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                consumeNewline();
                if (depth == 0) {
                    emitNewline();
                    atLineStart = true;
                }
            } else if (c == '\\') {
                if (pos + 1 < length && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
                    pos++;
                    consumeNewline();
                } else {
                    throw error("续行符后不能有其他字符");
                }
            } else if (isStringStart()) {
                lexString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(src.charAt(pos + 1)))) {
                lexNumber();
            } else if (Character.isLetter(c) || c == '_') {
                lexName();
            } else {
                lexOperator();
            }
        }
        if (depth > 0) {
            throw new ScriptSyntaxException("括号未闭合", line, pos - lineStart);
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", null, line, 0, line, 0);
        }
        add(TokenType.END, "", null, line, pos - lineStart, line, pos - lineStart);
        return tokens;
    }

    /**
     * 处理行首缩进。
     *
     * @return false 表示本行是空行/注释行，已被跳过
     */
    private boolean handleIndentation() {
        int col = 0;
        int p = pos;
        while (p < length) {
            char c = src.charAt(p);
            if (c == ' ') {
                col++;
            } else if (c == '\t') {
                col = (col / 8 + 1) * 8;
            } else if (c == '\f') {
                col = 0;
            } else {
                break;
            }
            p++;
        }
        pos = p;
        if (p >= length) {
            return false;
        }
        char c = src.charAt(p);
        if (c == '#') {
            skipComment();
            return false;
        }
        if (c == '\n' || c == '\r') {
            consumeNewline();
            return false;
        }
        int current = indents.peek();
        if (col > current) {
            indents.push(col);
            add(TokenType.INDENT, "", null, line, 0, line, pos - lineStart);
        } else {
            while (col < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "", null, line, pos - lineStart, line, pos - lineStart);
            }
            if (col != indents.peek()) {
                throw error("缩进与外层代码块不一致");
            }
        }
        atLineStart = false;
        return true;
    }

    private void skipComment() {
        while (pos < length && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void consumeNewline() {
        if (src.charAt(pos) == '\r' && pos + 1 < length && src.charAt(pos + 1) == '\n') {
            pos += 2;
        } else {
            pos++;
        }
        line++;
        lineStart = pos;
    }

    private void emitNewline() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        if (last == TokenType.NEWLINE || last == TokenType.INDENT || last == TokenType.DEDENT) {
            return;
        }
        add(TokenType.NEWLINE, "", null, line, pos - lineStart, line, pos - lineStart);
    }

    private boolean isStringStart() {
        int p = pos;
        int prefix = 0;
        while (p < length && prefix < 2 && "rRbBuUfF".indexOf(src.charAt(p)) >= 0) {
            p++;
            prefix++;
        }
        return p < length && (src.charAt(p) == '\'' || src.charAt(p) == '"');
    }

    private void lexString() {
        int startPos = pos;
        int startLine = line;
        int startCol = pos - lineStart;
        boolean raw = false;
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            if (src.charAt(pos) == 'r' || src.charAt(pos) == 'R') {
                raw = true;
            }
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= length) {
                throw new ScriptSyntaxException("字符串未闭合", startLine, startCol);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                if (pos + 1 >= length) {
                    throw new ScriptSyntaxException("字符串未闭合", startLine, startCol);
                }
                char next = src.charAt(pos + 1);
                if (next == '\n' || next == '\r') {
                    if (raw) {
                        value.append('\\').append('\n');
                    }
                    pos++;
                    consumeNewline();
                    continue;
                }
                if (raw) {
                    value.append(c).append(next);
                    pos += 2;
                } else {
                    pos = decodeEscape(value, pos);
                }
            } else if (triple && src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                pos += 3;
                break;
            } else if (!triple && c == quote) {
                pos++;
                break;
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new ScriptSyntaxException("字符串未闭合", startLine, startCol);
                }
                value.append('\n');
                consumeNewline();
            } else {
                value.append(c);
                pos++;
            }
        }
        add(TokenType.STRING, src.substring(startPos, pos), value.toString(), startLine, startCol, line, pos - lineStart);
    }

    /** 解码一个转义序列，返回转义序列之后的位置。 */
    private int decodeEscape(StringBuilder out, int at) {
        char e = src.charAt(at + 1);
        String simple = switch (e) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case 'a' -> "\u0007";
            case 'b' -> "\b";
            case 'f' -> "\f";
            case 'v' -> "\u000B";
            case '\\', '\'', '"' -> String.valueOf(e);
            default -> null;
        };
        if (simple != null) {
            out.append(simple);
            return at + 2;
        }
        if (e == 'x' || e == 'u' || e == 'U') {
            return appendHex(out, at, e == 'x' ? 2 : e == 'u' ? 4 : 8);
        }
        if (e >= '0' && e <= '7') {
            int end = at + 1;
            while (end < length && end < at + 4 && src.charAt(end) >= '0' && src.charAt(end) <= '7') {
                end++;
            }
            out.append((char) Integer.parseInt(src.substring(at + 1, end), 8));
            return end;
        }
        // 未知转义保持原样
        out.append('\\').append(e);
        return at + 2;
    }

    private int appendHex(StringBuilder out, int at, int digits) {
        int start = at + 2;
        int end = start + digits;
        if (end > length || !src.substring(start, end).chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
            throw error("无效的十六进制转义");
        }
        out.appendCodePoint(Integer.parseInt(src.substring(start, end), 16));
        return end;
    }

    private void lexNumber() {
        int start = pos;
        int startCol = pos - lineStart;
        Object value;
        char c = src.charAt(pos);
        char radixChar = pos + 1 < length ? Character.toLowerCase(src.charAt(pos + 1)) : ' ';
        if (c == '0' && (radixChar == 'x' || radixChar == 'o' || radixChar == 'b')) {
            int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : 2;
            pos += 2;
            int digitsStart = pos;
            while (pos < length && (src.charAt(pos) == '_' || Character.digit(src.charAt(pos), radix) >= 0)) {
                pos++;
            }
            if (pos == digitsStart) {
                throw error("数字字面量不完整");
            }
            value = integerValue(new BigInteger(src.substring(digitsStart, pos).replace("_", ""), radix));
        } else {
            boolean floating = false;
            readDigits();
            if (pos < length && src.charAt(pos) == '.') {
                floating = true;
                pos++;
                readDigits();
            }
            if (pos < length && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < length && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < length && Character.isDigit(src.charAt(pos))) {
                    floating = true;
                    readDigits();
                } else {
                    pos = mark;
                }
            }
            String digits = src.substring(start, pos).replace("_", "");
            if (pos < length && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                pos++;
                value = null;
            } else if (floating) {
                value = Double.parseDouble(digits);
            } else {
                value = integerValue(new BigInteger(digits));
            }
        }
        if (pos < length && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("无效的数字字面量");
        }
        add(TokenType.NUMBER, src.substring(start, pos), value, line, startCol, line, pos - lineStart);
    }

    private void readDigits() {
        while (pos < length && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private static Object integerValue(BigInteger big) {
        return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
    }

    private void lexName() {
        int start = pos;
        while (pos < length && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String text = src.substring(start, pos);
        add(TokenType.NAME, text, null, line, start - lineStart, line, pos - lineStart);
    }

    private void lexOperator() {
        String op = null;
        for (String candidate : OPERATORS_3) {
            if (src.startsWith(candidate, pos)) {
                op = candidate;
                break;
            }
        }
        if (op == null) {
            for (String candidate : OPERATORS_2) {
                if (src.startsWith(candidate, pos)) {
                    op = candidate;
                    break;
                }
            }
        }
        if (op == null && OPERATORS_1.indexOf(src.charAt(pos)) >= 0) {
            op = String.valueOf(src.charAt(pos));
        }
        if (op == null) {
            throw error("无法识别的字符 '" + src.charAt(pos) + "'");
        }
        if (op.equals("(") || op.equals("[") || op.equals("{")) {
            depth++;
        } else if (op.equals(")") || op.equals("]") || op.equals("}")) {
            if (depth == 0) {
                throw error("不匹配的右括号 '" + op + "'");
            }
            depth--;
        }
        int col = pos - lineStart;
        pos += op.length();
        add(TokenType.OP, op, null, line, col, line, col + op.length());
    }

    private void add(TokenType type, String text, Object value, int startLine, int startCol, int endLine, int endCol) {
        tokens.add(new Token(type, text, value, startLine, startCol, endLine, endCol));
    }

    private ScriptSyntaxException error(String message) {
        return new ScriptSyntaxException(message, line, pos - lineStart);
    }
}
