package org.ltlspec.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 将公式字符串转换为记号序列。
 * <p>
 * 规则：
 * <ul>
 *     <li>布尔字面量不区分大小写，整个单词为 true 或 false 时成立。</li>
 *     <li>以 "next" 开头的位置总是产生 next 运算符记号。</li>
 *     <li>单个字母 X、G、F、U、R 在其后不是数字或下划线时是时序关键字，
 *         因此 "GFp" 是 G F p，而 "X1"、"G_a" 是变量名。</li>
 *     <li>多字符运算符 (&amp;&amp;、||、-&gt;、&lt;-&gt;、==、!=、&lt;=、&gt;=、[]、&lt;&gt;) 优先于其单字符前缀。</li>
 *     <li>换行推进行号，其余空白被丢弃。</li>
 *     <li>无法识别的字符被跳过并记录为 {@link LexDiagnostic}，不会中止分析。</li>
 * </ul>
 * 静态表只读，每次调用都使用独立的扫描状态，因此可以并发调用。
 */
public final class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final String NEXT_WORD = "next";
    private static final String KEYWORD_LETTERS = "XGFUR";

    /** 运算符拼写表，较长的拼写在前。 */
    private static final Map<String, TokenType> OPERATORS;

    static {
        Map<String, TokenType> operators = new LinkedHashMap<>();
        operators.put("<->", TokenType.IFF);
        operators.put("<=", TokenType.LE);
        operators.put("<>", TokenType.EVENTUALLY);
        operators.put("->", TokenType.IMPLIES);
        operators.put("&&", TokenType.AND);
        operators.put("||", TokenType.OR);
        operators.put("==", TokenType.EQUALS);
        operators.put("!=", TokenType.NOT_EQUALS);
        operators.put(">=", TokenType.GE);
        operators.put("[]", TokenType.ALWAYS);
        operators.put("<", TokenType.LT);
        operators.put(">", TokenType.GT);
        operators.put("!", TokenType.NOT);
        operators.put("&", TokenType.AND);
        operators.put("|", TokenType.OR);
        operators.put("^", TokenType.XOR);
        operators.put("=", TokenType.EQUALS);
        operators.put("+", TokenType.PLUS);
        operators.put("-", TokenType.MINUS);
        operators.put("*", TokenType.TIMES);
        operators.put("/", TokenType.DIV);
        operators.put("(", TokenType.LPAREN);
        operators.put(")", TokenType.RPAREN);
        operators.put("'", TokenType.QUOTE);
        OPERATORS = Collections.unmodifiableMap(operators);
    }

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexDiagnostic> diagnostics = new ArrayList<>();
    private int pos = 0;
    private int line = 1;

    private Lexer(String text) {
        this.text = text;
    }

    /**
     * 对公式进行词法分析。
     * @param text 公式文本。
     * @return 记号序列 (以 EOF 记号结尾) 与诊断。
     */
    public static LexResult tokenize(String text) {
        Objects.requireNonNull(text, "Lexer.tokenize: text 不能为 null");
        Lexer lexer = new Lexer(text);
        lexer.run();
        logger.debug("词法分析完成: {} 个记号, {} 条诊断", lexer.tokens.size(), lexer.diagnostics.size());
        return new LexResult(lexer.tokens, lexer.diagnostics);
    }

    private void run() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (isDigit(c)) {
                scanNumber();
            } else if (isWordStart(c)) {
                scanWord();
            } else if (!scanOperator()) {
                LexDiagnostic diagnostic = new LexDiagnostic(pos, c, line);
                logger.warn("跳过{}", diagnostic);
                diagnostics.add(diagnostic);
                pos++;
            }
        }
        tokens.add(new Token(TokenType.EOF, "", pos, line));
    }

    private void scanNumber() {
        int start = pos;
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            pos++;
        }
        emit(TokenType.NUMBER, start);
    }

    private void scanWord() {
        int start = pos;
        int end = start + 1;
        while (end < text.length() && isWordPart(text.charAt(end))) {
            end++;
        }
        String word = text.substring(start, end);

        if (word.equalsIgnoreCase("true") || word.equalsIgnoreCase("false")) {
            pos = end;
            emit(word.equalsIgnoreCase("true") ? TokenType.TRUE : TokenType.FALSE, start);
            return;
        }
        if (text.startsWith(NEXT_WORD, start)) {
            pos = start + NEXT_WORD.length();
            emit(TokenType.NEXT, start);
            return;
        }
        char first = word.charAt(0);
        if (KEYWORD_LETTERS.indexOf(first) >= 0 && !(word.length() > 1 && isNameSecond(word.charAt(1)))) {
            pos = start + 1;
            emit(keyword(first), start);
            return;
        }
        pos = end;
        emit(TokenType.NAME, start);
    }

    private boolean scanOperator() {
        for (Map.Entry<String, TokenType> entry : OPERATORS.entrySet()) {
            if (text.startsWith(entry.getKey(), pos)) {
                int start = pos;
                pos += entry.getKey().length();
                emit(entry.getValue(), start);
                return true;
            }
        }
        return false;
    }

    private void emit(TokenType type, int start) {
        Token token = new Token(type, text.substring(start, pos), start, line);
        logger.trace("记号: {} {}", type, token);
        tokens.add(token);
    }

    private static TokenType keyword(char letter) {
        return switch (letter) {
            case 'X' -> TokenType.NEXT;
            case 'G' -> TokenType.ALWAYS;
            case 'F' -> TokenType.EVENTUALLY;
            case 'U' -> TokenType.UNTIL;
            case 'R' -> TokenType.RELEASE;
            default -> throw new IllegalStateException("不是时序关键字: " + letter);
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isWordStart(char c) {
        return isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return isLetter(c) || isDigit(c) || c == '.' || c == '_' || c == ':';
    }

    // 关键字字母之后若是数字或下划线，整个单词是变量名
    private static boolean isNameSecond(char c) {
        return isDigit(c) || c == '_';
    }
}
