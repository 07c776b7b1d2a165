package org.ltlspec.parser;

import org.ltlspec.exceptions.FormulaSyntaxException;
import org.ltlspec.expressions.Node;
import org.ltlspec.expressions.Operator;
import org.ltlspec.expressions.OperatorType;
import org.ltlspec.expressions.terminals.Bool;
import org.ltlspec.expressions.terminals.Num;
import org.ltlspec.expressions.terminals.Str;
import org.ltlspec.expressions.terminals.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * LTL 公式的优先级爬升解析器。
 * <p>
 * 优先级与结合性见 {@link Precedence}。括号不产生 AST 节点；
 * 带引号的标识符产生字符串常量，未加引号的标识符产生变量，数字产生整数。
 * 运算数按书写顺序排列：左运算数在位置 0，右运算数在位置 1。
 * <p>
 * 遇到第一个无法延续当前推导的记号时抛出 {@link FormulaSyntaxException}，
 * 不做错误恢复，也不返回部分结果。每次解析使用独立的状态，可以并发调用。
 */
public final class LTLParser {

    private static final Logger logger = LoggerFactory.getLogger(LTLParser.class);

    private final String formula;
    private final List<Token> tokens;
    private int index = 0;

    private LTLParser(String formula, List<Token> tokens) {
        this.formula = formula;
        this.tokens = tokens;
    }

    /**
     * 解析公式字符串，返回递归 AST 的根。
     * 词法诊断以警告记录，不中止解析。
     * @param formula 公式文本。
     * @return AST 根节点。
     * @throws FormulaSyntaxException 如果公式不合语法。
     */
    public static Node parse(String formula) {
        Objects.requireNonNull(formula, "LTLParser.parse: formula 不能为 null");
        LexResult lexed = Lexer.tokenize(formula);
        if (lexed.hasDiagnostics()) {
            logger.warn("公式 {} 中有 {} 个字符被跳过: {}", formula, lexed.getDiagnostics().size(), lexed.getDiagnostics());
        }
        LTLParser parser = new LTLParser(formula, lexed.getTokens());
        Node root = parser.parseExpression(0);
        parser.expect(TokenType.EOF, "多余的记号");
        logger.debug("解析了公式 {}: {}", formula, root);
        return root;
    }

    private Node parseExpression(int minLevel) {
        Node left = parsePrefix();
        while (true) {
            Token token = peek();
            Precedence level = Precedence.of(token.getType());
            if (level == null || level.isPrefix() || level.ordinal() < minLevel) {
                return left;
            }
            advance();
            if (level.isPostfix()) {
                left = Operator.unary(OperatorType.PRIME, left);
                continue;
            }
            Node right = parseExpression(level.rightOperandLevel());
            left = Operator.binary(token.getType().getOperator(), left, right);
            if (level.getAssociativity() == Precedence.Associativity.NONASSOC
                    && Precedence.of(peek().getType()) == level) {
                throw syntaxError(peek(), "非结合运算符不能连用");
            }
        }
    }

    private Node parsePrefix() {
        Token token = advance();
        switch (token.getType()) {
            case NOT, NEXT, ALWAYS, EVENTUALLY -> {
                Precedence level = Precedence.of(token.getType());
                Node operand = parseExpression(level.ordinal());
                return Operator.unary(token.getType().getOperator(), operand);
            }
            case LPAREN -> {
                Node inner = parseExpression(0);
                expect(TokenType.RPAREN, "缺少右括号");
                return inner;
            }
            case NUMBER -> {
                try {
                    return Num.of(Long.parseLong(token.getText()));
                } catch (NumberFormatException e) {
                    throw syntaxError(token, "整数超出范围");
                }
            }
            case NAME -> {
                return Var.of(token.getText());
            }
            case TRUE -> {
                return Bool.TRUE;
            }
            case FALSE -> {
                return Bool.FALSE;
            }
            case QUOTE -> {
                Token name = expect(TokenType.NAME, "引号内应为标识符");
                expect(TokenType.QUOTE, "缺少右引号");
                return Str.of(name.getText());
            }
            case EOF -> throw syntaxError(token, "意外的输入结束");
            default -> throw syntaxError(token, "此处需要运算数");
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String detail) {
        Token token = peek();
        if (!token.is(type)) {
            throw syntaxError(token, detail);
        }
        return advance();
    }

    private FormulaSyntaxException syntaxError(Token token, String detail) {
        logger.error("语法错误: 位置 {} 处的记号 {} ({}), 公式: {}", token.getOffset(), token, detail, formula);
        return new FormulaSyntaxException(token, formula, detail);
    }
}
