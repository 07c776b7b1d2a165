package org.ltlspec.parser;

import lombok.Getter;
import org.ltlspec.expressions.OperatorType;

/**
 * 记号种类。运算符记号记录其对应的 {@link OperatorType}。
 */
@Getter
public enum TokenType {

    TRUE,
    FALSE,
    NAME,
    NUMBER,

    NOT(OperatorType.NOT),
    AND(OperatorType.AND),
    OR(OperatorType.OR),
    XOR(OperatorType.XOR),
    IMPLIES(OperatorType.IMPLIES),
    IFF(OperatorType.IFF),

    EQUALS(OperatorType.EQ),
    NOT_EQUALS(OperatorType.NE),
    LT(OperatorType.LT),
    LE(OperatorType.LE),
    GT(OperatorType.GT),
    GE(OperatorType.GE),

    NEXT(OperatorType.NEXT),
    ALWAYS(OperatorType.ALWAYS),
    EVENTUALLY(OperatorType.EVENTUALLY),
    UNTIL(OperatorType.UNTIL),
    RELEASE(OperatorType.RELEASE),

    PLUS(OperatorType.PLUS),
    MINUS(OperatorType.MINUS),
    TIMES(OperatorType.TIMES),
    DIV(OperatorType.DIV),

    LPAREN,
    RPAREN,
    // 字符串常量的定界符；跟在运算数之后时表示后缀 prime
    QUOTE,

    EOF;

    private final OperatorType operator;

    TokenType() {
        this(null);
    }

    TokenType(OperatorType operator) {
        this.operator = operator;
    }
}
