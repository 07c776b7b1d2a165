package org.ltlspec.parser;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 运算符优先级表，按结合强度从低到高排列 (ordinal 越大结合越紧)。
 * 表在类加载时构建一次，之后只读，可在并发解析之间共享。
 */
@Getter
public enum Precedence {

    TEMPORAL_BINARY(Associativity.RIGHT, Fixity.INFIX, TokenType.UNTIL, TokenType.RELEASE),
    BICONDITIONAL(Associativity.RIGHT, Fixity.INFIX, TokenType.IFF),
    IMPLICATION(Associativity.RIGHT, Fixity.INFIX, TokenType.IMPLIES),
    XOR(Associativity.LEFT, Fixity.INFIX, TokenType.XOR),
    OR(Associativity.LEFT, Fixity.INFIX, TokenType.OR),
    AND(Associativity.LEFT, Fixity.INFIX, TokenType.AND),
    UNARY_TEMPORAL(Associativity.RIGHT, Fixity.PREFIX, TokenType.NEXT, TokenType.ALWAYS, TokenType.EVENTUALLY),
    NEGATION(Associativity.RIGHT, Fixity.PREFIX, TokenType.NOT),
    PRIME(Associativity.LEFT, Fixity.POSTFIX, TokenType.QUOTE),
    RELATIONAL(Associativity.NONASSOC, Fixity.INFIX,
            TokenType.EQUALS, TokenType.NOT_EQUALS, TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE),
    MULTIPLICATIVE(Associativity.NONASSOC, Fixity.INFIX, TokenType.TIMES, TokenType.DIV),
    ADDITIVE(Associativity.NONASSOC, Fixity.INFIX, TokenType.PLUS, TokenType.MINUS);

    /**
     * 结合性。
     */
    public enum Associativity {
        LEFT,
        RIGHT,
        // 同级运算符不能连用，例如 a < b < c
        NONASSOC
    }

    /**
     * 运算符相对于运算数的位置。
     */
    public enum Fixity {
        PREFIX,
        INFIX,
        POSTFIX
    }

    private static final Map<TokenType, Precedence> BY_TOKEN;

    static {
        Map<TokenType, Precedence> byToken = new EnumMap<>(TokenType.class);
        for (Precedence level : values()) {
            for (TokenType type : level.tokens) {
                byToken.put(type, level);
            }
        }
        BY_TOKEN = Collections.unmodifiableMap(byToken);
    }

    private final Associativity associativity;
    private final Fixity fixity;
    private final List<TokenType> tokens;

    Precedence(Associativity associativity, Fixity fixity, TokenType... tokens) {
        this.associativity = associativity;
        this.fixity = fixity;
        this.tokens = List.of(tokens);
    }

    /**
     * @param type 记号种类。
     * @return 该记号所在的优先级，不是运算符时返回 null。
     */
    public static Precedence of(TokenType type) {
        return BY_TOKEN.get(type);
    }

    /**
     * 解析右侧运算数时使用的最低优先级：右结合取本级，其余取高一级。
     */
    public int rightOperandLevel() {
        return associativity == Associativity.RIGHT ? ordinal() : ordinal() + 1;
    }

    public boolean isPrefix() {
        return fixity == Fixity.PREFIX;
    }

    public boolean isPostfix() {
        return fixity == Fixity.POSTFIX;
    }
}
