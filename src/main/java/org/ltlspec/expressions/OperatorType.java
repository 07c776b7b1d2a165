package org.ltlspec.expressions;

import lombok.Getter;

/**
 * 运算符标签枚举。
 * 每个标签带有其在输入语法中的规范写法、元数以及所属类别。
 */
@Getter
public enum OperatorType {

    // 算术
    TIMES("*", 2, Category.ARITHMETIC),
    DIV("/", 2, Category.ARITHMETIC),
    PLUS("+", 2, Category.ARITHMETIC),
    MINUS("-", 2, Category.ARITHMETIC),
    // 关系
    EQ("=", 2, Category.RELATIONAL),
    NE("!=", 2, Category.RELATIONAL),
    LT("<", 2, Category.RELATIONAL),    // Less Than
    LE("<=", 2, Category.RELATIONAL),   // Less Equal
    GT(">", 2, Category.RELATIONAL),    // Greater Than
    GE(">=", 2, Category.RELATIONAL),   // Greater Equal
    // 布尔
    NOT("!", 1, Category.BOOLEAN),
    AND("&&", 2, Category.BOOLEAN),
    OR("||", 2, Category.BOOLEAN),
    XOR("^", 2, Category.BOOLEAN),
    IMPLIES("->", 2, Category.BOOLEAN),
    IFF("<->", 2, Category.BOOLEAN),
    // 时序
    NEXT("X", 1, Category.TEMPORAL),
    ALWAYS("[]", 1, Category.TEMPORAL),
    EVENTUALLY("<>", 1, Category.TEMPORAL),
    PRIME("'", 1, Category.TEMPORAL),   // 后缀形式 x'
    UNTIL("U", 2, Category.TEMPORAL),
    RELEASE("R", 2, Category.TEMPORAL);

    /**
     * 运算符类别。
     */
    public enum Category {
        ARITHMETIC,
        RELATIONAL,
        BOOLEAN,
        TEMPORAL
    }

    private final String symbol;
    private final int arity;
    private final Category category;

    OperatorType(String symbol, int arity, Category category) {
        this.symbol = symbol;
        this.arity = arity;
        this.category = category;
    }

    /**
     * 是否为变量与常量之间的二元比较类运算符 (关系或算术)。
     * 常量与变量的配对只在这类运算符下进行。
     */
    public boolean isComparison() {
        return arity == 2 && (category == Category.RELATIONAL || category == Category.ARITHMETIC);
    }

    /**
     * 是否以后缀形式书写。
     */
    public boolean isPostfix() {
        return this == PRIME;
    }
}
