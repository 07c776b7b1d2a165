package org.ltlspec.expressions;

import lombok.Getter;
import org.ltlspec.exceptions.MalformedTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 运算符节点：一个运算符标签加上有序的运算数序列。
 * 运算数个数必须等于运算符的元数，由构造函数保证。
 * 此类是不可变的。
 */
public final class Operator extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Operator.class);

    @Getter
    private final OperatorType type;
    @Getter
    private final List<Node> operands;

    private final int hashCode;

    private Operator(OperatorType type, List<Node> operands) {
        this.type = Objects.requireNonNull(type, "Operator-构造函数: type 不能为 null");
        Objects.requireNonNull(operands, "Operator-构造函数: operands 不能为 null");
        if (operands.size() != type.getArity()) {
            logger.error("Operator-构造函数: 运算符 {} 的元数为 {}, 却得到 {} 个运算数", type, type.getArity(), operands.size());
            throw new MalformedTreeException("运算符 " + type.getSymbol() + " 需要 " + type.getArity()
                    + " 个运算数, 实际为 " + operands.size());
        }
        for (Node operand : operands) {
            Objects.requireNonNull(operand, "Operator-构造函数: 运算数不能为 null");
        }
        this.operands = List.copyOf(operands);
        this.hashCode = Objects.hash(type, this.operands);
    }

    // --- 工厂方法 ---
    public static Operator of(OperatorType type, List<Node> operands) {
        return new Operator(type, operands);
    }

    public static Operator of(OperatorType type, Node... operands) {
        return new Operator(type, Arrays.asList(operands));
    }

    public static Operator unary(OperatorType type, Node operand) {
        return new Operator(type, List.of(operand));
    }

    public static Operator binary(OperatorType type, Node left, Node right) {
        return new Operator(type, List.of(left, right));
    }

    /**
     * 浅拷贝：保留运算符标签，替换运算数序列。
     * @param newOperands 新的运算数，个数须与元数一致。
     * @return 新的 Operator。
     */
    public Operator withOperands(List<Node> newOperands) {
        return new Operator(type, newOperands);
    }

    public int getArity() {
        return type.getArity();
    }

    public Node getOperand(int position) {
        return operands.get(position);
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operator that = (Operator) o;
        return type == that.type && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String op = type.getSymbol();
        if (type.getArity() == 2) {
            return "(" + operands.get(0) + " " + op + " " + operands.get(1) + ")";
        }
        if (type.isPostfix()) {
            return "(" + operands.get(0) + op + ")";
        }
        return "(" + op + " " + operands.get(0) + ")";
    }
}
