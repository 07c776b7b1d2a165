package org.ltlspec.expressions;

/**
 * 递归 AST 的节点。
 * 只有两种能力：{@link Terminal} 携带一个值，{@link Operator} 携带有序的运算数序列。
 * 节点是不可变的值对象，equals 按结构比较。
 * toString 以输入语法输出完整加括号的公式，重新解析可得到同一棵树。
 */
public abstract class Node {

    Node() {
    }

    public abstract boolean isTerminal();

    public final boolean isOperator() {
        return !isTerminal();
    }
}
