package org.ltlspec.expressions;

/**
 * 终结符节点：携带一个值，没有运算数。
 */
public abstract class Terminal extends Node {

    protected Terminal() {
    }

    /**
     * @return 终结符携带的值。
     */
    public abstract Object getValue();

    @Override
    public final boolean isTerminal() {
        return true;
    }
}
