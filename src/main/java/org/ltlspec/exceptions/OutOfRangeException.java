package org.ltlspec.exceptions;

import org.ltlspec.core.IntegerRange;
import org.ltlspec.expressions.terminals.Num;

/**
 * 整数常量超出其变量的闭区间 [low, high]。
 */
public class OutOfRangeException extends DomainMismatchException {

    public OutOfRangeException(String variable, Num constant, IntegerRange range) {
        super("整数变量 " + variable + " 被赋值为 " + constant.getValue()
                        + ", 超出其范围 " + range.getLow() + " ... " + range.getHigh(),
                variable, constant, range);
    }

    public long getValue() {
        return ((Num) getConstant()).getValue();
    }

    public IntegerRange getRange() {
        return (IntegerRange) getDomain();
    }
}
