package org.ltlspec.exceptions;

import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.expressions.terminals.Str;

/**
 * 字符串常量不属于其变量的有限枚举定义域。
 */
public class OutOfDomainException extends DomainMismatchException {

    public OutOfDomainException(String variable, Str constant, EnumerationDomain domain) {
        super("字符串常量 " + constant + " 不在变量 " + variable + " 的定义域 " + domain + " 中",
                variable, constant, domain);
    }

    public String getValue() {
        return ((Str) getConstant()).getValue();
    }
}
