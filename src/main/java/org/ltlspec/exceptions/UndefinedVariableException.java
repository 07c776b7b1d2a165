package org.ltlspec.exceptions;

import lombok.Getter;

/**
 * 公式中出现了定义域映射中不存在的变量。
 */
@Getter
public class UndefinedVariableException extends SpecException {

    private final String variable;

    public UndefinedVariableException(String variable, String formula) {
        super("未定义的变量: " + variable + ", 所在子公式: " + formula);
        this.variable = variable;
    }
}
