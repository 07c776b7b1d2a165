package org.ltlspec.exceptions;

import lombok.Getter;
import org.ltlspec.core.Domain;
import org.ltlspec.expressions.Terminal;

/**
 * 常量的种类与其所配对变量的定义域种类不符，
 * 例如字符串常量被赋给整数变量。
 */
@Getter
public class DomainMismatchException extends SpecException {

    private final String variable;
    private final Terminal constant;
    private final Domain domain;

    public DomainMismatchException(String variable, Terminal constant, Domain domain) {
        this("常量 " + constant + " 被赋给变量 " + variable + ", 而该变量的定义域为 " + domain,
                variable, constant, domain);
    }

    protected DomainMismatchException(String message, String variable, Terminal constant, Domain domain) {
        super(message);
        this.variable = variable;
        this.constant = constant;
        this.domain = domain;
    }
}
