package org.ltlspec.exceptions;

/**
 * 结构错误：传入的 AST 或树不满足内部不变量 (节点既非终结符也非运算符、
 * 运算数个数与元数不符、常量没有可配对的比较运算符等)。
 * 属于编程错误，库内部从不捕获。
 */
public class MalformedTreeException extends SpecException {

    public MalformedTreeException(String message) {
        super(message);
    }
}
