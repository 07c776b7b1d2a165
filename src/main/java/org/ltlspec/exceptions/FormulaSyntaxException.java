package org.ltlspec.exceptions;

import lombok.Getter;
import org.ltlspec.parser.Token;

/**
 * 语法错误：在第一个无法延续当前推导的记号处抛出。
 * 不做错误恢复，也不会返回部分解析结果。
 */
@Getter
public class FormulaSyntaxException extends SpecException {

    private final Token token;
    private final String formula;

    public FormulaSyntaxException(Token token, String formula, String detail) {
        super("语法错误: 第 " + token.getLine() + " 行, 位置 " + token.getOffset()
                + " 处的记号 " + token + " (" + detail + "), 公式: " + formula);
        this.token = token;
        this.formula = formula;
    }
}
