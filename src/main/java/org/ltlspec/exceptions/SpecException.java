package org.ltlspec.exceptions;

/**
 * 公式处理过程中所有类型化失败的基类。
 * 与 JDK 的 IllegalArgumentException 一样是非受检异常，由调用方决定是否捕获。
 */
public class SpecException extends RuntimeException {

    public SpecException(String message) {
        super(message);
    }

    public SpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
