package org.ltlspec.parser;

import lombok.Getter;

import java.util.Objects;

/**
 * 词法记号：种类、原始文本、在输入中的偏移以及所在行号 (仅用于诊断)。
 * 此类是不可变的。
 */
@Getter
public final class Token {

    private final TokenType type;
    private final String text;
    private final int offset;
    private final int line;

    public Token(TokenType type, String text, int offset, int line) {
        this.type = Objects.requireNonNull(type, "Token-构造函数: type 不能为 null");
        this.text = Objects.requireNonNull(text, "Token-构造函数: text 不能为 null");
        this.offset = offset;
        this.line = line;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Token token = (Token) o;
        return offset == token.offset && line == token.line && type == token.type && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, offset, line);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "<EOF>" : "'" + text + "'";
    }
}
