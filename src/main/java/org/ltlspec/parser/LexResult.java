package org.ltlspec.parser;

import lombok.Getter;

import java.util.List;

/**
 * 词法分析的结果：记号序列 (以 EOF 结尾) 以及收集到的诊断。
 */
@Getter
public final class LexResult {

    private final List<Token> tokens;
    private final List<LexDiagnostic> diagnostics;

    LexResult(List<Token> tokens, List<LexDiagnostic> diagnostics) {
        this.tokens = List.copyOf(tokens);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "LexResult{tokens=" + tokens + ", diagnostics=" + diagnostics + "}";
    }
}
