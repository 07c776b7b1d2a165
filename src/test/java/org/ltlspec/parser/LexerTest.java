package org.ltlspec.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenType> types(String text) {
        return Lexer.tokenize(text).getTokens().stream()
                .map(Token::getType)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("运算符 (Operators)")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符优先于单字符前缀")
        void testCompoundOperators_AreMatchedGreedily() {
            assertAll("Compound operators",
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.IFF, TokenType.NAME, TokenType.EOF), types("a<->b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.IMPLIES, TokenType.NAME, TokenType.EOF), types("a->b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.LE, TokenType.NAME, TokenType.EOF), types("a<=b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.GE, TokenType.NAME, TokenType.EOF), types("a>=b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.EQUALS, TokenType.NAME, TokenType.EOF), types("a==b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.NOT_EQUALS, TokenType.NAME, TokenType.EOF), types("a!=b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.AND, TokenType.NAME, TokenType.EOF), types("a&&b")),
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.OR, TokenType.NAME, TokenType.EOF), types("a||b")),
                    () -> assertEquals(List.of(TokenType.ALWAYS, TokenType.EVENTUALLY, TokenType.NAME, TokenType.EOF), types("[]<>p"))
            );
        }

        @Test
        @DisplayName("单字符写法 & | = 与双字符写法等价")
        void testSingleCharacterSpellings() {
            assertEquals(types("a && b || c == d"), types("a & b | c = d"));
        }

        @Test
        @DisplayName("算术、括号与引号")
        void testArithmeticParenthesesAndQuotes() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.NAME, TokenType.PLUS, TokenType.NUMBER, TokenType.RPAREN,
                            TokenType.TIMES, TokenType.NUMBER, TokenType.MINUS, TokenType.NUMBER, TokenType.DIV,
                            TokenType.QUOTE, TokenType.NAME, TokenType.QUOTE, TokenType.EOF),
                    types("(x + 1) * 2 - 3 / 'red'"));
        }
    }

    @Nested
    @DisplayName("关键字与标识符 (Keywords and Identifiers)")
    class KeywordTests {

        @Test
        @DisplayName("布尔字面量不区分大小写")
        void testBooleanLiterals_AreCaseInsensitive() {
            assertEquals(List.of(TokenType.TRUE, TokenType.TRUE, TokenType.TRUE, TokenType.TRUE,
                            TokenType.FALSE, TokenType.FALSE, TokenType.FALSE, TokenType.EOF),
                    types("TRUE True true tRuE FALSE False false"));
        }

        @Test
        @DisplayName("以 true 开头的更长单词是变量名")
        void testLongerWordStartingWithTrue_IsName() {
            List<Token> tokens = Lexer.tokenize("trueish").getTokens();
            assertEquals(TokenType.NAME, tokens.get(0).getType());
            assertEquals("trueish", tokens.get(0).getText());
        }

        @Test
        @DisplayName("单字母时序关键字可以连写 (GFp => G F p)")
        void testTemporalLetters_SplitFromFollowingName() {
            List<Token> tokens = Lexer.tokenize("GFp").getTokens();
            assertAll("GFp",
                    () -> assertEquals(List.of(TokenType.ALWAYS, TokenType.EVENTUALLY, TokenType.NAME, TokenType.EOF),
                            tokens.stream().map(Token::getType).collect(Collectors.toList())),
                    () -> assertEquals("p", tokens.get(2).getText())
            );
            assertEquals(List.of(TokenType.NEXT, TokenType.NAME, TokenType.UNTIL, TokenType.NAME, TokenType.RELEASE,
                    TokenType.NAME, TokenType.EOF), types("Xa U b R c"));
        }

        @Test
        @DisplayName("关键字字母后跟数字或下划线时是变量名 (X1, G_a)")
        void testKeywordLetterFollowedByDigitOrUnderscore_IsName() {
            List<Token> tokens = Lexer.tokenize("X1 G_a U_2").getTokens();
            assertAll("names",
                    () -> assertEquals(TokenType.NAME, tokens.get(0).getType()),
                    () -> assertEquals("X1", tokens.get(0).getText()),
                    () -> assertEquals(TokenType.NAME, tokens.get(1).getType()),
                    () -> assertEquals("G_a", tokens.get(1).getText()),
                    () -> assertEquals("U_2", tokens.get(2).getText())
            );
        }

        @Test
        @DisplayName("next 是保留字，变量名不能以 next 开头")
        void testNextIsReserved() {
            assertEquals(List.of(TokenType.NEXT, TokenType.NAME, TokenType.EOF), types("next x"));
            assertEquals(List.of(TokenType.NEXT, TokenType.NAME, TokenType.EOF), types("nextx"));
        }

        @Test
        @DisplayName("变量名可以包含字母、数字以及 . _ :")
        void testNameCharacters() {
            List<Token> tokens = Lexer.tokenize("loc.x_1:a Vx _tmp").getTokens();
            assertAll("names",
                    () -> assertEquals("loc.x_1:a", tokens.get(0).getText()),
                    () -> assertEquals("Vx", tokens.get(1).getText()),
                    () -> assertEquals("_tmp", tokens.get(2).getText()),
                    () -> assertEquals(TokenType.EOF, tokens.get(3).getType())
            );
        }
    }

    @Nested
    @DisplayName("诊断与位置 (Diagnostics and Positions)")
    class DiagnosticTests {

        @Test
        @DisplayName("换行推进行号，其他空白被丢弃")
        void testNewlines_AdvanceLineCounter() {
            List<Token> tokens = Lexer.tokenize("a\n&&\r\n\tb").getTokens();
            assertAll("lines",
                    () -> assertEquals(1, tokens.get(0).getLine()),
                    () -> assertEquals(2, tokens.get(1).getLine()),
                    () -> assertEquals(3, tokens.get(2).getLine()),
                    () -> assertEquals(4, tokens.size())
            );
        }

        @Test
        @DisplayName("非法字符被跳过并记录，分析继续")
        void testIllegalCharacter_IsSkippedAndRecorded() {
            LexResult result = Lexer.tokenize("a # && $b");
            assertAll("diagnostics",
                    () -> assertEquals(List.of(TokenType.NAME, TokenType.AND, TokenType.NAME, TokenType.EOF),
                            result.getTokens().stream().map(Token::getType).collect(Collectors.toList())),
                    () -> assertTrue(result.hasDiagnostics()),
                    () -> assertEquals(List.of(new LexDiagnostic(2, '#', 1), new LexDiagnostic(7, '$', 1)),
                            result.getDiagnostics())
            );
        }

        @Test
        @DisplayName("记号记录其偏移")
        void testTokenOffsets() {
            List<Token> tokens = Lexer.tokenize("ab <-> 12").getTokens();
            assertAll("offsets",
                    () -> assertEquals(0, tokens.get(0).getOffset()),
                    () -> assertEquals(3, tokens.get(1).getOffset()),
                    () -> assertEquals(7, tokens.get(2).getOffset()),
                    () -> assertEquals("12", tokens.get(2).getText()),
                    () -> assertEquals(9, tokens.get(3).getOffset())
            );
        }

        @Test
        @DisplayName("空输入只产生 EOF")
        void testEmptyInput() {
            LexResult result = Lexer.tokenize("   ");
            assertEquals(List.of(TokenType.EOF), result.getTokens().stream().map(Token::getType).collect(Collectors.toList()));
            assertFalse(result.hasDiagnostics());
        }
    }
}
