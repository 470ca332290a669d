package com.treegrep.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PatternLexerTest {

    @Test
    @DisplayName("标签与关系运算符")
    void testSimpleRelation() {
        List<LexToken> tokens = tokenize("NP < DT");

        assertEquals(List.of(TokenType.LABEL, TokenType.RELATION, TokenType.LABEL, TokenType.EOF), types(tokens));
        assertEquals("DT", tokens.get(2).value());
        assertEquals(5, tokens.get(2).position());
    }

    @Test
    @DisplayName("运算符贪婪匹配")
    void testGreedyOperators() {
        List<LexToken> tokens = tokenize("A $,, B <<' C <-2 D !.. E");

        assertEquals("$,,", tokens.get(1).value());
        assertEquals("<<'", tokens.get(3).value());
        assertEquals("<-2", tokens.get(5).value());
        assertEquals(TokenType.NOT, tokens.get(7).type());
        assertEquals("..", tokens.get(8).value());
    }

    @Test
    @DisplayName("无空白分隔的模式")
    void testNoWhitespace() {
        List<LexToken> tokens = tokenize("NP<DT&$.VP");

        assertEquals(List.of(TokenType.LABEL, TokenType.RELATION, TokenType.LABEL, TokenType.AND,
                TokenType.RELATION, TokenType.LABEL, TokenType.EOF), types(tokens));
    }

    @Test
    @DisplayName("引号、正则与大小写不敏感前缀保留原文")
    void testQuotedRegexAndCaseInsensitive() {
        List<LexToken> tokens = tokenize("\"a \\\" b\" /^N[NP]$/ i@np i@/v/ i@\"X\"");

        assertEquals(TokenType.QUOTED, tokens.get(0).type());
        assertEquals("\"a \\\" b\"", tokens.get(0).value());
        assertEquals(TokenType.REGEX, tokens.get(1).type());
        assertEquals("/^N[NP]$/", tokens.get(1).value());
        assertEquals(TokenType.LABEL, tokens.get(2).type());
        assertEquals("i@np", tokens.get(2).value());
        assertEquals(TokenType.REGEX, tokens.get(3).type());
        assertEquals(TokenType.QUOTED, tokens.get(4).type());
    }

    @Test
    @DisplayName("通配符与含星号的标签")
    void testWildcardAndStarLabels() {
        List<LexToken> tokens = tokenize("* *T* (*)");

        assertEquals(TokenType.WILDCARD, tokens.get(0).type());
        assertEquals(TokenType.LABEL, tokens.get(1).type());
        assertEquals("*T*", tokens.get(1).value());
        assertEquals(TokenType.WILDCARD, tokens.get(3).type());
    }

    @Test
    void testPositionLiteralAndComments() {
        List<LexToken> tokens = tokenize("N(0, 1,) # trailing comment\n< NN");

        assertEquals(List.of(TokenType.POSITION, TokenType.RELATION, TokenType.LABEL, TokenType.EOF), types(tokens));
        assertEquals("N(0, 1,)", tokens.get(0).value());
    }

    @Test
    void testBracketsAndLabelsWithHyphen() {
        List<LexToken> tokens = tokenize("NP-SBJ ![< -NONE- | $ VP]");

        assertEquals("NP-SBJ", tokens.get(0).value());
        assertEquals(List.of(TokenType.LABEL, TokenType.NOT, TokenType.LBRACKET, TokenType.RELATION,
                TokenType.LABEL, TokenType.OR, TokenType.RELATION, TokenType.LABEL, TokenType.RBRACKET,
                TokenType.EOF), types(tokens));
    }

    @ParameterizedTest
    @CsvSource({
        "'\"unclosed', 0",
        "'NP < /x', 5",
        "'N(0,1', 0",
        "'NP ^ VP', 3"
    })
    void testMalformedInput(String pattern, int position) {
        PatternParseException exception = assertThrows(PatternParseException.class, () -> tokenize(pattern));
        assertEquals(position, exception.getPosition());
    }

    @ParameterizedTest
    @CsvSource({
        "'NP=x < DT', 2",
        "'NP < ~x', 5",
        "'@NOUN < DT', 0",
        "'NP : VP', 3",
        "'NP ; VP', 3",
        "'NP ?< DT', 3"
    })
    void testUnsupportedSyntax(String pattern, int position) {
        UnsupportedSyntaxException exception = assertThrows(UnsupportedSyntaxException.class, () -> tokenize(pattern));
        assertEquals(position, exception.getPosition());
    }

    @Test
    void testNullPattern() {
        assertThrows(PatternParseException.class, () -> tokenize(null));
    }

    private static List<LexToken> tokenize(String pattern) {
        return new PatternLexer().tokenize(pattern);
    }

    private static List<TokenType> types(List<LexToken> tokens) {
        return tokens.stream().map(LexToken::type).toList();
    }
}
