package com.treegrep.query;

import java.util.ArrayList;
import java.util.List;

public class PatternLexer {
    private static final String RELATION_START_CHARS = "$%,.<>";
    private static final String RELATION_BODY_CHARS = "%,.<>0123456789-':";
    private static final String LABEL_STOP_CHARS = "[]();:.,&|<>$!@%'^=~?#\"/";

    /**
     * 将原始模式字符串切分为词法 token 序列。
     */
    public List<LexToken> tokenize(String pattern) {
        if (pattern == null) {
            throw new PatternParseException("模式字符串不能为空", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < pattern.length()) {
            char currentChar = pattern.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '#') {
                index = skipComment(pattern, index);
                continue;
            }

            TokenType single = singleCharType(currentChar);
            if (single != null) {
                tokens.add(new LexToken(single, String.valueOf(currentChar), index));
                index++;
                continue;
            }

            if (currentChar == '"') {
                int end = readDelimited(pattern, index, '"');
                tokens.add(new LexToken(TokenType.QUOTED, pattern.substring(index, end), index));
                index = end;
                continue;
            }
            if (currentChar == '/') {
                int end = readDelimited(pattern, index, '/');
                tokens.add(new LexToken(TokenType.REGEX, pattern.substring(index, end), index));
                index = end;
                continue;
            }

            if (RELATION_START_CHARS.indexOf(currentChar) >= 0) {
                int end = index + 1;
                while (end < pattern.length() && RELATION_BODY_CHARS.indexOf(pattern.charAt(end)) >= 0) {
                    end++;
                }
                tokens.add(new LexToken(TokenType.RELATION, pattern.substring(index, end), index));
                index = end;
                continue;
            }

            if (currentChar == 'i' && index + 1 < pattern.length() && pattern.charAt(index + 1) == '@') {
                index = readCaseInsensitive(pattern, index, tokens);
                continue;
            }

            rejectUnsupported(pattern, index);

            if (currentChar == '*' && !(index + 1 < pattern.length() && isLabelChar(pattern.charAt(index + 1)))) {
                tokens.add(new LexToken(TokenType.WILDCARD, "*", index));
                index++;
                continue;
            }

            if (currentChar == 'N' && index + 1 < pattern.length() && pattern.charAt(index + 1) == '(') {
                int close = pattern.indexOf(')', index);
                if (close < 0) {
                    throw new PatternParseException("位置字面量缺少右括号", index, pattern);
                }
                tokens.add(new LexToken(TokenType.POSITION, pattern.substring(index, close + 1), index));
                index = close + 1;
                continue;
            }

            int tokenStart = index;
            index = readLabel(pattern, index);
            if (tokenStart == index) {
                throw new PatternParseException("无法识别字符: " + currentChar, index, pattern);
            }
            tokens.add(new LexToken(TokenType.LABEL, pattern.substring(tokenStart, index), tokenStart));
        }

        tokens.add(new LexToken(TokenType.EOF, "", pattern.length()));
        return tokens;
    }

    /**
     * 判断字符能否出现在裸标签中。
     */
    static boolean isLabelChar(char ch) {
        return !Character.isWhitespace(ch) && LABEL_STOP_CHARS.indexOf(ch) < 0;
    }

    private TokenType singleCharType(char ch) {
        return switch (ch) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '!' -> TokenType.NOT;
            case '&' -> TokenType.AND;
            case '|' -> TokenType.OR;
            default -> null;
        };
    }

    /**
     * 读取 i@ 前缀的大小写不敏感标签、字符串或正则。
     */
    private int readCaseInsensitive(String pattern, int prefixIndex, List<LexToken> tokens) {
        int index = prefixIndex + 2;
        if (index >= pattern.length()) {
            throw new PatternParseException("i@ 之后缺少标签", index, pattern);
        }
        char first = pattern.charAt(index);
        int end;
        TokenType type;
        if (first == '"') {
            end = readDelimited(pattern, index, '"');
            type = TokenType.QUOTED;
        } else if (first == '/') {
            end = readDelimited(pattern, index, '/');
            type = TokenType.REGEX;
        } else {
            end = readLabel(pattern, index);
            type = TokenType.LABEL;
        }
        if (end == index) {
            throw new PatternParseException("i@ 之后缺少标签", index, pattern);
        }
        tokens.add(new LexToken(type, pattern.substring(prefixIndex, end), prefixIndex));
        return end;
    }

    /**
     * 读取带反斜杠转义的定界文本，返回结束定界符之后的位置。
     */
    private int readDelimited(String pattern, int startIndex, char delimiter) {
        int index = startIndex + 1;
        while (index < pattern.length()) {
            char currentChar = pattern.charAt(index);
            if (currentChar == '\\' && index + 1 < pattern.length()) {
                index += 2;
                continue;
            }
            if (currentChar == delimiter) {
                return index + 1;
            }
            index++;
        }
        String message = delimiter == '"' ? "未闭合引号" : "未闭合正则表达式";
        throw new PatternParseException(message, startIndex, pattern);
    }

    private int readLabel(String pattern, int index) {
        while (index < pattern.length() && isLabelChar(pattern.charAt(index))) {
            index++;
        }
        return index;
    }

    private int skipComment(String pattern, int index) {
        int lineEnd = pattern.indexOf('\n', index);
        return lineEnd < 0 ? pattern.length() : lineEnd + 1;
    }

    private void rejectUnsupported(String pattern, int index) {
        String feature = switch (pattern.charAt(index)) {
            case '@' -> "宏定义与宏调用";
            case '=' -> "命名节点";
            case '~' -> "节点回指";
            case ';' -> "多模式分隔符";
            case ':' -> "分段模式";
            case '?' -> "可选链接修饰符";
            default -> null;
        };
        if (feature != null) {
            throw new UnsupportedSyntaxException(feature, index, pattern);
        }
    }
}
