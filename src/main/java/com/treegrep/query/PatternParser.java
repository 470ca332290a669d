package com.treegrep.query;

import com.treegrep.relation.RelationTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class PatternParser {
    private static final String CASE_INSENSITIVE_PREFIX = "i@";
    private static final Pattern POSITION_BODY = Pattern.compile("\\s*(\\d+\\s*(,\\s*\\d+\\s*)*,?\\s*)?");

    private List<LexToken> tokens;
    private int pos;
    private String patternString;

    /**
     * 将模式字符串解析为 AST。
     */
    public PatternNode parse(String pattern) {
        this.tokens = new PatternLexer().tokenize(pattern);
        this.pos = 0;
        this.patternString = pattern;

        if (current().type() == TokenType.EOF) {
            throw new PatternParseException("模式不能为空", 0, patternString);
        }

        PatternNode ast = parseDisjunction();

        if (current().type() == TokenType.RPAREN) {
            throw new PatternParseException("多余的右括号", current().position(), patternString);
        }
        if (current().type() != TokenType.EOF) {
            throw new PatternParseException("意外token: " + current().value(), current().position(), patternString);
        }
        return ast;
    }

    /**
     * 解析 | 层级，优先级最低。
     */
    private PatternNode parseDisjunction() {
        List<PatternNode> operands = new ArrayList<>();
        operands.add(parseConjunction());
        while (match(TokenType.OR)) {
            operands.add(parseConjunction());
        }
        return operands.size() == 1 ? operands.get(0) : new PatternNode.Disjunction(operands);
    }

    /**
     * 解析 & 层级，并支持相邻项的隐式合取。
     */
    private PatternNode parseConjunction() {
        List<PatternNode> operands = new ArrayList<>();
        operands.add(parseTerm());
        while (true) {
            if (match(TokenType.AND)) {
                operands.add(parseTerm());
                continue;
            }
            if (isTermStart(current().type())) {
                operands.add(parseTerm());
                continue;
            }
            break;
        }
        return operands.size() == 1 ? operands.get(0) : new PatternNode.Conjunction(operands);
    }

    /**
     * 解析节点及其后的关系链；关系链中的每个链接都直接限定该节点。
     */
    private PatternNode parseTerm() {
        PatternNode node = parseUnary();
        if (!isRelationStart(pos)) {
            return node;
        }
        PatternNode relations = parseRelations();
        List<PatternNode> operands = new ArrayList<>();
        operands.add(node);
        if (relations instanceof PatternNode.Conjunction conjunction) {
            operands.addAll(conjunction.operands());
        } else {
            operands.add(relations);
        }
        return new PatternNode.Conjunction(operands);
    }

    private PatternNode parseUnary() {
        if (match(TokenType.NOT)) {
            return new PatternNode.Negation(parseUnary());
        }
        return parseAtom();
    }

    /**
     * 解析基础节点：分组、位置字面量、标签及标签析取。
     */
    private PatternNode parseAtom() {
        LexToken token = current();
        switch (token.type()) {
            case LPAREN -> {
                advance();
                PatternNode grouped = parseDisjunction();
                expect(TokenType.RPAREN, "缺少右括号");
                return grouped;
            }
            case POSITION -> {
                advance();
                return new PatternNode.PositionTest(parsePosition(token));
            }
            case LABEL, QUOTED, REGEX, WILDCARD -> {
                return parseLabelTest();
            }
            case RELATION -> throw new PatternParseException(
                    "关系运算符 " + token.value() + " 缺少左侧节点", token.position(), patternString);
            case EOF -> throw new PatternParseException("模式意外结束，缺少节点", token.position(), patternString);
            default -> throw new PatternParseException(
                    "无法解析表达式: " + token.value(), token.position(), patternString);
        }
    }

    /**
     * 解析 A|B|... 形式的标签析取；| 两侧均为标签时才归入同一节点。
     */
    private PatternNode parseLabelTest() {
        List<LabelMatcher> alternatives = new ArrayList<>();
        alternatives.add(toLabelMatcher(advance()));
        while (current().type() == TokenType.OR && isLabelToken(peek(1).type())) {
            advance();
            alternatives.add(toLabelMatcher(advance()));
        }
        LabelMatcher matcher = alternatives.size() == 1
                ? alternatives.get(0)
                : new LabelMatcher.AnyOf(alternatives);
        return new PatternNode.LabelTest(matcher);
    }

    /**
     * 解析关系链，| 连接的关系备选优先级低于 & 连接的关系合取。
     */
    private PatternNode parseRelations() {
        List<PatternNode> alternatives = new ArrayList<>();
        alternatives.add(parseRelationConjunction());
        while (current().type() == TokenType.OR && isRelationStart(pos + 1)) {
            advance();
            alternatives.add(parseRelationConjunction());
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new PatternNode.Disjunction(alternatives);
    }

    private PatternNode parseRelationConjunction() {
        List<PatternNode> links = new ArrayList<>();
        links.add(parseRelation());
        while (true) {
            if (current().type() == TokenType.AND && isRelationStart(pos + 1)) {
                advance();
                links.add(parseRelation());
                continue;
            }
            if (isRelationStart(pos)) {
                links.add(parseRelation());
                continue;
            }
            break;
        }
        return links.size() == 1 ? links.get(0) : new PatternNode.Conjunction(links);
    }

    /**
     * 解析单个关系链接，或方括号内的关系组。
     */
    private PatternNode parseRelation() {
        boolean negated = match(TokenType.NOT);
        if (match(TokenType.LBRACKET)) {
            PatternNode grouped = parseRelations();
            expect(TokenType.RBRACKET, "缺少右方括号");
            return negated ? new PatternNode.Negation(grouped) : grouped;
        }

        LexToken operatorToken = advance();
        String operator = operatorToken.value();
        if (RelationTable.isLegacyAlias(operator)) {
            throw new UnsupportedSyntaxException("旧式运算符别名 " + operator, operatorToken.position(), patternString);
        }
        if (RelationTable.lookup(operator).isEmpty()) {
            throw new PatternParseException("未知关系运算符: " + operator, operatorToken.position(), patternString);
        }
        if (!isTermStart(current().type())) {
            throw new PatternParseException("关系运算符 " + operator + " 缺少右侧模式", current().position(), patternString);
        }
        return new PatternNode.RelationLink(operator, negated, parseUnary());
    }

    private LabelMatcher toLabelMatcher(LexToken token) {
        String raw = token.value();
        boolean ignoreCase = raw.startsWith(CASE_INSENSITIVE_PREFIX);
        if (ignoreCase) {
            raw = raw.substring(CASE_INSENSITIVE_PREFIX.length());
        }
        switch (token.type()) {
            case WILDCARD -> {
                return new LabelMatcher.Wildcard();
            }
            case QUOTED -> {
                String text = raw.substring(1, raw.length() - 1)
                        .replace("\\\"", "\"")
                        .replace("\\\\", "\\");
                return new LabelMatcher.Literal(text, ignoreCase);
            }
            case REGEX -> {
                String source = raw.substring(1, raw.length() - 1);
                try {
                    Pattern.compile(source);
                } catch (PatternSyntaxException syntaxException) {
                    throw new PatternParseException("非法正则表达式: " + syntaxException.getDescription(),
                            token.position(), patternString);
                }
                return new LabelMatcher.Regex(source, ignoreCase);
            }
            default -> {
                if ("__".equals(raw)) {
                    return new LabelMatcher.Wildcard();
                }
                return new LabelMatcher.Literal(raw, ignoreCase);
            }
        }
    }

    /**
     * 解析 N(0,1,...) 位置字面量，允许空白与末尾逗号。
     */
    private List<Integer> parsePosition(LexToken token) {
        String raw = token.value();
        String body = raw.substring(2, raw.length() - 1);
        if (!POSITION_BODY.matcher(body).matches()) {
            throw new PatternParseException("非法位置字面量: " + raw, token.position(), patternString);
        }
        List<Integer> position = new ArrayList<>();
        for (String part : body.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                position.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException numberFormatException) {
                throw new PatternParseException("位置下标超出范围: " + trimmed, token.position(), patternString);
            }
        }
        return position;
    }

    /**
     * 判断指定位置是否开始一个关系：运算符、方括号组，或其前带 !。
     */
    private boolean isRelationStart(int index) {
        TokenType type = tokens.get(index).type();
        if (type == TokenType.NOT) {
            type = tokens.get(index + 1).type();
        }
        return type == TokenType.RELATION || type == TokenType.LBRACKET;
    }

    /**
     * 判断当前 token 是否可开始一个节点项。
     */
    private boolean isTermStart(TokenType type) {
        return isLabelToken(type)
                || type == TokenType.POSITION
                || type == TokenType.LPAREN
                || type == TokenType.NOT;
    }

    private boolean isLabelToken(TokenType type) {
        return type == TokenType.LABEL
                || type == TokenType.QUOTED
                || type == TokenType.REGEX
                || type == TokenType.WILDCARD;
    }

    /**
     * 断言当前 token 类型符合预期，否则抛出带位置的语法错误。
     */
    private void expect(TokenType type, String message) {
        if (!match(type)) {
            throw new PatternParseException(message, current().position(), patternString);
        }
    }

    /**
     * 返回当前位置 token。
     */
    private LexToken current() {
        return tokens.get(pos);
    }

    /**
     * 向前查看 offset 个 token，越过末尾时返回 EOF。
     */
    private LexToken peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 消费并返回当前位置 token。
     */
    private LexToken advance() {
        return tokens.get(pos++);
    }

    /**
     * 若当前位置匹配指定类型则消费并返回 true。
     */
    private boolean match(TokenType type) {
        if (current().type() == type) {
            pos++;
            return true;
        }
        return false;
    }
}
