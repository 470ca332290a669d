package com.treegrep.query;

public class PatternParseException extends PatternException {
    private final String suggestion;

    public PatternParseException(String message, int position, String patternString) {
        super("Parse error", message, position, patternString);
        this.suggestion = suggestFix(position, getPatternString());
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String suggestFix(int pos, String pattern) {
        if (pattern.isBlank()) {
            return "请输入非空模式";
        }
        if (pos >= pattern.length() && pattern.chars().filter(ch -> ch == '"').count() % 2 != 0) {
            return "检测到未闭合引号，请补全右引号";
        }
        if (pattern.chars().filter(ch -> ch == '(').count() != pattern.chars().filter(ch -> ch == ')').count()) {
            return "括号数量不匹配，请检查分组";
        }
        return "请检查该位置附近的语法，例如关系运算符、括号或引号";
    }
}
