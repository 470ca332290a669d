package com.treegrep.query;

/**
 * 模式编译失败的公共基类，携带出错位置与原始模式文本。
 */
public abstract class PatternException extends RuntimeException {
    private final int position;
    private final String patternString;

    protected PatternException(String kind, String message, int position, String patternString) {
        super(buildMessage(kind, message, position, patternString == null ? "" : patternString));
        this.position = position;
        this.patternString = patternString == null ? "" : patternString;
    }

    public int getPosition() {
        return position;
    }

    public String getPatternString() {
        return patternString;
    }

    private static String buildMessage(String kind, String message, int pos, String pattern) {
        int caretPos = Math.max(0, Math.min(pos, pattern.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return kind + " at position " + pos + ": " + message + System.lineSeparator()
                + pattern + System.lineSeparator() + pointer;
    }
}
