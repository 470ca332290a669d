package com.treegrep.query;

/**
 * 语法可识别但未实现的特性：宏、分段模式、命名节点与回指、链接修饰符、旧式运算符别名。
 */
public class UnsupportedSyntaxException extends PatternException {
    private final String feature;

    public UnsupportedSyntaxException(String feature, int position, String patternString) {
        super("Unsupported syntax", "不支持" + feature, position, patternString);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }
}
