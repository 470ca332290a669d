package com.treegrep.query;

import java.util.List;

/**
 * 节点标签的匹配规则。
 */
public sealed interface LabelMatcher permits LabelMatcher.Wildcard, LabelMatcher.Literal,
        LabelMatcher.Regex, LabelMatcher.AnyOf {

    /** 通配符 {@code *}，匹配任意标签 */
    record Wildcard() implements LabelMatcher {
    }

    record Literal(String text, boolean ignoreCase) implements LabelMatcher {
    }

    /** 正则在标签中查找（非整串匹配） */
    record Regex(String source, boolean ignoreCase) implements LabelMatcher {
    }

    record AnyOf(List<LabelMatcher> alternatives) implements LabelMatcher {
        public AnyOf {
            alternatives = List.copyOf(alternatives);
        }
    }
}
