package com.treegrep.query;

import com.treegrep.tree.TreeNode;

import java.util.function.Predicate;

/**
 * 编译后的模式：对单个节点判定是否匹配。不持有可变状态，可跨树、跨线程复用。
 */
public final class CompiledPattern implements Predicate<TreeNode> {
    private final String source;
    private final PatternNode ast;
    private final Predicate<TreeNode> predicate;

    CompiledPattern(String source, PatternNode ast, Predicate<TreeNode> predicate) {
        this.source = source;
        this.ast = ast;
        this.predicate = predicate;
    }

    @Override
    public boolean test(TreeNode node) {
        return predicate.test(node);
    }

    /**
     * 原始模式文本；直接由 AST 编译时为 AST 的字符串形式。
     */
    public String source() {
        return source;
    }

    public PatternNode ast() {
        return ast;
    }

    @Override
    public String toString() {
        return "CompiledPattern[" + source + "]";
    }
}
