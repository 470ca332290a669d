package com.treegrep.relation;

import com.treegrep.tree.TreeNode;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 关系运算符及其候选生成函数。
 */
public record Relation(
        String operator,
        String description,
        Function<TreeNode, Stream<TreeNode>> generator
) {

    /**
     * 与 subject 处于该关系的全部节点，惰性产生；无候选时返回空流。
     */
    public Stream<TreeNode> candidates(TreeNode subject) {
        return generator.apply(subject);
    }
}
