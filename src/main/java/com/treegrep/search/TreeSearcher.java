package com.treegrep.search;

import com.treegrep.config.TGrepConfig;
import com.treegrep.relation.TreeWalks;
import com.treegrep.tree.TreeNode;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 先序遍历目标树，对每个节点应用编译后的模式。
 */
public class TreeSearcher {
    private final boolean searchLeaves;

    public TreeSearcher() {
        this(TGrepConfig.defaults());
    }

    public TreeSearcher(TGrepConfig config) {
        this.searchLeaves = config.isSearchLeaves();
    }

    /**
     * 惰性产生匹配节点，调用方可提前停止消费。
     */
    public Stream<TreeNode> stream(TreeNode root, Predicate<? super TreeNode> pattern) {
        Stream<TreeNode> candidates = TreeWalks.preorder(root);
        if (!searchLeaves) {
            candidates = candidates.filter(node -> !node.isLeaf());
        }
        return candidates.filter(pattern);
    }

    public List<TreeNode> searchNodes(TreeNode root, Predicate<? super TreeNode> pattern) {
        return stream(root, pattern).toList();
    }

    public List<List<Integer>> searchPositions(TreeNode root, Predicate<? super TreeNode> pattern) {
        return stream(root, pattern).map(TreeNode::treePosition).toList();
    }
}
