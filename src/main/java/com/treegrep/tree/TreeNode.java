package com.treegrep.tree;

import java.util.List;
import java.util.Optional;

/**
 * 查询引擎所需的只读树节点视图。
 *
 * 宿主树可自行实现；叶子节点允许不提供父节点引用，此时向上、兄弟与线性先后关系
 * 返回空候选集而不是失败。
 */
public interface TreeNode {

    /**
     * 节点标签；叶子节点即为词形本身。
     */
    String label();

    /**
     * 有序子节点列表，叶子节点返回空列表。
     */
    List<TreeNode> children();

    /**
     * 从根出发的子节点下标序列，根节点为空列表。
     */
    List<Integer> treePosition();

    /**
     * 父节点；根节点或未保留父链接的叶子返回 empty。
     */
    Optional<TreeNode> parent();

    default boolean isLeaf() {
        return children().isEmpty();
    }

    /**
     * 节点在父节点中的下标，根节点返回 -1。
     */
    default int indexInParent() {
        List<Integer> position = treePosition();
        return position.isEmpty() ? -1 : position.get(position.size() - 1);
    }
}
