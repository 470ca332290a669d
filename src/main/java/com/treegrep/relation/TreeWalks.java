package com.treegrep.relation;

import com.treegrep.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiPredicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 树上的惰性遍历原语。所有方法只读取节点，不缓存任何状态。
 */
public final class TreeWalks {
    private TreeWalks() {
    }

    /**
     * 以 start 为根的先序遍历，包含 start 自身。
     */
    public static Stream<TreeNode> preorder(TreeNode start) {
        Spliterator<TreeNode> spliterator = Spliterators.spliteratorUnknownSize(
                new PreorderIterator(start), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * 全部真后代，先序。
     */
    public static Stream<TreeNode> descendants(TreeNode node) {
        return preorder(node).skip(1);
    }

    /**
     * 全部真祖先，由近及远。
     */
    public static Stream<TreeNode> ancestors(TreeNode node) {
        return Stream.iterate(node.parent(), Optional::isPresent, current -> current.get().parent())
                .map(Optional::get);
    }

    /**
     * 沿父链向上，仅当 (子, 父) 满足 step 时继续；不包含 node 自身。
     */
    public static Stream<TreeNode> ancestorsWhile(TreeNode node, BiPredicate<TreeNode, TreeNode> step) {
        return Stream.iterate(Optional.of(node), Optional::isPresent,
                        current -> current.flatMap(child -> child.parent().filter(parent -> step.test(child, parent))))
                .skip(1)
                .map(Optional::get);
    }

    /**
     * 沿“始终取第一个子节点”的路径向下，不包含 node 自身。
     */
    public static Stream<TreeNode> leftmostDescendants(TreeNode node) {
        return Stream.iterate(firstChild(node), Optional::isPresent, current -> firstChild(current.get()))
                .map(Optional::get);
    }

    public static Stream<TreeNode> rightmostDescendants(TreeNode node) {
        return Stream.iterate(lastChild(node), Optional::isPresent, current -> lastChild(current.get()))
                .map(Optional::get);
    }

    /**
     * 单子节点下降路径上的节点。
     */
    public static Stream<TreeNode> uniqueDescendants(TreeNode node) {
        return Stream.iterate(onlyChild(node), Optional::isPresent, current -> onlyChild(current.get()))
                .map(Optional::get);
    }

    /**
     * 经父链找到真正的根；父链在非根处中断（叶子未保留父链接）时返回 empty。
     */
    public static Optional<TreeNode> root(TreeNode node) {
        TreeNode current = node;
        Optional<TreeNode> parent = current.parent();
        while (parent.isPresent()) {
            current = parent.get();
            parent = current.parent();
        }
        return current.treePosition().isEmpty() ? Optional.of(current) : Optional.empty();
    }

    /**
     * 先序中位于 node 之后且不被 node 支配的节点。
     */
    public static Stream<TreeNode> following(TreeNode node) {
        List<Integer> position = node.treePosition();
        return root(node).stream()
                .flatMap(TreeWalks::preorder)
                .filter(candidate -> comparePrefixes(candidate.treePosition(), position) > 0);
    }

    /**
     * 先序中位于 node 之前且不支配 node 的节点。
     */
    public static Stream<TreeNode> preceding(TreeNode node) {
        List<Integer> position = node.treePosition();
        return root(node).stream()
                .flatMap(TreeWalks::preorder)
                .takeWhile(candidate -> !candidate.treePosition().equals(position))
                .filter(candidate -> comparePrefixes(candidate.treePosition(), position) < 0);
    }

    /**
     * 紧随 node 之后的节点及其最左后代：前者的首个终结符紧接 node 的末个终结符。
     */
    public static Stream<TreeNode> immediatelyFollowing(TreeNode node) {
        TreeNode current = node;
        while (true) {
            Optional<TreeNode> parent = current.parent();
            if (parent.isEmpty()) {
                return Stream.empty();
            }
            List<TreeNode> siblings = parent.get().children();
            int index = current.indexInParent();
            if (index < siblings.size() - 1) {
                TreeNode next = siblings.get(index + 1);
                return Stream.concat(Stream.of(next), leftmostDescendants(next));
            }
            current = parent.get();
        }
    }

    public static Stream<TreeNode> immediatelyPreceding(TreeNode node) {
        TreeNode current = node;
        while (true) {
            Optional<TreeNode> parent = current.parent();
            if (parent.isEmpty()) {
                return Stream.empty();
            }
            int index = current.indexInParent();
            if (index > 0) {
                TreeNode previous = parent.get().children().get(index - 1);
                return Stream.concat(Stream.of(previous), rightmostDescendants(previous));
            }
            current = parent.get();
        }
    }

    public static Optional<TreeNode> firstChild(TreeNode node) {
        List<TreeNode> children = node.children();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    public static Optional<TreeNode> lastChild(TreeNode node) {
        List<TreeNode> children = node.children();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
    }

    public static Optional<TreeNode> onlyChild(TreeNode node) {
        List<TreeNode> children = node.children();
        return children.size() == 1 ? Optional.of(children.get(0)) : Optional.empty();
    }

    /**
     * 将 1 起始（负数从末尾计）的子节点序号换算为 0 起始下标，越界返回 -1。
     */
    static int resolveChildIndex(int childCount, int ordinal) {
        int index;
        if (ordinal > 0) {
            index = ordinal - 1;
        } else if (ordinal < 0) {
            index = childCount + ordinal;
        } else {
            return -1;
        }
        return index >= 0 && index < childCount ? index : -1;
    }

    /**
     * 按公共前缀长度比较两个树地址；一方是另一方前缀（支配关系）时返回 0。
     */
    static int comparePrefixes(List<Integer> left, List<Integer> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int compared = Integer.compare(left.get(i), right.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return 0;
    }

    private static final class PreorderIterator implements Iterator<TreeNode> {
        private final Deque<TreeNode> pending = new ArrayDeque<>();

        private PreorderIterator(TreeNode start) {
            pending.push(start);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public TreeNode next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            TreeNode current = pending.pop();
            List<TreeNode> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return current;
        }
    }
}
