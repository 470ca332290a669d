package com.treegrep.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基于下标数组的句法树。
 *
 * 节点按先序存放，每个节点记录父节点下标；父链接通过下标解析为 {@link Optional}，
 * 不持有可能为 null 的引用。叶子的父链接是否对外可见由 {@code leafParentLinks} 决定。
 */
public final class ParseTree {
    private final List<String> labels;
    private final int[] parentIndexes;
    private final boolean leafParentLinks;
    private final List<Node> nodes;

    private ParseTree(List<String> labels, List<Integer> parents, boolean leafParentLinks) {
        this.labels = List.copyOf(labels);
        this.leafParentLinks = leafParentLinks;
        this.parentIndexes = new int[parents.size()];
        for (int i = 0; i < parents.size(); i++) {
            parentIndexes[i] = parents.get(i);
        }

        int size = this.labels.size();
        List<List<Integer>> childIndexes = new ArrayList<>(size);
        List<List<Integer>> positions = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            childIndexes.add(new ArrayList<>());
            int parent = parentIndexes[i];
            if (parent < 0) {
                positions.add(List.of());
                continue;
            }
            List<Integer> siblings = childIndexes.get(parent);
            List<Integer> position = new ArrayList<>(positions.get(parent));
            position.add(siblings.size());
            siblings.add(i);
            positions.add(List.copyOf(position));
        }

        List<Node> created = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            created.add(new Node(i, positions.get(i)));
        }
        for (int i = 0; i < size; i++) {
            List<TreeNode> children = new ArrayList<>(childIndexes.get(i).size());
            for (int childIndex : childIndexes.get(i)) {
                children.add(created.get(childIndex));
            }
            created.get(i).children = Collections.unmodifiableList(children);
        }
        this.nodes = Collections.unmodifiableList(created);
    }

    static Builder builder() {
        return new Builder();
    }

    public Node root() {
        return nodes.get(0);
    }

    /**
     * 全部节点，先序排列。
     */
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean hasLeafParentLinks() {
        return leafParentLinks;
    }

    /**
     * 按树地址定位节点，越界时返回 empty。
     */
    public Optional<TreeNode> nodeAt(List<Integer> position) {
        TreeNode current = root();
        for (int childIndex : position) {
            List<TreeNode> children = current.children();
            if (childIndex < 0 || childIndex >= children.size()) {
                return Optional.empty();
            }
            current = children.get(childIndex);
        }
        return Optional.of(current);
    }

    /**
     * 叶子标签序列，即句子的词形。
     */
    public List<String> leaves() {
        List<String> words = new ArrayList<>();
        for (Node node : nodes) {
            if (node.isLeaf()) {
                words.add(node.label());
            }
        }
        return List.copyOf(words);
    }

    public String toBracketedString() {
        return root().toString();
    }

    @Override
    public String toString() {
        return toBracketedString();
    }

    public final class Node implements TreeNode {
        private final int index;
        private final List<Integer> position;
        private List<TreeNode> children;

        private Node(int index, List<Integer> position) {
            this.index = index;
            this.position = position;
        }

        @Override
        public String label() {
            return labels.get(index);
        }

        @Override
        public List<TreeNode> children() {
            return children;
        }

        @Override
        public List<Integer> treePosition() {
            return position;
        }

        @Override
        public Optional<TreeNode> parent() {
            int parentIndex = parentIndexes[index];
            if (parentIndex < 0) {
                return Optional.empty();
            }
            // 叶子默认不回指父节点，与仅以字符串表示叶子的宿主树行为一致
            if (!leafParentLinks && isLeaf()) {
                return Optional.empty();
            }
            return Optional.of(nodes.get(parentIndex));
        }

        public ParseTree tree() {
            return ParseTree.this;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            appendBracketed(this, builder);
            return builder.toString();
        }

        private void appendBracketed(TreeNode node, StringBuilder builder) {
            if (node.isLeaf()) {
                builder.append(node.label());
                return;
            }
            builder.append('(').append(node.label());
            for (TreeNode child : node.children()) {
                builder.append(' ');
                appendBracketed(child, builder);
            }
            builder.append(')');
        }
    }

    /**
     * 按先序追加节点的构建器，供 {@link BracketedTreeReader} 使用。
     */
    static final class Builder {
        private final List<String> labels = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();

        int add(String label, int parentIndex) {
            if (parentIndex >= labels.size()) {
                throw new IllegalArgumentException("父节点下标越界: " + parentIndex);
            }
            if (labels.isEmpty() != (parentIndex < 0)) {
                throw new IllegalArgumentException("只有首个节点可以作为根节点");
            }
            labels.add(label);
            parents.add(parentIndex);
            return labels.size() - 1;
        }

        ParseTree build(boolean leafParentLinks) {
            if (labels.isEmpty()) {
                throw new IllegalStateException("空树无法构建");
            }
            return new ParseTree(labels, parents, leafParentLinks);
        }
    }
}
