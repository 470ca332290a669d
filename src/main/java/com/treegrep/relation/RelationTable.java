package com.treegrep.relation;

import com.treegrep.tree.TreeNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 固定的关系运算符注册表。
 *
 * 左侧节点 X 调用生成函数，返回待与右侧模式比对的候选节点 Y。
 * 带序号的 {@code <N}、{@code >N}、{@code <-N}、{@code >-N} 按需构造。
 */
public final class RelationTable {
    private static final Pattern CHILD_ORDINAL_OPERATOR = Pattern.compile("([<>])(-?\\d+)");

    private static final Map<String, Relation> RELATIONS;

    static {
        Map<String, Relation> relations = new LinkedHashMap<>();
        register(relations, "X 直接支配 Y（Y 是子节点）", node -> node.children().stream(), "<");
        register(relations, "Y 是 X 的父节点", node -> node.parent().stream(), ">");
        register(relations, "Y 是 X 的第一个子节点", node -> TreeWalks.firstChild(node).stream(), "<,");
        register(relations, "X 是 Y 的第一个子节点", node -> parentIfOrdinal(node, 1), ">,");
        register(relations, "Y 是 X 的最后一个子节点", node -> TreeWalks.lastChild(node).stream(),
                "<-,", "<-", "<'");
        register(relations, "X 是 Y 的最后一个子节点", node -> parentIfOrdinal(node, -1),
                ">-,", ">-", ">'");
        register(relations, "Y 是 X 的唯一子节点", node -> TreeWalks.onlyChild(node).stream(), "<:");
        register(relations, "X 是 Y 的唯一子节点",
                node -> node.parent().filter(parent -> parent.children().size() == 1).stream(), ">:");
        register(relations, "X 支配 Y", TreeWalks::descendants, "<<");
        register(relations, "Y 支配 X", TreeWalks::ancestors, ">>");
        register(relations, "Y 是 X 的最左后代", TreeWalks::leftmostDescendants, "<<,", "<<1");
        register(relations, "X 是 Y 的最左后代",
                node -> TreeWalks.ancestorsWhile(node, (child, parent) -> child.indexInParent() == 0), ">>,");
        register(relations, "Y 是 X 的最右后代", TreeWalks::rightmostDescendants, "<<'");
        register(relations, "X 是 Y 的最右后代",
                node -> TreeWalks.ancestorsWhile(node, RelationTable::isLastChild), ">>'");
        register(relations, "Y 位于 X 的单一下降路径上", TreeWalks::uniqueDescendants, "<<:");
        register(relations, "X 位于 Y 的单一下降路径上",
                node -> TreeWalks.ancestorsWhile(node, (child, parent) -> parent.children().size() == 1), ">>:");
        register(relations, "X 紧邻地位于 Y 之前", TreeWalks::immediatelyFollowing, ".");
        register(relations, "X 紧邻地位于 Y 之后", TreeWalks::immediatelyPreceding, ",");
        register(relations, "X 位于 Y 之前", TreeWalks::following, "..");
        register(relations, "X 位于 Y 之后", TreeWalks::preceding, ",,");
        register(relations, "X 与 Y 是姊妹节点", RelationTable::siblings, "$");
        register(relations, "X 是 Y 的左邻姊妹", node -> siblingAt(node, 1), "$.");
        register(relations, "X 是 Y 的右邻姊妹", node -> siblingAt(node, -1), "$,");
        register(relations, "X 是 Y 左侧的姊妹", node -> siblingRange(node, true), "$..");
        register(relations, "X 是 Y 右侧的姊妹", node -> siblingRange(node, false), "$,,");
        RELATIONS = Collections.unmodifiableMap(relations);
    }

    private RelationTable() {
    }

    /**
     * 查找运算符；未知运算符返回 empty。
     */
    public static Optional<Relation> lookup(String operator) {
        Relation relation = RELATIONS.get(operator);
        if (relation != null) {
            return Optional.of(relation);
        }
        Matcher ordinalMatcher = CHILD_ORDINAL_OPERATOR.matcher(operator);
        if (!ordinalMatcher.matches()) {
            return Optional.empty();
        }
        int ordinal;
        try {
            ordinal = Integer.parseInt(ordinalMatcher.group(2));
        } catch (NumberFormatException numberFormatException) {
            return Optional.empty();
        }
        if ("<".equals(ordinalMatcher.group(1))) {
            return Optional.of(new Relation(operator, "Y 是 X 的第 " + ordinal + " 个子节点",
                    node -> childAt(node, ordinal)));
        }
        return Optional.of(new Relation(operator, "X 是 Y 的第 " + ordinal + " 个子节点",
                node -> parentIfOrdinal(node, ordinal)));
    }

    /**
     * 注册表中的固定运算符，不含按序号构造的形式。
     */
    public static Set<String> operators() {
        return RELATIONS.keySet();
    }

    /**
     * 以 % 表示姊妹关系的旧式单字符别名。
     */
    public static boolean isLegacyAlias(String operator) {
        return operator.indexOf('%') >= 0;
    }

    private static void register(Map<String, Relation> relations, String description,
                                 Function<TreeNode, Stream<TreeNode>> generator, String... operators) {
        for (String operator : operators) {
            relations.put(operator, new Relation(operator, description, generator));
        }
    }

    private static Stream<TreeNode> childAt(TreeNode node, int ordinal) {
        List<TreeNode> children = node.children();
        int index = TreeWalks.resolveChildIndex(children.size(), ordinal);
        return index < 0 ? Stream.empty() : Stream.of(children.get(index));
    }

    private static Stream<TreeNode> parentIfOrdinal(TreeNode node, int ordinal) {
        return node.parent()
                .filter(parent -> TreeWalks.resolveChildIndex(parent.children().size(), ordinal) == node.indexInParent())
                .stream();
    }

    private static boolean isLastChild(TreeNode child, TreeNode parent) {
        return child.indexInParent() == parent.children().size() - 1;
    }

    private static Stream<TreeNode> siblings(TreeNode node) {
        int index = node.indexInParent();
        return node.parent().stream().flatMap(parent -> {
            List<TreeNode> children = parent.children();
            return IntStream.range(0, children.size())
                    .filter(i -> i != index)
                    .mapToObj(children::get);
        });
    }

    private static Stream<TreeNode> siblingAt(TreeNode node, int offset) {
        int target = node.indexInParent() + offset;
        return node.parent().stream()
                .filter(parent -> target >= 0 && target < parent.children().size())
                .map(parent -> parent.children().get(target));
    }

    private static Stream<TreeNode> siblingRange(TreeNode node, boolean toTheRight) {
        int index = node.indexInParent();
        return node.parent().stream().flatMap(parent -> {
            List<TreeNode> children = parent.children();
            return toTheRight
                    ? children.subList(index + 1, children.size()).stream()
                    : children.subList(0, index).stream();
        });
    }
}
