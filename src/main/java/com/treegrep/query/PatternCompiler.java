package com.treegrep.query;

import com.treegrep.relation.Relation;
import com.treegrep.relation.RelationTable;
import com.treegrep.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 将模式 AST 编译为节点谓词。
 *
 * 关系链接编译为对候选流的存在量化（取反时为全称否定），候选按需产生，首个成功即短路。
 */
public class PatternCompiler {

    /**
     * 解析并编译模式字符串。
     */
    public CompiledPattern compile(String pattern) {
        PatternNode ast = new PatternParser().parse(pattern);
        return new CompiledPattern(pattern, ast, compileNode(ast));
    }

    /**
     * 编译已构建的 AST。
     */
    public CompiledPattern compile(PatternNode ast) {
        return new CompiledPattern(ast.toString(), ast, compileNode(ast));
    }

    private Predicate<TreeNode> compileNode(PatternNode node) {
        if (node instanceof PatternNode.LabelTest labelTest) {
            Predicate<String> labelPredicate = compileLabel(labelTest.matcher());
            return treeNode -> labelPredicate.test(treeNode.label());
        }
        if (node instanceof PatternNode.PositionTest positionTest) {
            List<Integer> position = positionTest.position();
            return treeNode -> treeNode.treePosition().equals(position);
        }
        if (node instanceof PatternNode.Negation negation) {
            return compileNode(negation.inner()).negate();
        }
        if (node instanceof PatternNode.Conjunction conjunction) {
            List<Predicate<TreeNode>> operands = compileAll(conjunction.operands());
            return treeNode -> {
                for (Predicate<TreeNode> operand : operands) {
                    if (!operand.test(treeNode)) {
                        return false;
                    }
                }
                return true;
            };
        }
        if (node instanceof PatternNode.Disjunction disjunction) {
            List<Predicate<TreeNode>> operands = compileAll(disjunction.operands());
            return treeNode -> {
                for (Predicate<TreeNode> operand : operands) {
                    if (operand.test(treeNode)) {
                        return true;
                    }
                }
                return false;
            };
        }
        if (node instanceof PatternNode.RelationLink link) {
            return compileRelation(link);
        }
        throw new IllegalArgumentException("未知模式节点: " + node);
    }

    private List<Predicate<TreeNode>> compileAll(List<PatternNode> nodes) {
        List<Predicate<TreeNode>> compiled = new ArrayList<>(nodes.size());
        for (PatternNode operand : nodes) {
            compiled.add(compileNode(operand));
        }
        return List.copyOf(compiled);
    }

    private Predicate<TreeNode> compileRelation(PatternNode.RelationLink link) {
        String operator = link.operator();
        if (RelationTable.isLegacyAlias(operator)) {
            throw new UnsupportedSyntaxException("旧式运算符别名 " + operator, 0, operator);
        }
        Relation relation = RelationTable.lookup(operator)
                .orElseThrow(() -> new PatternParseException("未知关系运算符: " + operator, 0, operator));
        Predicate<TreeNode> right = compileNode(link.right());
        if (link.negated()) {
            return treeNode -> relation.candidates(treeNode).noneMatch(right);
        }
        return treeNode -> relation.candidates(treeNode).anyMatch(right);
    }

    private Predicate<String> compileLabel(LabelMatcher matcher) {
        if (matcher instanceof LabelMatcher.Wildcard) {
            return label -> true;
        }
        if (matcher instanceof LabelMatcher.Literal literal) {
            String text = literal.text();
            return literal.ignoreCase() ? text::equalsIgnoreCase : text::equals;
        }
        if (matcher instanceof LabelMatcher.Regex regex) {
            Pattern compiled = compileRegex(regex);
            return label -> compiled.matcher(label).find();
        }
        if (matcher instanceof LabelMatcher.AnyOf anyOf) {
            List<Predicate<String>> alternatives = new ArrayList<>();
            for (LabelMatcher alternative : anyOf.alternatives()) {
                alternatives.add(compileLabel(alternative));
            }
            return label -> alternatives.stream().anyMatch(alternative -> alternative.test(label));
        }
        throw new IllegalArgumentException("未知标签匹配规则: " + matcher);
    }

    private Pattern compileRegex(LabelMatcher.Regex regex) {
        int flags = regex.ignoreCase() ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
        try {
            return Pattern.compile(regex.source(), flags);
        } catch (PatternSyntaxException syntaxException) {
            throw new PatternParseException("非法正则表达式: " + syntaxException.getDescription(),
                    Math.max(syntaxException.getIndex(), 0), regex.source());
        }
    }
}
