package com.treegrep.query;

import java.util.List;

public sealed interface PatternNode permits PatternNode.LabelTest, PatternNode.PositionTest,
        PatternNode.Negation, PatternNode.Conjunction, PatternNode.Disjunction,
        PatternNode.RelationLink {

    record LabelTest(LabelMatcher matcher) implements PatternNode {
    }

    /** 树地址精确相等 */
    record PositionTest(List<Integer> position) implements PatternNode {
        public PositionTest {
            position = List.copyOf(position);
        }
    }

    record Negation(PatternNode inner) implements PatternNode {
    }

    record Conjunction(List<PatternNode> operands) implements PatternNode {
        public Conjunction {
            operands = List.copyOf(operands);
        }
    }

    record Disjunction(List<PatternNode> operands) implements PatternNode {
        public Disjunction {
            operands = List.copyOf(operands);
        }
    }

    /**
     * 以关系限定左侧节点：存在（取反时为不存在）满足 right 的候选节点。
     */
    record RelationLink(String operator, boolean negated, PatternNode right) implements PatternNode {
    }
}
