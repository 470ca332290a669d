package com.treegrep.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.treegrep.tree.BracketedTreeReader;
import com.treegrep.tree.ParseTree;
import com.treegrep.tree.TreeNode;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class PatternCompilerTest {
    private static final String SENTENCE = "(S (NP (DT the) (JJ big) (NN dog)) (VP bit) (NP (DT a) (NN cat)))";

    private final PatternCompiler compiler = new PatternCompiler();
    private final ParseTree tree = new BracketedTreeReader().read(SENTENCE);

    static Stream<Arguments> relationCases() {
        return Stream.of(
                Arguments.of("NN", List.of(List.of(0, 2), List.of(2, 1))),
                Arguments.of("DT $ JJ", List.of(List.of(0, 0))),
                Arguments.of("NP < NN", List.of(List.of(0), List.of(2))),
                Arguments.of("S << DT", List.of(List.of())),
                Arguments.of("DT >> S", List.of(List.of(0, 0), List.of(2, 0))),
                Arguments.of("NP . VP", List.of(List.of(0))),
                Arguments.of("NN . VP", List.of(List.of(0, 2))),
                Arguments.of("VP , NP", List.of(List.of(1))),
                Arguments.of("DT , VP", List.of(List.of(2, 0))),
                Arguments.of("JJ .. NN", List.of(List.of(0, 1))),
                Arguments.of("NN .. JJ", List.of()),
                Arguments.of("NN ,, JJ", List.of(List.of(0, 2), List.of(2, 1))),
                Arguments.of("DT $. JJ", List.of(List.of(0, 0))),
                Arguments.of("JJ $, DT", List.of(List.of(0, 1))),
                Arguments.of("DT $.. NN", List.of(List.of(0, 0), List.of(2, 0))),
                Arguments.of("NN $,, JJ", List.of(List.of(0, 2))),
                Arguments.of("NP <2 JJ", List.of(List.of(0))),
                Arguments.of("NP <-2 DT", List.of(List.of(2))),
                Arguments.of("NP <, DT", List.of(List.of(0), List.of(2))),
                Arguments.of("NP <' NN", List.of(List.of(0), List.of(2))),
                Arguments.of("JJ >2 NP", List.of(List.of(0, 1))),
                Arguments.of("DT >, NP", List.of(List.of(0, 0), List.of(2, 0))),
                Arguments.of("NP >- S", List.of(List.of(2))),
                Arguments.of("VP <: bit", List.of(List.of(1))),
                Arguments.of("VP >: S", List.of()),
                Arguments.of("S <<, DT", List.of(List.of())),
                Arguments.of("NP <<, the", List.of(List.of(0))),
                Arguments.of("S <<' cat", List.of(List.of())),
                Arguments.of("DT >>, S", List.of(List.of(0, 0))),
                Arguments.of("NN >>' S", List.of(List.of(2, 1))),
                Arguments.of("VP <<: bit", List.of(List.of(1))),
                Arguments.of("NP !< JJ", List.of(List.of(2))),
                Arguments.of("NP < JJ | < VP", List.of(List.of(0))),
                Arguments.of("NP < DT & < JJ", List.of(List.of(0))),
                Arguments.of("NP [< JJ | < VP] < NN", List.of(List.of(0))),
                Arguments.of("NP ![< JJ | < VP]", List.of(List.of(2))),
                Arguments.of("S < (NP < JJ)", List.of(List.of())),
                Arguments.of("S < (NP < VP)", List.of()),
                Arguments.of("S < NP < VP", List.of(List.of())),
                Arguments.of("NP|VP < DT", List.of(List.of(0), List.of(2))),
                Arguments.of("(NP < JJ) | (VP)", List.of(List.of(0), List.of(1))),
                Arguments.of("!NP < DT", List.of()),
                Arguments.of("N(0,2)", List.of(List.of(0, 2))),
                Arguments.of("N()", List.of(List.of())),
                Arguments.of("N(0,) < JJ", List.of(List.of(0))),
                Arguments.of("N(5)", List.of())
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("relationCases")
    @DisplayName("关系运算符语义")
    void testRelationSemantics(String pattern, List<List<Integer>> expected) {
        assertEquals(expected, positions(pattern));
    }

    @Test
    @DisplayName("标签匹配：字面量、析取、正则查找与大小写不敏感")
    void testLabelMatching() {
        assertEquals(List.of(List.of(0, 0), List.of(0, 1), List.of(2, 0)), positions("DT|JJ"));
        assertEquals(List.of(List.of(0), List.of(0, 2), List.of(2), List.of(2, 1)), positions("/^N/"));
        assertEquals(List.of(List.of(2, 0, 0), List.of(2, 1, 0)), positions("/a/"));
        assertEquals(List.of(List.of(0), List.of(2)), positions("i@np"));
        assertEquals(List.of(List.of(0, 2, 0)), positions("i@\"DOG\""));
        assertEquals(List.of(List.of(2, 0, 0)), positions("\"a\""));
        assertEquals(List.of(), positions("np"));
    }

    @Test
    void testWildcardAndNegationCounts() {
        assertEquals(15, positions("*").size());
        assertEquals(6, positions("* <: *").size());
        assertEquals(6, positions("* !< *").size());
        assertEquals(14, positions("!N()").size());
    }

    @Test
    @DisplayName("未保留父链接时叶子不被视为有祖先")
    void testLeafWithoutParentLink() {
        ParseTree small = new BracketedTreeReader().read("(S (A x))");
        CompiledPattern pattern = compiler.compile("* !>> S");

        List<List<Integer>> matches = small.nodes().stream()
                .filter(pattern)
                .map(TreeNode::treePosition)
                .toList();

        assertEquals(List.of(List.of(), List.of(0, 0)), matches);
    }

    @Test
    void testLeafPrecedenceNeedsParentLinks() {
        ParseTree linked = new BracketedTreeReader(true).read(SENTENCE);
        CompiledPattern pattern = compiler.compile("dog . bit");

        assertTrue(pattern.test(linked.nodeAt(List.of(0, 2, 0)).orElseThrow()));
        assertFalse(pattern.test(tree.nodeAt(List.of(0, 2, 0)).orElseThrow()));
    }

    @Test
    @DisplayName("编译结果可在多棵树上复用")
    void testCompiledPatternIsReusable() {
        CompiledPattern pattern = compiler.compile("NP < DT");
        ParseTree other = new BracketedTreeReader().read("(S (NP (DT every) (NN cat)) (VP slept))");

        assertEquals(2, tree.nodes().stream().filter(pattern).count());
        assertEquals(1, other.nodes().stream().filter(pattern).count());
        assertEquals(2, tree.nodes().stream().filter(pattern).count());
        assertEquals("NP < DT", pattern.source());
    }

    @Test
    void testCompileFromAst() {
        PatternNode ast = new PatternNode.Conjunction(List.of(
                new PatternNode.LabelTest(new LabelMatcher.Literal("NP", false)),
                new PatternNode.RelationLink("<", false,
                        new PatternNode.LabelTest(new LabelMatcher.Literal("JJ", false)))));

        CompiledPattern pattern = compiler.compile(ast);

        assertEquals(ast, pattern.ast());
        assertEquals(List.of(List.of(0)), tree.nodes().stream()
                .filter(pattern)
                .map(TreeNode::treePosition)
                .toList());
    }

    @Test
    void testCompileAstWithBadOperators() {
        PatternNode leaf = new PatternNode.LabelTest(new LabelMatcher.Wildcard());

        assertThrows(UnsupportedSyntaxException.class, () -> compiler.compile(new PatternNode.Conjunction(List.of(
                leaf, new PatternNode.RelationLink("%", false, leaf)))));
        assertThrows(PatternParseException.class, () -> compiler.compile(new PatternNode.Conjunction(List.of(
                leaf, new PatternNode.RelationLink("<<<", false, leaf)))));
        assertThrows(PatternParseException.class, () -> compiler.compile(
                new PatternNode.LabelTest(new LabelMatcher.Regex("(", false))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"NP=x < DT", "NP < ~x", "NP : VP", "NP ; VP", "@NP", "NP % VP", "NP ?< VP", "NP %. VP"})
    @DisplayName("命名节点、回指、宏等语法明确拒绝")
    void testUnsupportedSyntax(String pattern) {
        assertThrows(UnsupportedSyntaxException.class, () -> compiler.compile(pattern));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "NP <", "NP)", "(NP", "< NP", "NP <<< VP", "\"open", "/open", "/(/"})
    void testSyntaxErrors(String pattern) {
        assertThrows(PatternParseException.class, () -> compiler.compile(pattern));
    }

    private List<List<Integer>> positions(String pattern) {
        CompiledPattern compiled = compiler.compile(pattern);
        return tree.nodes().stream()
                .filter(compiled)
                .map(TreeNode::treePosition)
                .toList();
    }
}
