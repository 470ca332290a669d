package com.treegrep.search;

import com.treegrep.config.TGrepConfig;
import com.treegrep.query.CompiledPattern;
import com.treegrep.query.LexToken;
import com.treegrep.query.PatternCompiler;
import com.treegrep.query.PatternLexer;
import com.treegrep.query.PatternNode;
import com.treegrep.query.PatternParseException;
import com.treegrep.query.PatternParser;
import com.treegrep.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 模式查询入口：解析、编译并在树上搜索。
 */
public class TGrepEngine {
    private static final Logger logger = LoggerFactory.getLogger(TGrepEngine.class);

    private final TGrepConfig config;
    private final PatternCompiler compiler;
    private final TreeSearcher searcher;

    /**
     * 使用默认配置构造查询引擎。
     */
    public TGrepEngine() {
        this(TGrepConfig.defaults());
    }

    public TGrepEngine(TGrepConfig config) {
        this.config = config;
        this.compiler = new PatternCompiler();
        this.searcher = new TreeSearcher(config);
    }

    public List<LexToken> tokenize(String pattern) {
        return new PatternLexer().tokenize(checkLength(pattern));
    }

    public PatternNode parse(String pattern) {
        return new PatternParser().parse(checkLength(pattern));
    }

    /**
     * 编译模式；语法错误与不支持的语法在此同步抛出，不返回部分结果。
     */
    public CompiledPattern compile(String pattern) {
        CompiledPattern compiled = compiler.compile(checkLength(pattern));
        logger.debug("模式已编译: {} -> {}", pattern, compiled.ast());
        return compiled;
    }

    /**
     * 返回树中匹配模式的全部节点，先序排列。
     */
    public List<TreeNode> searchNodes(TreeNode tree, String pattern) {
        return searcher.searchNodes(tree, compile(pattern));
    }

    /**
     * 与 {@link #searchNodes} 语义相同，返回匹配节点的树地址。
     */
    public List<List<Integer>> searchPositions(TreeNode tree, String pattern) {
        return searcher.searchPositions(tree, compile(pattern));
    }

    /**
     * 在多棵树上搜索，模式只编译一次。
     */
    public SearchResult search(List<? extends TreeNode> trees, String pattern) {
        long startNanos = System.nanoTime();
        CompiledPattern compiled = compile(pattern);

        List<SearchHit> hits = new ArrayList<>();
        for (int treeIndex = 0; treeIndex < trees.size(); treeIndex++) {
            for (TreeNode match : searcher.searchNodes(trees.get(treeIndex), compiled)) {
                hits.add(new SearchHit(treeIndex, match.treePosition(), match.label(), match.toString()));
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("搜索完成: pattern={}, trees={}, matches={}, {}ms", pattern, trees.size(), hits.size(), elapsedMs);
        return new SearchResult(List.copyOf(hits), hits.size(), trees.size(), elapsedMs, pattern);
    }

    public TGrepConfig getConfig() {
        return config;
    }

    private String checkLength(String pattern) {
        if (pattern != null && pattern.length() > config.getMaxPatternLength()) {
            throw new PatternParseException("模式长度超过限制（最大 " + config.getMaxPatternLength() + " 字符）",
                    config.getMaxPatternLength(), pattern);
        }
        return pattern;
    }
}
