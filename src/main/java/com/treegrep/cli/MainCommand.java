package com.treegrep.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treegrep.config.Constants;
import com.treegrep.config.TGrepConfig;
import com.treegrep.query.LexToken;
import com.treegrep.query.PatternException;
import com.treegrep.relation.Relation;
import com.treegrep.relation.RelationTable;
import com.treegrep.search.SearchHit;
import com.treegrep.search.SearchResult;
import com.treegrep.search.TGrepEngine;
import com.treegrep.tree.BracketedTreeReader;
import com.treegrep.tree.ParseTree;
import com.treegrep.tree.TreeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "tgrep",
    description = "🌳 在括号表示的句法树中按 TGrep2 模式查找节点",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.TokensSubcommand.class,
        MainCommand.OperatorsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--link-leaves"}, description = "为叶子保留父链接，使向上关系对叶子生效")
    private boolean linkLeaves;

    @Option(names = {"--max-pattern-length"}, description = "模式最大长度",
            defaultValue = "" + Constants.MAX_PATTERN_LENGTH)
    private int maxPatternLength = Constants.MAX_PATTERN_LENGTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🌳 TGrep2 风格的句法树查询工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    TGrepConfig buildConfig(boolean searchLeaves) {
        TGrepConfig config = TGrepConfig.defaults();
        config.setLeafParentLinks(linkLeaves);
        config.setSearchLeaves(searchLeaves);
        if (maxPatternLength <= 0) {
            System.err.printf("⚠️ 非法模式长度上限 %d，已回退为默认值 %d%n", maxPatternLength, Constants.MAX_PATTERN_LENGTH);
        } else {
            config.setMaxPatternLength(maxPatternLength);
        }
        return config;
    }

    static String formatPosition(List<Integer> position) {
        if (position.size() == 1) {
            return "(" + position.get(0) + ",)";
        }
        return position.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }

    @Command(name = "search", description = "🔎 在树库中执行模式查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "TGrep2 模式")
        private String pattern;

        @Parameters(index = "1..*", arity = "0..*", description = "树库文件（缺省读取标准输入）")
        private List<Path> files;

        @Option(names = {"-p", "--positions"}, description = "输出树地址而不是子树")
        private boolean positions;

        @Option(names = {"--no-leaves"}, description = "不在叶子位置上匹配")
        private boolean noLeaves;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)",
                defaultValue = Constants.DEFAULT_OUTPUT_FORMAT)
        private String format = Constants.DEFAULT_OUTPUT_FORMAT;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            TGrepConfig config = main.buildConfig(!noLeaves);
            try {
                List<ParseTree> trees = readTrees(new BracketedTreeReader(config));
                List<ParseTree.Node> roots = trees.stream().map(ParseTree::root).toList();
                SearchResult result = new TGrepEngine(config).search(roots, pattern);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }
                return 0;
            } catch (PatternException patternException) {
                System.err.println("❌ 模式错误: " + patternException.getMessage());
                return 1;
            } catch (TreeParseException | IOException exception) {
                System.err.println("❌ 读取树库失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<ParseTree> readTrees(BracketedTreeReader reader) throws IOException {
            if (files == null || files.isEmpty()) {
                return reader.readAll(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            }
            List<ParseTree> trees = new ArrayList<>();
            for (Path file : files) {
                if (!Files.isReadable(file)) {
                    logger.warn("跳过不可读的树库文件: {}", file);
                    continue;
                }
                try (Reader fileReader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    trees.addAll(reader.readAll(fileReader));
                }
            }
            return trees;
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配节点");
                return;
            }
            for (SearchHit hit : result.hits()) {
                if (positions) {
                    System.out.println(hit.treeIndex() + "\t" + formatPosition(hit.position()));
                } else {
                    System.out.println(hit.text());
                }
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "tokens", description = "🔤 输出模式的词法切分结果")
    static class TokensSubcommand implements Callable<Integer> {

        @Parameters(description = "TGrep2 模式", arity = "1")
        private String pattern;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                List<LexToken> tokens = new TGrepEngine(main.buildConfig(true)).tokenize(pattern);
                for (LexToken token : tokens) {
                    System.out.printf("%-3d %-9s %s%n", token.position(), token.type(), token.value());
                }
                return 0;
            } catch (PatternException patternException) {
                System.err.println("❌ 模式错误: " + patternException.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "operators", description = "📖 列出支持的关系运算符")
    static class OperatorsSubcommand implements Callable<Integer> {

        @Override
        public Integer call() {
            for (String operator : RelationTable.operators()) {
                Relation relation = RelationTable.lookup(operator).orElseThrow();
                System.out.printf("%-4s %s%n", operator, relation.description());
            }
            System.out.printf("%-4s %s%n", "<N", "Y 是 X 的第 N 个子节点（负数从末尾计）");
            System.out.printf("%-4s %s%n", ">N", "X 是 Y 的第 N 个子节点（负数从末尾计）");
            return 0;
        }
    }
}
