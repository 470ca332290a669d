package com.treegrep.tree;

import com.treegrep.config.TGrepConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 读取括号表示法的句法树，例如 {@code (S (NP (DT the) (NN dog)) (VP barked))}。
 */
public class BracketedTreeReader {
    private final boolean leafParentLinks;

    /**
     * 使用默认配置：叶子不保留父链接。
     */
    public BracketedTreeReader() {
        this(false);
    }

    public BracketedTreeReader(TGrepConfig config) {
        this(config.isLeafParentLinks());
    }

    public BracketedTreeReader(boolean leafParentLinks) {
        this.leafParentLinks = leafParentLinks;
    }

    /**
     * 解析恰好包含一棵树的文本。
     */
    public ParseTree read(String text) {
        List<ParseTree> trees = readAll(text);
        if (trees.size() != 1) {
            throw new TreeParseException("期望恰好一棵树，实际为 " + trees.size(), 0);
        }
        return trees.get(0);
    }

    /**
     * 从字符流读取全部树，适用于一个文件包含多棵树的树库。
     */
    public List<ParseTree> readAll(Reader reader) throws IOException {
        StringBuilder content = new StringBuilder();
        try (BufferedReader bufferedReader = new BufferedReader(reader)) {
            char[] buffer = new char[8192];
            int read;
            while ((read = bufferedReader.read(buffer)) != -1) {
                content.append(buffer, 0, read);
            }
        }
        return readAll(content.toString());
    }

    /**
     * 依次解析文本中的所有顶层树。
     */
    public List<ParseTree> readAll(String text) {
        if (text == null) {
            throw new TreeParseException("树文本不能为空", 0);
        }

        List<ParseTree> trees = new ArrayList<>();
        Deque<Integer> openNodes = new ArrayDeque<>();
        ParseTree.Builder builder = null;
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '(') {
                if (builder == null) {
                    builder = ParseTree.builder();
                }
                index = skipWhitespace(text, index + 1);
                int labelEnd = readWord(text, index);
                String label = text.substring(index, labelEnd);
                int parent = openNodes.isEmpty() ? -1 : openNodes.peek();
                openNodes.push(builder.add(label, parent));
                index = labelEnd;
                continue;
            }

            if (currentChar == ')') {
                if (openNodes.isEmpty()) {
                    throw new TreeParseException("多余的右括号", index);
                }
                openNodes.pop();
                index++;
                if (openNodes.isEmpty()) {
                    trees.add(builder.build(leafParentLinks));
                    builder = null;
                }
                continue;
            }

            int wordEnd = readWord(text, index);
            if (openNodes.isEmpty()) {
                throw new TreeParseException("叶子必须位于括号之内: " + text.substring(index, wordEnd), index);
            }
            builder.add(text.substring(index, wordEnd), openNodes.peek());
            index = wordEnd;
        }

        if (!openNodes.isEmpty()) {
            throw new TreeParseException("缺少 " + openNodes.size() + " 个右括号", text.length());
        }
        return List.copyOf(trees);
    }

    private int skipWhitespace(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private int readWord(String text, int index) {
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (Character.isWhitespace(currentChar) || currentChar == '(' || currentChar == ')') {
                break;
            }
            index++;
        }
        return index;
    }
}
