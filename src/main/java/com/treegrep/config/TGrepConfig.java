package com.treegrep.config;

/**
 * 查询运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class TGrepConfig {
    private boolean searchLeaves = Constants.DEFAULT_SEARCH_LEAVES;
    private boolean leafParentLinks = Constants.DEFAULT_LEAF_PARENT_LINKS;
    private int maxPatternLength = Constants.MAX_PATTERN_LENGTH;

    public boolean isSearchLeaves() {
        return searchLeaves;
    }

    public void setSearchLeaves(boolean searchLeaves) {
        this.searchLeaves = searchLeaves;
    }

    public boolean isLeafParentLinks() {
        return leafParentLinks;
    }

    public void setLeafParentLinks(boolean leafParentLinks) {
        this.leafParentLinks = leafParentLinks;
    }

    public int getMaxPatternLength() {
        return maxPatternLength;
    }

    public void setMaxPatternLength(int maxPatternLength) {
        this.maxPatternLength = maxPatternLength;
    }

    /**
     * 使用默认配置创建实例
     */
    public static TGrepConfig defaults() {
        return new TGrepConfig();
    }
}
