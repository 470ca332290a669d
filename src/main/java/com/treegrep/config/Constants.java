package com.treegrep.config;

/**
 * 全局常量定义
 *
 * 包含模式长度上限、搜索默认值与命令行输出参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 模式参数 ====================
    /** 模式字符串最大长度 */
    public static final int MAX_PATTERN_LENGTH = 4096;

    // ==================== 搜索参数 ====================
    /** 默认是否在叶子位置上匹配 */
    public static final boolean DEFAULT_SEARCH_LEAVES = true;
    /** 默认是否为叶子保留父链接 */
    public static final boolean DEFAULT_LEAF_PARENT_LINKS = false;

    // ==================== 输出参数 ====================
    /** 默认输出格式 */
    public static final String DEFAULT_OUTPUT_FORMAT = "text";
}
