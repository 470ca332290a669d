package com.treegrep.query;

/**
 * 模式词法单元；value 保留原始文本（含引号、斜杠与 i@ 前缀）。
 */
public record LexToken(TokenType type, String value, int position) {
}
