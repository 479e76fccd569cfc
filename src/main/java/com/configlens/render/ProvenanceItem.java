package com.configlens.render;

/**
 * 树形视图中的一行。
 *
 * @param line 源文件行号，0 表示未知
 */
public record ProvenanceItem(Classification classification, int line, String path) {
}
