package com.configlens.provenance;

import java.util.Objects;

/**
 * 一条来源记录：值来自哪个文件的哪一行，经过几层继承。
 *
 * @param sourceFile 源文件路径
 * @param sourceLine 行号，0 表示未知
 * @param kind       来源类型
 * @param depth      距当前描述文件的导入/继承跳数
 */
public record ProvenanceEntry(
        String sourceFile,
        int sourceLine,
        ProvenanceKind kind,
        int depth
) {
    public ProvenanceEntry {
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(kind, "kind");
        if (sourceLine < 0) {
            throw new IllegalArgumentException("sourceLine 不能为负数: " + sourceLine);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth 不能为负数: " + depth);
        }
    }

    public boolean hasLine() {
        return sourceLine > 0;
    }
}
