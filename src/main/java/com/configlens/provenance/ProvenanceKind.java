package com.configlens.provenance;

import java.util.Locale;

/**
 * 值进入合并结果的方式。
 */
public enum ProvenanceKind {
    INLINE,
    OVERRIDE,
    IMPORT,
    DEFAULT,
    COMPUTED;

    /**
     * 按名称解析，忽略大小写。
     */
    public static ProvenanceKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("来源类型不能为空");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
