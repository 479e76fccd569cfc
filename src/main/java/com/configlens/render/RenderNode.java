package com.configlens.render;

import java.util.List;

/**
 * 按源文件分组的树节点，条目保持遇到的顺序。
 */
public record RenderNode(String sourceFile, List<ProvenanceItem> items) {
    public RenderNode {
        items = List.copyOf(items);
    }
}
