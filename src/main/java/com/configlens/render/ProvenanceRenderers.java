package com.configlens.render;

import com.configlens.config.RenderConfig;
import com.configlens.provenance.ProvenanceStore;
import com.configlens.yaml.AnsiYamlHighlighter;
import com.configlens.yaml.Highlighter;
import com.configlens.yaml.SnakeYamlSerializer;
import com.configlens.yaml.YamlSerializer;

import java.util.Set;

/**
 * 对外的三种来源视图入口。每次调用只读一遍来源存储，不保留任何状态。
 */
public class ProvenanceRenderers {
    private final TreeRenderer treeRenderer;
    private final SideBySideRenderer sideBySideRenderer;
    private final InlineRenderer inlineRenderer;

    /**
     * 使用 Jackson 序列化；关闭颜色时不做语法高亮。
     */
    public ProvenanceRenderers(RenderConfig config) {
        this(config, new SnakeYamlSerializer(), config.isColorEnabled() ? new AnsiYamlHighlighter() : Highlighter.plain());
    }

    public ProvenanceRenderers(RenderConfig config, YamlSerializer serializer, Highlighter highlighter) {
        this.treeRenderer = new TreeRenderer(config);
        this.sideBySideRenderer = new SideBySideRenderer(config, serializer, highlighter);
        this.inlineRenderer = new InlineRenderer(config, serializer, highlighter);
    }

    public String renderTree(ProvenanceStore store, Set<String> allowList) {
        return treeRenderer.render(store, allowList);
    }

    public String renderSideBySide(Object document, ProvenanceStore store, int leftWidth) {
        return sideBySideRenderer.render(document, store, leftWidth);
    }

    public String renderInline(Object document, ProvenanceStore store, String describedFile) {
        return inlineRenderer.render(document, store, describedFile);
    }
}
