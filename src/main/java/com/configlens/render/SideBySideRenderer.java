package com.configlens.render;

import com.configlens.config.Constants;
import com.configlens.config.RenderConfig;
import com.configlens.document.Node;
import com.configlens.provenance.ProvenanceStore;
import com.configlens.text.Ansi;
import com.configlens.text.LineWrapper;
import com.configlens.yaml.HighlightException;
import com.configlens.yaml.Highlighter;
import com.configlens.yaml.YamlSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 左栏为着色后的 YAML，右栏为来源树，两栏逐行交错对齐。
 */
public class SideBySideRenderer {
    private static final Logger logger = LoggerFactory.getLogger(SideBySideRenderer.class);
    private static final String SEPARATOR = " │  ";
    private static final String LEFT_TITLE = "Configuration";

    private final RenderConfig config;
    private final YamlSerializer serializer;
    private final Highlighter highlighter;
    private final TreeRenderer treeRenderer;

    public SideBySideRenderer(RenderConfig config, YamlSerializer serializer, Highlighter highlighter) {
        this.config = config;
        this.serializer = serializer;
        this.highlighter = highlighter;
        this.treeRenderer = new TreeRenderer(config);
    }

    public String render(Object document, ProvenanceStore store, int leftWidth) {
        String yaml;
        try {
            yaml = serializer.serialize(Node.of(document), config.getIndentWidth());
        } catch (IOException | RuntimeException exception) {
            logger.warn("并排视图序列化失败: {}", exception.getMessage());
            return RenderFailure.describe(exception);
        }

        String highlighted;
        try {
            highlighted = highlighter.highlight(yaml);
        } catch (HighlightException | RuntimeException exception) {
            logger.debug("高亮失败，使用纯文本: {}", exception.getMessage());
            highlighted = yaml;
        }

        // 右栏展示全部来源，不按文档内容过滤
        String tree = treeRenderer.render(store, null);
        return combine(highlighted, tree, leftWidth);
    }

    String combine(String left, String right, int leftWidth) {
        List<String> wrappedLeft = new ArrayList<>();
        for (String line : splitLines(left)) {
            wrappedLeft.addAll(LineWrapper.wrap(line, leftWidth - Constants.LEFT_COLUMN_GUTTER));
        }
        List<Row> rows = balanceColumns(wrappedLeft, splitLines(right));

        StringBuilder builder = new StringBuilder();
        builder.append(LEFT_TITLE);
        builder.append(" ".repeat(Math.max(0, leftWidth - LEFT_TITLE.length())));
        builder.append(SEPARATOR).append("Provenance\n");
        builder.append("─".repeat(Math.max(0, leftWidth)));
        builder.append('┼');
        builder.append("─".repeat(Constants.HEADER_RULE_WIDTH));
        builder.append('\n');

        for (Row row : rows) {
            builder.append(row.left());
            int padding = leftWidth - Ansi.visibleLength(row.left());
            if (padding > 0) {
                builder.append(" ".repeat(padding));
            }
            builder.append(SEPARATOR);
            builder.append(row.right());
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * 两侧都有剩余时各取一行；一侧耗尽后只在该侧补空行，因此行数恰为 max(|L|, |R|)。
     */
    static List<Row> balanceColumns(List<String> left, List<String> right) {
        int total = Math.max(left.size(), right.size());
        List<Row> rows = new ArrayList<>(total);
        for (int index = 0; index < total; index++) {
            String leftLine = index < left.size() ? left.get(index) : "";
            String rightLine = index < right.size() ? right.get(index) : "";
            rows.add(new Row(leftLine, rightLine));
        }
        return rows;
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String trimmed = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return List.of(trimmed.split("\n", -1));
    }

    record Row(String left, String right) {
    }
}
