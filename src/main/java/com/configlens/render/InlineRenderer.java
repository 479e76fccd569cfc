package com.configlens.render;

import com.configlens.config.RenderConfig;
import com.configlens.document.Node;
import com.configlens.path.LineAddress;
import com.configlens.path.PathNormalizer;
import com.configlens.path.PathReconstructor;
import com.configlens.path.ProvenanceLookup;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceStore;
import com.configlens.text.Ansi;
import com.configlens.transform.EmptySectionFilter;
import com.configlens.transform.KeyRenameTransform;
import com.configlens.transform.ScalarWrapper;
import com.configlens.yaml.HighlightException;
import com.configlens.yaml.Highlighter;
import com.configlens.yaml.YamlSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 在 YAML 每个键行右侧追加来源注释 {@code # ● [0] dev.yaml:12}。
 *
 * 流程：根键重命名 → 空段过滤 → 长字符串折行 → 序列化 → 高亮 → 路径重建 → 逐行查找并标注。
 * 行太长放不下时，注释另起一行并缩进到注释列。
 */
public class InlineRenderer {
    private static final Logger logger = LoggerFactory.getLogger(InlineRenderer.class);

    private static final List<String> LEGEND = List.of(
            "# Provenance Legend:",
            "#   ● [0] Defined in parent stack",
            "#   ○ [N] Inherited/imported (N levels deep)",
            "#   ∴ Computed/templated");

    private final RenderConfig config;
    private final YamlSerializer serializer;
    private final Highlighter highlighter;
    private final PathReconstructor reconstructor;
    private final PathNormalizer normalizer;
    private final ProvenanceLookup lookup;
    private final KeyRenameTransform renameTransform;
    private final EmptySectionFilter sectionFilter;

    public InlineRenderer(RenderConfig config, YamlSerializer serializer, Highlighter highlighter) {
        this.config = config;
        this.serializer = serializer;
        this.highlighter = highlighter;
        this.reconstructor = new PathReconstructor();
        this.normalizer = new PathNormalizer(config);
        this.lookup = new ProvenanceLookup(normalizer);
        this.renameTransform = new KeyRenameTransform(config.getRenameFrom(), config.getRenameTo());
        this.sectionFilter = new EmptySectionFilter();
    }

    /**
     * @param describedFile 被描述的清单文件，非空时输出在图例之后
     */
    public String render(Object document, ProvenanceStore store, String describedFile) {
        boolean tracking = store != null && store.isProvenanceEnabled();

        String yaml;
        try {
            Node node = Node.of(document);
            if (tracking) {
                // 重命名会写入存储，必须先于下面所有读取
                node = renameTransform.apply(node, store);
                node = sectionFilter.apply(node, store);
            }
            node = ScalarWrapper.wrapLongScalars(node, config.getWrapWidth());
            yaml = serializer.serialize(node, config.getIndentWidth());
        } catch (IOException | RuntimeException exception) {
            logger.warn("内联视图序列化失败: {}", exception.getMessage());
            return RenderFailure.describe(exception);
        }

        String highlighted;
        try {
            highlighted = highlighter.highlight(yaml);
        } catch (HighlightException | RuntimeException exception) {
            logger.debug("高亮失败，使用纯文本: {}", exception.getMessage());
            highlighted = yaml;
        }

        Theme theme = config.getTheme();
        StringBuilder result = new StringBuilder();
        for (String legendLine : LEGEND) {
            result.append(theme.paint(legendLine, theme.muted())).append('\n');
        }
        if (describedFile != null && !describedFile.isBlank()) {
            result.append(theme.paint("# Stack: " + describedFile, theme.muted())).append('\n');
        }
        result.append('\n');

        if (highlighted.endsWith("\n")) {
            highlighted = highlighted.substring(0, highlighted.length() - 1);
        }
        List<String> lines = Arrays.asList(highlighted.split("\n", -1));
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(lines);
        Map<String, ProvenanceEntry> winners = lookup.index(store);

        int commentColumn = config.getCommentColumn();
        int annotated = 0;
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            result.append(line);

            LineAddress address = addresses.get(index);
            if (address == null || address.continuation() || !address.keyLine()) {
                result.append('\n');
                continue;
            }
            ProvenanceEntry entry = winners.get(normalizer.normalize(address.path()));
            if (entry == null) {
                result.append('\n');
                continue;
            }

            String comment = formatComment(entry);
            int lineLength = Ansi.visibleLength(line);
            if (lineLength < commentColumn) {
                result.append(" ".repeat(commentColumn - lineLength));
            } else {
                result.append('\n').append(" ".repeat(Math.max(0, commentColumn)));
            }
            result.append(comment).append('\n');
            annotated++;
        }
        logger.debug("内联标注完成: {} 行, 标注 {} 行", lines.size(), annotated);
        return result.toString();
    }

    /**
     * {@code # <符号> [<深度>] <短文件名>:<行号>}，行号未知时省略。
     */
    String formatComment(ProvenanceEntry entry) {
        Theme theme = config.getTheme();
        Classification classification = SymbolClassifier.classify(entry);
        String tierColor = theme.colorFor(classification.tier());

        StringBuilder comment = new StringBuilder();
        comment.append(theme.paint("#", theme.muted())).append(' ');
        comment.append(theme.paint(classification.symbol(), tierColor)).append(' ');
        comment.append(theme.paint("[" + entry.depth() + "]", tierColor)).append(' ');
        comment.append(theme.paint(shortenFilePath(entry.sourceFile()), theme.muted()));
        if (entry.hasLine()) {
            comment.append(':').append(entry.sourceLine());
        }
        return comment.toString();
    }

    private String shortenFilePath(String file) {
        String prefix = config.getFilePrefix();
        if (prefix != null && !prefix.isEmpty() && file.startsWith(prefix)) {
            return file.substring(prefix.length());
        }
        return file;
    }
}
