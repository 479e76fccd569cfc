package com.configlens.render;

import com.configlens.config.Constants;
import com.configlens.config.RenderConfig;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceKind;
import com.configlens.provenance.ProvenanceStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按源文件分组的来源树：
 * <pre>
 * Provenance
 * ────────
 * stacks/
 * ├── catalog/vpc.yaml
 * │  ├─ ○ :12   vars.cidr
 * │  └─ ○ :13   vars.name
 * └── dev.yaml
 *    └─ ● :4   vars.enabled
 * </pre>
 */
public class TreeRenderer {
    private final RenderConfig config;

    public TreeRenderer(RenderConfig config) {
        this.config = config;
    }

    /**
     * @param allowList 只渲染其中的路径；null 表示不过滤
     * @return 未启用来源追踪时返回空串
     */
    public String render(ProvenanceStore store, Set<String> allowList) {
        if (store == null || !store.isProvenanceEnabled()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("Provenance\n");
        builder.append("─".repeat(Constants.HEADER_RULE_WIDTH)).append('\n');
        renderFileTree(builder, buildFileTree(store, allowList));
        return builder.toString();
    }

    List<RenderNode> buildFileTree(ProvenanceStore store, Set<String> allowList) {
        Map<String, List<ProvenanceItem>> byFile = new LinkedHashMap<>();
        for (String path : store.getProvenancePaths()) {
            if (allowList != null && !allowList.contains(path)) {
                continue;
            }
            List<ProvenanceEntry> entries = store.getProvenance(path);
            if (entries.isEmpty()) {
                continue;
            }
            ProvenanceEntry winner = entries.get(0);
            String file = winner.kind() == ProvenanceKind.COMPUTED
                    ? Constants.COMPUTED_PSEUDO_FILE
                    : winner.sourceFile();
            byFile.computeIfAbsent(file, ignored -> new ArrayList<>())
                    .add(new ProvenanceItem(SymbolClassifier.classify(winner), winner.sourceLine(), path));
        }

        List<RenderNode> tree = new ArrayList<>(byFile.size());
        for (Map.Entry<String, List<ProvenanceItem>> entry : byFile.entrySet()) {
            tree.add(new RenderNode(entry.getKey(), entry.getValue()));
        }
        tree.sort((left, right) -> left.sourceFile().compareTo(right.sourceFile()));
        return tree;
    }

    private void renderFileTree(StringBuilder builder, List<RenderNode> tree) {
        if (tree.isEmpty()) {
            builder.append("No provenance data available.\n");
            return;
        }
        Theme theme = config.getTheme();
        builder.append(config.getRootLabel()).append('\n');

        for (int fileIndex = 0; fileIndex < tree.size(); fileIndex++) {
            RenderNode node = tree.get(fileIndex);
            boolean lastFile = fileIndex == tree.size() - 1;
            builder.append(lastFile ? "└──" : "├──").append(' ');
            builder.append(theme.paint(node.sourceFile(), theme.file())).append('\n');

            String prefix = lastFile ? "   " : "│  ";
            List<ProvenanceItem> items = node.items();
            for (int itemIndex = 0; itemIndex < items.size(); itemIndex++) {
                ProvenanceItem item = items.get(itemIndex);
                builder.append(prefix);
                builder.append(itemIndex == items.size() - 1 ? "└─" : "├─").append(' ');
                Classification classification = item.classification();
                builder.append(theme.paint(classification.symbol(), theme.colorFor(classification.tier())));
                builder.append(' ');
                if (item.line() > 0) {
                    builder.append(theme.paint(":" + item.line(), theme.lineNumber())).append("   ");
                }
                builder.append(item.path()).append('\n');
            }
        }
    }
}
