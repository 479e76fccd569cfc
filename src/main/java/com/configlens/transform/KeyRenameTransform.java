package com.configlens.transform;

import com.configlens.document.Node;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将根键改名以对齐清单 schema（默认 imports → import），同时把该键及其
 * {@code key[N]} 子元素的来源记录复制到新路径下。
 *
 * 这是渲染流程中唯一写入来源存储的步骤，必须在任何读取之前执行。
 */
public class KeyRenameTransform {
    private static final Logger logger = LoggerFactory.getLogger(KeyRenameTransform.class);

    private final String from;
    private final String to;

    public KeyRenameTransform(String from, String to) {
        this.from = from;
        this.to = to;
    }

    public Node apply(Node document, ProvenanceStore store) {
        if (!(document instanceof Node.MapNode map) || !map.containsKey(from) || from.equals(to)) {
            return document;
        }

        Map<String, Node> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : map.entries().entrySet()) {
            renamed.put(entry.getKey().equals(from) ? to : entry.getKey(), entry.getValue());
        }

        if (store != null) {
            int migrated = migrate(store, from, to);
            for (int index = 0; store.hasProvenance(from + "[" + index + "]"); index++) {
                migrated += migrate(store, from + "[" + index + "]", to + "[" + index + "]");
            }
            logger.debug("根键 {} 重命名为 {}，迁移来源记录 {} 条", from, to, migrated);
        }
        return new Node.MapNode(renamed);
    }

    /**
     * 按原顺序复制，保证新路径的胜出记录与旧路径一致。
     */
    private int migrate(ProvenanceStore store, String oldPath, String newPath) {
        if (store.hasProvenance(newPath)) {
            return 0;
        }
        List<ProvenanceEntry> entries = store.getProvenance(oldPath);
        for (ProvenanceEntry entry : entries) {
            store.recordProvenance(newPath, entry);
        }
        return entries.size();
    }
}
