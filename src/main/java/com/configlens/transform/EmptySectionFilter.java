package com.configlens.transform;

import com.configlens.config.Constants;
import com.configlens.document.Node;
import com.configlens.provenance.ProvenanceStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 去掉没有任何来源记录的顶层段，例如合并时生成的空 {@code backend: {}} 占位。
 * 一个段有来源，当且仅当段本身或其前 {@link Constants#MAX_ARRAY_CHECKS} 个下标元素之一有记录。
 */
public class EmptySectionFilter {
    private final int arrayCheckLimit;

    public EmptySectionFilter() {
        this(Constants.MAX_ARRAY_CHECKS);
    }

    public EmptySectionFilter(int arrayCheckLimit) {
        this.arrayCheckLimit = Math.max(0, arrayCheckLimit);
    }

    public Node apply(Node document, ProvenanceStore store) {
        if (!(document instanceof Node.MapNode map)) {
            return document;
        }
        Map<String, Node> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : map.entries().entrySet()) {
            if (hasProvenance(store, entry.getKey())) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return new Node.MapNode(filtered);
    }

    private boolean hasProvenance(ProvenanceStore store, String key) {
        if (store == null) {
            return false;
        }
        if (store.hasProvenance(key)) {
            return true;
        }
        for (int index = 0; index < arrayCheckLimit; index++) {
            if (store.hasProvenance(key + "[" + index + "]")) {
                return true;
            }
        }
        return false;
    }
}
