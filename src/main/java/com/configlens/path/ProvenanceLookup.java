package com.configlens.path;

import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 按归一化路径查找胜出的来源记录。
 *
 * 逐个归一化存储中的路径并比较，首个命中者获胜。多个存储路径归一化后相同时，
 * 结果取决于存储的迭代顺序，调用方不应依赖。
 */
public class ProvenanceLookup {
    private static final Logger logger = LoggerFactory.getLogger(ProvenanceLookup.class);

    private final PathNormalizer normalizer;

    public ProvenanceLookup(PathNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public Optional<ProvenanceEntry> find(ProvenanceStore store, String normalizedPath) {
        if (store == null || !store.isProvenanceEnabled() || normalizedPath == null) {
            return Optional.empty();
        }
        for (String storedPath : store.getProvenancePaths()) {
            if (!normalizedPath.equals(normalizer.normalize(storedPath))) {
                continue;
            }
            List<ProvenanceEntry> entries = store.getProvenance(storedPath);
            if (!entries.isEmpty()) {
                return Optional.of(entries.get(0));
            }
        }
        logger.trace("未找到来源: {}", normalizedPath);
        return Optional.empty();
    }

    /**
     * 一次扫描建立 归一化路径 → 胜出记录 的索引，命中规则与 {@link #find} 相同，
     * 供逐行查找的渲染器避免重复扫描整个存储。
     */
    public Map<String, ProvenanceEntry> index(ProvenanceStore store) {
        Map<String, ProvenanceEntry> index = new HashMap<>();
        if (store == null || !store.isProvenanceEnabled()) {
            return index;
        }
        for (String storedPath : store.getProvenancePaths()) {
            List<ProvenanceEntry> entries = store.getProvenance(storedPath);
            if (!entries.isEmpty()) {
                index.putIfAbsent(normalizer.normalize(storedPath), entries.get(0));
            }
        }
        return index;
    }
}
