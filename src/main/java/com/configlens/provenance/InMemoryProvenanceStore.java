package com.configlens.provenance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 LinkedHashMap 的来源存储，路径按首次记录顺序迭代。
 */
public class InMemoryProvenanceStore implements ProvenanceStore {
    private final Map<String, List<ProvenanceEntry>> entriesByPath = new LinkedHashMap<>();
    private final boolean enabled;

    public InMemoryProvenanceStore() {
        this(true);
    }

    public InMemoryProvenanceStore(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean isProvenanceEnabled() {
        return enabled;
    }

    @Override
    public List<String> getProvenancePaths() {
        return List.copyOf(entriesByPath.keySet());
    }

    @Override
    public List<ProvenanceEntry> getProvenance(String path) {
        List<ProvenanceEntry> entries = entriesByPath.get(path);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public boolean hasProvenance(String path) {
        List<ProvenanceEntry> entries = entriesByPath.get(path);
        return entries != null && !entries.isEmpty();
    }

    /**
     * 追加一条记录。首条记录即胜出值，后续记录按合并先后排在其后。
     */
    @Override
    public void recordProvenance(String path, ProvenanceEntry entry) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(entry, "entry");
        entriesByPath.computeIfAbsent(path, ignored -> new ArrayList<>()).add(entry);
    }

    public int size() {
        return entriesByPath.size();
    }
}
