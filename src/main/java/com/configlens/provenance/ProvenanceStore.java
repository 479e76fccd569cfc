package com.configlens.provenance;

import java.util.List;

/**
 * 合并引擎维护的来源存储：逻辑路径 → 按合并先后排序的来源记录，下标 0 为最终胜出的值。
 *
 * 渲染器只读；唯一的写入方是键重命名预处理，且写入总在同一次调用的读取之前完成。
 */
public interface ProvenanceStore {

    boolean isProvenanceEnabled();

    /**
     * 所有记录过的路径，顺序不作保证。
     */
    List<String> getProvenancePaths();

    /**
     * 指定路径的来源记录，没有时返回空列表。
     */
    List<ProvenanceEntry> getProvenance(String path);

    boolean hasProvenance(String path);

    void recordProvenance(String path, ProvenanceEntry entry);
}
