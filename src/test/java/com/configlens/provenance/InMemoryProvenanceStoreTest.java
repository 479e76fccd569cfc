package com.configlens.provenance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProvenanceStoreTest {
    private static final ProvenanceEntry FIRST = new ProvenanceEntry("stacks/dev.yaml", 1, ProvenanceKind.INLINE, 0);
    private static final ProvenanceEntry SECOND = new ProvenanceEntry("stacks/base.yaml", 2, ProvenanceKind.IMPORT, 1);

    @Test
    @DisplayName("追加记录并保持路径首次出现顺序")
    void testRecordAndOrder() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();
        store.recordProvenance("vars.b", FIRST);
        store.recordProvenance("vars.a", FIRST);
        store.recordProvenance("vars.b", SECOND);

        assertTrue(store.isProvenanceEnabled());
        assertEquals(List.of("vars.b", "vars.a"), store.getProvenancePaths());
        assertEquals(List.of(FIRST, SECOND), store.getProvenance("vars.b"));
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("未记录路径返回空列表")
    void testMissingPath() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();

        assertTrue(store.getProvenance("nope").isEmpty());
        assertFalse(store.hasProvenance("nope"));
    }

    @Test
    @DisplayName("返回的列表是快照")
    void testSnapshots() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();
        store.recordProvenance("vars.a", FIRST);
        List<String> paths = store.getProvenancePaths();
        List<ProvenanceEntry> entries = store.getProvenance("vars.a");

        store.recordProvenance("vars.b", SECOND);
        store.recordProvenance("vars.a", SECOND);

        assertEquals(1, paths.size());
        assertEquals(1, entries.size());
        assertThrows(UnsupportedOperationException.class, () -> entries.add(SECOND));
    }

    @Test
    @DisplayName("空参数被拒绝")
    void testNullArguments() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore(false);

        assertFalse(store.isProvenanceEnabled());
        assertThrows(NullPointerException.class, () -> store.recordProvenance(null, FIRST));
        assertThrows(NullPointerException.class, () -> store.recordProvenance("a", null));
    }
}
