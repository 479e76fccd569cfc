package com.configlens.path;

import com.configlens.provenance.InMemoryProvenanceStore;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProvenanceLookupTest {
    private final ProvenanceLookup lookup = new ProvenanceLookup(new PathNormalizer());

    @Test
    @DisplayName("带作用域前缀的存储路径可以按归一化路径找到")
    void testFindThroughScopePrefix() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();
        ProvenanceEntry entry = new ProvenanceEntry("stacks/dev.yaml", 4, ProvenanceKind.INLINE, 0);
        store.recordProvenance("components.terraform.vpc.vars.enabled", entry);

        Optional<ProvenanceEntry> found = lookup.find(store, "vars.enabled");

        assertTrue(found.isPresent());
        assertEquals(entry, found.get());
    }

    @Test
    @DisplayName("返回下标 0 的胜出记录")
    void testFirstEntryWins() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();
        ProvenanceEntry winner = new ProvenanceEntry("stacks/dev.yaml", 8, ProvenanceKind.OVERRIDE, 0);
        store.recordProvenance("vars.name", winner);
        store.recordProvenance("vars.name", new ProvenanceEntry("stacks/base.yaml", 2, ProvenanceKind.IMPORT, 1));

        assertEquals(winner, lookup.find(store, "vars.name").orElseThrow());
    }

    @Test
    @DisplayName("未启用、空存储或无匹配时返回空")
    void testAbsent() {
        InMemoryProvenanceStore disabled = new InMemoryProvenanceStore(false);
        disabled.recordProvenance("vars.name", new ProvenanceEntry("a.yaml", 1, ProvenanceKind.INLINE, 0));

        assertTrue(lookup.find(disabled, "vars.name").isEmpty());
        assertTrue(lookup.find(null, "vars.name").isEmpty());
        assertTrue(lookup.find(new InMemoryProvenanceStore(), "vars.name").isEmpty());
        assertTrue(lookup.find(disabled, null).isEmpty());
    }

    @Test
    @DisplayName("索引与逐条查找结果一致")
    void testIndexMatchesFind() {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore();
        store.recordProvenance("terraform.vars.cidr", new ProvenanceEntry("a.yaml", 3, ProvenanceKind.IMPORT, 2));
        store.recordProvenance("vars.cidr", new ProvenanceEntry("b.yaml", 9, ProvenanceKind.INLINE, 0));
        store.recordProvenance("vars.tags[0]", new ProvenanceEntry("c.yaml", 1, ProvenanceKind.IMPORT, 1));

        Map<String, ProvenanceEntry> index = lookup.index(store);

        assertEquals(2, index.size());
        assertEquals(lookup.find(store, "vars.cidr").orElseThrow(), index.get("vars.cidr"));
        assertEquals(lookup.find(store, "vars.tags[0]").orElseThrow(), index.get("vars.tags[0]"));
    }

    @Test
    @DisplayName("未启用的存储索引为空")
    void testIndexDisabled() {
        assertTrue(lookup.index(new InMemoryProvenanceStore(false)).isEmpty());
        assertTrue(lookup.index(null).isEmpty());
    }
}
