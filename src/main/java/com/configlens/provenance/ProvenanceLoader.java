package com.configlens.provenance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 从 JSON 文件读取来源存储。
 *
 * <pre>
 * {"enabled": true,
 *  "paths": {"vars.name": [{"file": "stacks/a.yaml", "line": 3, "kind": "inline", "depth": 0}]}}
 * </pre>
 */
public class ProvenanceLoader {
    private final ObjectMapper mapper;

    public ProvenanceLoader() {
        this(new ObjectMapper());
    }

    public ProvenanceLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public InMemoryProvenanceStore load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("来源文件不存在: " + path);
        }
        return toStore(mapper.readValue(path.toFile(), ProvenanceFile.class), path.toString());
    }

    public InMemoryProvenanceStore parse(String json) throws IOException {
        return toStore(mapper.readValue(json, ProvenanceFile.class), "<inline>");
    }

    private InMemoryProvenanceStore toStore(ProvenanceFile file, String origin) throws IOException {
        InMemoryProvenanceStore store = new InMemoryProvenanceStore(file.enabled() == null || file.enabled());
        if (file.paths() == null) {
            return store;
        }
        for (Map.Entry<String, List<EntryJson>> path : file.paths().entrySet()) {
            if (path.getValue() == null) {
                continue;
            }
            for (EntryJson json : path.getValue()) {
                try {
                    store.recordProvenance(path.getKey(), json.toEntry());
                } catch (IllegalArgumentException | NullPointerException exception) {
                    throw new IOException("非法来源记录 " + path.getKey() + " (" + origin + "): "
                            + exception.getMessage(), exception);
                }
            }
        }
        return store;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProvenanceFile(Boolean enabled, Map<String, List<EntryJson>> paths) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntryJson(String file, int line, String kind, int depth) {
        ProvenanceEntry toEntry() {
            ProvenanceKind parsedKind = kind == null ? ProvenanceKind.INLINE : ProvenanceKind.parse(kind);
            return new ProvenanceEntry(file, line, parsedKind, depth);
        }
    }
}
