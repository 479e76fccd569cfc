package com.configlens.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 从 YAML / JSON 文件读取合并后的文档。扩展名为 .json 时按 JSON 解析，其余按 YAML。
 */
public class DocumentLoader {
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentLoader() {
        this(new ObjectMapper(), new YAMLMapper());
    }

    DocumentLoader(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    public Node load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("文档不存在: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".json") ? jsonMapper : yamlMapper;
        JsonNode tree = mapper.readTree(path.toFile());
        return tree == null ? Node.NULL : toNode(tree);
    }

    public Node parseYaml(String text) throws IOException {
        JsonNode tree = yamlMapper.readTree(text);
        return tree == null ? Node.NULL : toNode(tree);
    }

    static Node toNode(JsonNode json) {
        if (json.isObject()) {
            Map<String, Node> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toNode(field.getValue()));
            }
            return new Node.MapNode(entries);
        }
        if (json.isArray()) {
            List<Node> items = new ArrayList<>(json.size());
            for (JsonNode item : json) {
                items.add(toNode(item));
            }
            return new Node.SeqNode(items);
        }
        if (json.isBoolean()) {
            return new Node.BoolNode(json.booleanValue());
        }
        if (json.isNumber()) {
            return new Node.NumberNode(json.numberValue());
        }
        if (json.isNull() || json.isMissingNode()) {
            return Node.NULL;
        }
        return new Node.StrNode(json.asText());
    }
}
