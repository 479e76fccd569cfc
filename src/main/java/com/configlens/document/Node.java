package com.configlens.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 合并后配置文档的节点。
 *
 * 预处理（重命名、空段过滤、长字符串折行）只面向这一组封闭类型，
 * 不在各处散落 instanceof 检查原始 Object。
 */
public sealed interface Node permits Node.NullNode, Node.BoolNode, Node.NumberNode,
        Node.StrNode, Node.LongStrNode, Node.SeqNode, Node.MapNode {

    record NullNode() implements Node {
    }

    record BoolNode(boolean value) implements Node {
    }

    record NumberNode(Number value) implements Node {
    }

    record StrNode(String value) implements Node {
    }

    /**
     * 超长的单行字符串。值保持原样，序列化为折叠块（{@code >-}），每行不超过 width 个字符。
     */
    record LongStrNode(String value, int width) implements Node {
        public LongStrNode {
            Objects.requireNonNull(value, "value");
            if (width <= 0) {
                throw new IllegalArgumentException("width 必须为正数: " + width);
            }
        }
    }

    record SeqNode(List<Node> items) implements Node {
        public SeqNode {
            items = List.copyOf(items);
        }
    }

    /** 保持插入顺序的映射节点 */
    record MapNode(Map<String, Node> entries) implements Node {
        public MapNode {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public Node get(String key) {
            return entries.get(key);
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }
    }

    NullNode NULL = new NullNode();

    /**
     * 将合并引擎产出的无类型值（Map/List/标量）转换为节点树。
     *
     * @throws IllegalArgumentException 遇到无法序列化的值类型时
     */
    static Node of(Object value) {
        return convert(value, "");
    }

    private static Node convert(Object value, String path) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Node node) {
            return node;
        }
        if (value instanceof Boolean bool) {
            return new BoolNode(bool);
        }
        if (value instanceof Number number) {
            return new NumberNode(number);
        }
        if (value instanceof CharSequence text) {
            return new StrNode(text.toString());
        }
        if (value instanceof Character character) {
            return new StrNode(character.toString());
        }
        if (value instanceof Enum<?> constant) {
            return new StrNode(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Node> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                entries.put(key, convert(entry.getValue(), path.isEmpty() ? key : path + "." + key));
            }
            return new MapNode(entries);
        }
        if (value instanceof Collection<?> collection) {
            List<Node> items = new ArrayList<>(collection.size());
            int index = 0;
            for (Object item : collection) {
                items.add(convert(item, path + "[" + index++ + "]"));
            }
            return new SeqNode(items);
        }
        if (value instanceof Object[] array) {
            return convert(Arrays.asList(array), path);
        }
        String location = path.isEmpty() ? "<root>" : path;
        throw new IllegalArgumentException(
                "unsupported value type " + value.getClass().getName() + " at " + location);
    }
}
