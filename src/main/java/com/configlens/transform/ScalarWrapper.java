package com.configlens.transform;

import com.configlens.document.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把超长的单行字符串标记为折叠块，序列化时在空白处换行，避免横向滚动。
 * 字符串的值不变；已含换行、首尾带空白的字符串与非字符串值保持原样。
 */
public final class ScalarWrapper {

    private ScalarWrapper() {
    }

    public static Node wrapLongScalars(Node node, int maxWidth) {
        if (maxWidth <= 0) {
            return node;
        }
        if (node instanceof Node.MapNode map) {
            Map<String, Node> entries = new LinkedHashMap<>();
            for (Map.Entry<String, Node> entry : map.entries().entrySet()) {
                entries.put(entry.getKey(), wrapLongScalars(entry.getValue(), maxWidth));
            }
            return new Node.MapNode(entries);
        }
        if (node instanceof Node.SeqNode seq) {
            List<Node> items = new ArrayList<>(seq.items().size());
            for (Node item : seq.items()) {
                items.add(wrapLongScalars(item, maxWidth));
            }
            return new Node.SeqNode(items);
        }
        if (node instanceof Node.StrNode str && isFoldable(str.value(), maxWidth)) {
            return new Node.LongStrNode(str.value(), maxWidth);
        }
        return node;
    }

    // 首尾带空白的值无法用折叠块原样表示
    static boolean isFoldable(String value, int maxWidth) {
        return value.length() > maxWidth
                && value.indexOf('\n') < 0
                && !Character.isWhitespace(value.charAt(0))
                && !Character.isWhitespace(value.charAt(value.length() - 1));
    }
}
