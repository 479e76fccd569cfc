package com.configlens.yaml;

import com.configlens.document.Node;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Represent;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 SnakeYAML 的序列化实现。
 *
 * 固定为块风格、序列缩进在父键之下、多行字符串使用字面量块（{@code |}），
 * 超长字符串使用折叠块（{@code >-}）并按宽度换行，读回时得到原值。
 * 这样渲染结果的缩进与标点足以重建每一行的逻辑路径。
 */
public class SnakeYamlSerializer implements YamlSerializer {
    private static final int MIN_INDENT = 2;
    private static final int MAX_INDENT = 9;
    private static final String FOLDED_HEADER = ">-";

    @Override
    public String serialize(Node document, int indentWidth) throws IOException {
        int indent = Math.max(MIN_INDENT, Math.min(MAX_INDENT, indentWidth));
        DumperOptions options = dumperOptions(indent);
        Map<String, Integer> foldWidths = new HashMap<>();

        String yaml;
        try {
            yaml = new Yaml(new NodeRepresenter(options), options).dump(toObject(document, foldWidths));
        } catch (YAMLException exception) {
            throw new IOException("YAML 序列化失败: " + exception.getMessage(), exception);
        }

        // 根级序列的短横线从第 0 列开始
        if (document instanceof Node.SeqNode seq && !seq.items().isEmpty()) {
            yaml = dedent(yaml, options.getIndicatorIndent());
        }
        return foldWidths.isEmpty() ? yaml : foldLongScalars(yaml, foldWidths);
    }

    /**
     * 缩进为 2 时短横线缩进在父键之下；更宽的缩进让短横线后的内容与映射内容对齐。
     */
    static DumperOptions dumperOptions(int indent) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(indent);
        if (indent == MIN_INDENT) {
            options.setIndicatorIndent(MIN_INDENT);
            options.setIndentWithIndicator(true);
        } else {
            options.setIndicatorIndent(indent - 2);
            options.setIndentWithIndicator(false);
        }
        options.setSplitLines(false);
        options.setExplicitStart(false);
        return options;
    }

    private Object toObject(Node node, Map<String, Integer> foldWidths) {
        if (node instanceof Node.MapNode map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<String, Node> entry : map.entries().entrySet()) {
                entries.put(entry.getKey(), toObject(entry.getValue(), foldWidths));
            }
            return entries;
        }
        if (node instanceof Node.SeqNode seq) {
            List<Object> items = new ArrayList<>(seq.items().size());
            for (Node item : seq.items()) {
                items.add(toObject(item, foldWidths));
            }
            return items;
        }
        if (node instanceof Node.LongStrNode longStr) {
            foldWidths.put(longStr.value(), longStr.width());
            return new FoldedString(longStr.value());
        }
        if (node instanceof Node.StrNode str) {
            return str.value();
        }
        if (node instanceof Node.NumberNode number) {
            return number.value();
        }
        if (node instanceof Node.BoolNode bool) {
            return bool.value();
        }
        return null;
    }

    static String dedent(String yaml, int columns) {
        if (columns <= 0) {
            return yaml;
        }
        String prefix = " ".repeat(columns);
        StringBuilder result = new StringBuilder(yaml.length());
        for (String line : yaml.split("\n", -1)) {
            if (result.length() > 0) {
                result.append('\n');
            }
            result.append(line.startsWith(prefix) ? line.substring(columns) : line);
        }
        return result.toString();
    }

    /**
     * SnakeYAML 关闭自动断行后，折叠块的内容在同一行输出；这里按宽度在单个空格处断开。
     * 折叠块读回时单个换行还原为单个空格，值不变。
     */
    static String foldLongScalars(String yaml, Map<String, Integer> foldWidths) {
        String[] lines = yaml.split("\n", -1);
        StringBuilder result = new StringBuilder(yaml.length() + 64);
        for (int index = 0; index < lines.length; index++) {
            String line = lines[index];
            appendLine(result, line);
            if (!isFoldedHeader(line) || index + 1 >= lines.length) {
                continue;
            }
            String content = lines[index + 1];
            int indent = leadingSpaces(content);
            Integer width = foldWidths.get(content.substring(indent));
            if (width == null) {
                continue;
            }
            String padding = content.substring(0, indent);
            for (String row : foldText(content.substring(indent), width)) {
                appendLine(result, padding + row);
            }
            index++;
        }
        return result.toString();
    }

    /**
     * 贪心断行：在宽度内取最后一个可折叠的空格；宽度内没有时取之后的第一个，单词不被拆开。
     */
    static List<String> foldText(String text, int width) {
        List<String> rows = new ArrayList<>();
        int start = 0;
        while (text.length() - start > width) {
            int cut = -1;
            for (int index = start + 1; index < text.length() - 1; index++) {
                if (!isFoldPoint(text, index)) {
                    continue;
                }
                if (index - start > width && cut >= 0) {
                    break;
                }
                cut = index;
                if (index - start > width) {
                    break;
                }
            }
            if (cut < 0) {
                break;
            }
            rows.add(text.substring(start, cut));
            start = cut + 1;
        }
        rows.add(text.substring(start));
        return rows;
    }

    // 前后都不是空白的单个空格；连续空白在折叠块里会保留换行
    private static boolean isFoldPoint(String text, int index) {
        return text.charAt(index) == ' '
                && !Character.isWhitespace(text.charAt(index - 1))
                && !Character.isWhitespace(text.charAt(index + 1));
    }

    private static boolean isFoldedHeader(String line) {
        return line.equals(FOLDED_HEADER) || line.endsWith(": " + FOLDED_HEADER) || line.endsWith("- " + FOLDED_HEADER);
    }

    private static void appendLine(StringBuilder result, String line) {
        if (result.length() > 0) {
            result.append('\n');
        }
        result.append(line);
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private record FoldedString(String value) {
    }

    private static class NodeRepresenter extends Representer {

        NodeRepresenter(DumperOptions options) {
            super(options);
            this.representers.put(FoldedString.class, new RepresentFolded());
            this.representers.put(String.class, new RepresentText());
        }

        private class RepresentFolded implements Represent {
            @Override
            public org.yaml.snakeyaml.nodes.Node representData(Object data) {
                return representScalar(Tag.STR, ((FoldedString) data).value(), DumperOptions.ScalarStyle.FOLDED);
            }
        }

        private class RepresentText implements Represent {
            @Override
            public org.yaml.snakeyaml.nodes.Node representData(Object data) {
                String value = (String) data;
                DumperOptions.ScalarStyle style = value.indexOf('\n') >= 0
                        ? DumperOptions.ScalarStyle.LITERAL
                        : DumperOptions.ScalarStyle.PLAIN;
                return representScalar(Tag.STR, value, style);
            }
        }
    }
}
