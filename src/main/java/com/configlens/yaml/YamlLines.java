package com.configlens.yaml;

import java.util.regex.Pattern;

/**
 * 单行 YAML 文本的最小词法判断，供高亮和路径重建共用。
 */
public final class YamlLines {
    private static final Pattern BLOCK_INDICATOR = Pattern.compile("[|>]([-+]?[1-9]?|[1-9][-+])");

    private YamlLines() {
    }

    /**
     * 返回键分隔符 ':' 的下标；不是 {@code key: value} / {@code key:} 形式时返回 -1。
     * 只识别引号外、后跟空格或行尾的冒号，流式值（以 { 或 [ 开头）不算键。
     */
    public static int keySeparatorIndex(String content) {
        if (content.isEmpty()) {
            return -1;
        }
        char first = content.charAt(0);
        if (first == '{' || first == '[') {
            return -1;
        }
        int index = 0;
        if (first == '"' || first == '\'') {
            index = closingQuote(content, first);
            if (index < 0) {
                return -1;
            }
            index++;
            while (index < content.length() && content.charAt(index) == ' ') {
                index++;
            }
            return isSeparatorAt(content, index) ? index : -1;
        }
        while (index < content.length()) {
            char current = content.charAt(index);
            if (current == '#' && index > 0 && content.charAt(index - 1) == ' ') {
                return -1;
            }
            if (isSeparatorAt(content, index)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    /**
     * 去掉引号后的键名。
     */
    public static String keyText(String content, int separatorIndex) {
        String raw = content.substring(0, separatorIndex).trim();
        if (raw.length() >= 2 && raw.charAt(0) == '"' && raw.charAt(raw.length() - 1) == '"') {
            return raw.substring(1, raw.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        if (raw.length() >= 2 && raw.charAt(0) == '\'' && raw.charAt(raw.length() - 1) == '\'') {
            return raw.substring(1, raw.length() - 1).replace("''", "'");
        }
        return raw;
    }

    public static String valueText(String content, int separatorIndex) {
        return content.substring(separatorIndex + 1).trim();
    }

    /**
     * 字面量块 / 折叠块标记：| |- |+ > >- >+，可带缩进数字。
     */
    public static boolean isBlockIndicator(String value) {
        return BLOCK_INDICATOR.matcher(value).matches();
    }

    /**
     * 值为空或是空集合时，其内容（若有）在后续更深的行上。
     */
    public static boolean opensNestedScope(String value) {
        return value.isEmpty() || "{}".equals(value) || "[]".equals(value) || isBlockIndicator(value);
    }

    public static boolean isSequenceMarker(String content) {
        return "-".equals(content) || content.startsWith("- ");
    }

    public static boolean isComment(String content) {
        return content.startsWith("#");
    }

    public static boolean isDocumentMarker(String content) {
        return "---".equals(content) || "...".equals(content) || content.startsWith("--- ");
    }

    private static boolean isSeparatorAt(String content, int index) {
        if (index >= content.length() || content.charAt(index) != ':') {
            return false;
        }
        return index + 1 == content.length() || content.charAt(index + 1) == ' ';
    }

    private static int closingQuote(String content, char quote) {
        int index = 1;
        while (index < content.length()) {
            char current = content.charAt(index);
            if (quote == '"' && current == '\\') {
                index += 2;
                continue;
            }
            if (current == quote) {
                if (quote == '\'' && index + 1 < content.length() && content.charAt(index + 1) == '\'') {
                    index += 2;
                    continue;
                }
                return index;
            }
            index++;
        }
        return -1;
    }
}
