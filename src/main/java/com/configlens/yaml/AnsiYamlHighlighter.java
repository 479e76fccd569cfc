package com.configlens.yaml;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * 逐行的 YAML 终端着色：键、序列标记、注释和标量值各用一种颜色。
 * 只在原文本中插入转义序列，不改变任何可见字符。
 */
public class AnsiYamlHighlighter implements Highlighter {
    private static final String ANSI_KEY = "\u001B[34m";
    private static final String ANSI_MARKER = "\u001B[90m";
    private static final String ANSI_COMMENT = "\u001B[90m";
    private static final String ANSI_STRING = "\u001B[32m";
    private static final String ANSI_NUMBER = "\u001B[36m";
    private static final String ANSI_LITERAL = "\u001B[35m";
    private static final String ANSI_RESET = "\u001B[0m";

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d[\\d_]*)(\\.\\d+)?([eE][-+]?\\d+)?");
    private static final Set<String> LITERALS = Set.of("true", "false", "null", "~", "{}", "[]");

    @Override
    public String highlight(String text) throws HighlightException {
        if (text == null) {
            throw new HighlightException("待高亮文本为空");
        }
        if (text.indexOf('\u001B') >= 0) {
            throw new HighlightException("文本已包含转义序列，拒绝重复着色");
        }
        StringBuilder builder = new StringBuilder(text.length() * 2);
        int start = 0;
        while (start <= text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                highlightLine(builder, text.substring(start));
                break;
            }
            highlightLine(builder, text.substring(start, end));
            builder.append('\n');
            start = end + 1;
        }
        return builder.toString();
    }

    private void highlightLine(StringBuilder builder, String line) {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        builder.append(line, 0, indent);
        String content = line.substring(indent);
        if (content.isEmpty()) {
            return;
        }
        if (YamlLines.isComment(content)) {
            paint(builder, content, ANSI_COMMENT);
            return;
        }

        while (YamlLines.isSequenceMarker(content)) {
            paint(builder, "-", ANSI_MARKER);
            content = content.substring(1);
            int spaces = 0;
            while (spaces < content.length() && content.charAt(spaces) == ' ') {
                spaces++;
            }
            builder.append(content, 0, spaces);
            content = content.substring(spaces);
        }

        int separator = YamlLines.keySeparatorIndex(content);
        if (separator < 0) {
            paintScalar(builder, content);
            return;
        }
        paint(builder, content.substring(0, separator), ANSI_KEY);
        builder.append(':');
        String rest = content.substring(separator + 1);
        int spaces = 0;
        while (spaces < rest.length() && rest.charAt(spaces) == ' ') {
            spaces++;
        }
        builder.append(rest, 0, spaces);
        paintScalar(builder, rest.substring(spaces));
    }

    private void paintScalar(StringBuilder builder, String value) {
        if (value.isEmpty()) {
            return;
        }
        if (YamlLines.isBlockIndicator(value)) {
            paint(builder, value, ANSI_MARKER);
        } else if (LITERALS.contains(value)) {
            paint(builder, value, ANSI_LITERAL);
        } else if (NUMBER.matcher(value).matches()) {
            paint(builder, value, ANSI_NUMBER);
        } else {
            paint(builder, value, ANSI_STRING);
        }
    }

    private void paint(StringBuilder builder, String text, String color) {
        builder.append(color).append(text).append(ANSI_RESET);
    }
}
