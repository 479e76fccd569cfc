package com.configlens.text;

import java.util.regex.Pattern;

/**
 * ANSI 转义序列工具。结构判断与宽度计算都必须基于去样式后的文本。
 */
public final class Ansi {
    /** CSI 序列：ESC [ 参数 中间字节 结束字节 */
    private static final Pattern CSI = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]");

    public static final char ESC = '\u001B';

    private Ansi() {
    }

    public static String strip(String text) {
        if (text == null || text.indexOf(ESC) < 0) {
            return text == null ? "" : text;
        }
        return CSI.matcher(text).replaceAll("");
    }

    /**
     * 可见宽度，按码点计数，不含转义序列。
     */
    public static int visibleLength(String text) {
        String plain = strip(text);
        return plain.codePointCount(0, plain.length());
    }

    /**
     * 从 {@code start} 处的 ESC 开始，返回该转义序列结束后的下标；不是完整序列时返回 start + 1。
     */
    static int escapeEnd(String text, int start) {
        int index = start + 1;
        if (index >= text.length() || text.charAt(index) != '[') {
            return index;
        }
        index++;
        while (index < text.length()) {
            char current = text.charAt(index);
            if (current >= '@' && current <= '~') {
                return index + 1;
            }
            index++;
        }
        return text.length();
    }
}
