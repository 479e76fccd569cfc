package com.configlens.yaml;

public interface Highlighter {

    /**
     * 为 YAML 文本加上终端样式。只允许插入转义序列，去样式后必须与输入逐字相同。
     */
    String highlight(String text) throws HighlightException;

    /**
     * 不做任何着色。
     */
    static Highlighter plain() {
        return text -> text;
    }
}
