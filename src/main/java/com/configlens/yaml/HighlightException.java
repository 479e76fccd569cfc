package com.configlens.yaml;

/**
 * 语法高亮失败。调用方应退回到未着色文本。
 */
public class HighlightException extends Exception {

    public HighlightException(String message) {
        super(message);
    }

    public HighlightException(String message, Throwable cause) {
        super(message, cause);
    }
}
