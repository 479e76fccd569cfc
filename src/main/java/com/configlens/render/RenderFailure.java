package com.configlens.render;

/**
 * 渲染边界上把异常转换为终端可读文本。
 */
final class RenderFailure {

    private RenderFailure() {
    }

    static String describe(Exception exception) {
        String message = exception.getMessage();
        if (message == null || message.isBlank()) {
            message = exception.getClass().getSimpleName();
        }
        return "Error rendering: " + message + "\n";
    }
}
