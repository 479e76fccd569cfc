package com.configlens.cli;

import com.configlens.config.Constants;

import java.util.OptionalInt;

/**
 * 终端宽度探测与注释列计算。未连接终端或宽度未知时使用默认注释列。
 */
final class TerminalWidth {

    private TerminalWidth() {
    }

    static OptionalInt detect() {
        if (System.console() == null) {
            return OptionalInt.empty();
        }
        return parse(System.getenv("COLUMNS"));
    }

    static OptionalInt parse(String columns) {
        if (columns == null || columns.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int width = Integer.parseInt(columns.trim());
            return width > 0 ? OptionalInt.of(width) : OptionalInt.empty();
        } catch (NumberFormatException exception) {
            return OptionalInt.empty();
        }
    }

    /**
     * 注释列 = 终端宽度 - 注释预留宽度，且不小于下限。
     */
    static int commentColumn(OptionalInt terminalWidth) {
        if (terminalWidth.isEmpty()) {
            return Constants.DEFAULT_COMMENT_COLUMN;
        }
        return Math.max(Constants.MIN_COMMENT_COLUMN, terminalWidth.getAsInt() - Constants.COMMENT_SPACE);
    }
}
