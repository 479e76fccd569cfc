package com.configlens.path;

/**
 * 解析栈的一层。键、缩进与数组计数器属于同一个对象，入栈出栈总是一起移动，
 * 出栈后计数器随之丢弃，不会泄漏给同缩进的兄弟层。
 */
final class ParseFrame {
    /** 该层贡献的路径段：键名或 [i] */
    final String key;
    /** 从根到该层的完整路径 */
    final String path;
    /** 该层起始列；后续行缩进 ≤ 此值时出栈 */
    final int indent;
    /** true 表示序列元素层（由 "- " 打开） */
    final boolean element;
    /** 下一个子元素下标，每层独立从 0 开始 */
    int nextIndex;
    /** 直接子行数量 */
    int children;
    /** 子序列与本层键同缩进（紧凑序列） */
    boolean compactSequence;

    private ParseFrame(String key, String path, int indent, boolean element) {
        this.key = key;
        this.path = path;
        this.indent = indent;
        this.element = element;
    }

    static ParseFrame root() {
        return new ParseFrame("", "", -1, false);
    }

    static ParseFrame forKey(ParseFrame parent, String key, int indent) {
        return new ParseFrame(key, join(parent.path, key), indent, false);
    }

    static ParseFrame forElement(ParseFrame parent, int index, int indent) {
        String segment = "[" + index + "]";
        return new ParseFrame(segment, join(parent.path, segment), indent, true);
    }

    int takeIndex() {
        return nextIndex++;
    }

    /**
     * 拼接路径段：下标段直接追加，键段以点分隔，根下不加前缀。
     */
    static String join(String prefix, String segment) {
        if (prefix.isEmpty()) {
            return segment;
        }
        if (segment.startsWith("[")) {
            return prefix + segment;
        }
        return prefix + "." + segment;
    }
}
