package com.configlens.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 按可见宽度折行，保留内嵌的 ANSI 序列且不会从序列中间截断。
 * 优先在空白处断行，宽度内没有空白时才硬切。行首缩进里的空白不作为断点。
 */
public final class LineWrapper {

    private LineWrapper() {
    }

    public static List<String> wrap(String line, int width) {
        if (width <= 0 || Ansi.visibleLength(line) <= width) {
            return List.of(line);
        }

        List<Unit> units = split(line);
        List<String> wrapped = new ArrayList<>();
        List<Unit> current = new ArrayList<>();
        int currentWidth = 0;
        int lastSpace = -1;
        boolean inIndent = true;

        for (Unit unit : units) {
            if (unit.escape()) {
                current.add(unit);
                continue;
            }
            if (currentWidth == width) {
                if (unit.whitespace()) {
                    wrapped.add(join(current, 0, current.size()));
                    current = new ArrayList<>();
                    currentWidth = 0;
                    lastSpace = -1;
                    continue;
                }
                if (lastSpace >= 0) {
                    wrapped.add(join(current, 0, lastSpace));
                    List<Unit> carried = new ArrayList<>(current.subList(lastSpace + 1, current.size()));
                    current = carried;
                    currentWidth = visibleCount(carried);
                } else {
                    wrapped.add(join(current, 0, current.size()));
                    current = new ArrayList<>();
                    currentWidth = 0;
                }
                lastSpace = -1;
            }
            if (!unit.whitespace()) {
                inIndent = false;
            } else if (!inIndent) {
                lastSpace = current.size();
            }
            current.add(unit);
            currentWidth++;
        }
        if (!current.isEmpty()) {
            wrapped.add(join(current, 0, current.size()));
        }
        return wrapped;
    }

    private static List<Unit> split(String line) {
        List<Unit> units = new ArrayList<>();
        int index = 0;
        while (index < line.length()) {
            char current = line.charAt(index);
            if (current == Ansi.ESC) {
                int end = Ansi.escapeEnd(line, index);
                units.add(new Unit(line.substring(index, end), true, false));
                index = end;
                continue;
            }
            int codePoint = line.codePointAt(index);
            int next = index + Character.charCount(codePoint);
            units.add(new Unit(line.substring(index, next), false, codePoint == ' ' || codePoint == '\t'));
            index = next;
        }
        return units;
    }

    private static String join(List<Unit> units, int from, int to) {
        StringBuilder builder = new StringBuilder();
        for (int index = from; index < to; index++) {
            builder.append(units.get(index).text());
        }
        return builder.toString();
    }

    private static int visibleCount(List<Unit> units) {
        int count = 0;
        for (Unit unit : units) {
            if (!unit.escape()) {
                count++;
            }
        }
        return count;
    }

    private record Unit(String text, boolean escape, boolean whitespace) {
    }
}
