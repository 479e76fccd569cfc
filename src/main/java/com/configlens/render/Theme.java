package com.configlens.render;

import java.util.EnumMap;
import java.util.Map;

/**
 * 渲染配色。所有颜色都是完整的 ANSI SGR 前缀，空串表示不着色。
 */
public record Theme(
        Map<ColorTier, String> tierColors,
        String muted,
        String file,
        String lineNumber
) {
    private static final String ANSI_RESET = "\u001B[0m";

    public Theme {
        tierColors = Map.copyOf(tierColors);
    }

    /**
     * 终端默认配色：0-1 绿，2 黄，3 橙，4+ 红。
     */
    public static Theme ansi() {
        Map<ColorTier, String> colors = new EnumMap<>(ColorTier.class);
        colors.put(ColorTier.DEFINED, "\u001B[32m");
        colors.put(ColorTier.SHALLOW, "\u001B[32m");
        colors.put(ColorTier.MEDIUM, "\u001B[33m");
        colors.put(ColorTier.DEEP, "\u001B[38;5;208m");
        colors.put(ColorTier.VERY_DEEP, "\u001B[31m");
        colors.put(ColorTier.COMPUTED, "\u001B[35m");
        return new Theme(colors, "\u001B[90m", "\u001B[1;34m", "\u001B[36m");
    }

    /**
     * 无颜色主题，用于管道输出和测试。
     */
    public static Theme plain() {
        Map<ColorTier, String> colors = new EnumMap<>(ColorTier.class);
        for (ColorTier tier : ColorTier.values()) {
            colors.put(tier, "");
        }
        return new Theme(colors, "", "", "");
    }

    public String colorFor(ColorTier tier) {
        return tierColors.getOrDefault(tier, "");
    }

    public String paint(String text, String color) {
        if (color == null || color.isEmpty() || text.isEmpty()) {
            return text;
        }
        return color + text + ANSI_RESET;
    }
}
