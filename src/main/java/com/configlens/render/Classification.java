package com.configlens.render;

public record Classification(String symbol, ColorTier tier) {
}
