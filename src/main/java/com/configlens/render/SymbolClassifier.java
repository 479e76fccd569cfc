package com.configlens.render;

import com.configlens.config.Constants;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceKind;

/**
 * (来源类型, 继承深度) → (符号, 颜色层级)。三种渲染器共用同一套规则：
 * 计算值一律 ∴；深度 0 为当前层定义 ●；深度 ≥ 1 为继承 ○，颜色随深度加深，4 层及以上封顶。
 */
public final class SymbolClassifier {
    /** 深度不超过该值视为"在当前层定义" */
    public static final int DEFINED_DEPTH_THRESHOLD = 0;

    private SymbolClassifier() {
    }

    public static Classification classify(ProvenanceEntry entry) {
        return classify(entry.kind(), entry.depth());
    }

    public static Classification classify(ProvenanceKind kind, int depth) {
        if (kind == ProvenanceKind.COMPUTED) {
            return new Classification(Constants.SYMBOL_COMPUTED, ColorTier.COMPUTED);
        }
        if (depth <= DEFINED_DEPTH_THRESHOLD) {
            return new Classification(Constants.SYMBOL_DEFINED, ColorTier.DEFINED);
        }
        int stepsBeyond = depth - DEFINED_DEPTH_THRESHOLD;
        ColorTier tier;
        if (stepsBeyond == 1) {
            tier = ColorTier.SHALLOW;
        } else if (stepsBeyond == 2) {
            tier = ColorTier.MEDIUM;
        } else if (stepsBeyond == 3) {
            tier = ColorTier.DEEP;
        } else {
            tier = ColorTier.VERY_DEEP;
        }
        return new Classification(Constants.SYMBOL_INHERITED, tier);
    }
}
