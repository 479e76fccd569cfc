package com.configlens.render;

/**
 * 按继承深度划分的颜色层级，越深越醒目。
 */
public enum ColorTier {
    /** 深度 0：当前文件定义 */
    DEFINED,
    /** 深度 1：浅层继承 */
    SHALLOW,
    /** 深度 2 */
    MEDIUM,
    /** 深度 3 */
    DEEP,
    /** 深度 ≥ 4 */
    VERY_DEEP,
    /** 计算/模板生成，与深度无关 */
    COMPUTED
}
