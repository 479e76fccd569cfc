package com.configlens.config;

import java.util.List;

/**
 * 全局常量定义
 *
 * 包含来源符号、注释列参数、序列化参数和渲染布局参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 来源符号 ====================
    /** 当前层级定义的值 U+25CF */
    public static final String SYMBOL_DEFINED = "●";
    /** 继承/导入的值 U+25CB */
    public static final String SYMBOL_INHERITED = "○";
    /** 计算/模板生成的值 */
    public static final String SYMBOL_COMPUTED = "∴";
    /** 计算值在树形视图中的伪文件名 */
    public static final String COMPUTED_PSEUDO_FILE = "<computed>";

    // ==================== 注释列参数 ====================
    /** 非终端输出时的默认注释列 */
    public static final int DEFAULT_COMMENT_COLUMN = 50;
    /** 注释列下限，保证 YAML 至少有这么宽 */
    public static final int MIN_COMMENT_COLUMN = 40;
    /** 注释本身（# ● [N] file:line）预留的宽度 */
    public static final int COMMENT_SPACE = 60;
    /** 长字符串折行阈值 = 注释列 - 该缓冲 */
    public static final int WRAP_BUFFER = 10;

    // ==================== 序列化参数 ====================
    /** 默认 YAML 缩进宽度 */
    public static final int DEFAULT_INDENT_WIDTH = 2;
    /** 空段过滤时检查的数组下标上限 */
    public static final int MAX_ARRAY_CHECKS = 1000;

    // ==================== 布局参数 ====================
    /** 树形标题下划线宽度 */
    public static final int HEADER_RULE_WIDTH = 60;
    /** 并排视图默认左栏宽度 */
    public static final int DEFAULT_LEFT_WIDTH = 80;
    /** 并排视图左栏为填充保留的字符数 */
    public static final int LEFT_COLUMN_GUTTER = 2;
    /** 树形视图根标签 */
    public static final String DEFAULT_ROOT_LABEL = "stacks/";
    /** 注释中省略的文件路径前缀 */
    public static final String DEFAULT_FILE_PREFIX = "stacks/";

    // ==================== 路径归一化参数 ====================
    /** 三段式作用域前缀的命名空间 */
    public static final List<String> DEFAULT_SCOPE_NAMESPACES = List.of("components");
    /** 作用域前缀中的组件类型 */
    public static final List<String> DEFAULT_SCOPE_KINDS = List.of("terraform", "helmfile", "packer");

    // ==================== 预处理参数 ====================
    /** 与清单 schema 对齐时被重命名的根键 */
    public static final String DEFAULT_RENAME_FROM = "imports";
    /** 重命名后的根键 */
    public static final String DEFAULT_RENAME_TO = "import";
}
