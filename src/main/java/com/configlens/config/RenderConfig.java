package com.configlens.config;

import com.configlens.render.Theme;

import java.util.List;

/**
 * 渲染运行时配置
 *
 * 由调用方（CLI 或上层服务）显式传入各渲染器，覆盖 Constants 默认值
 */
public class RenderConfig {
    private int commentColumn = Constants.DEFAULT_COMMENT_COLUMN;
    private int indentWidth = Constants.DEFAULT_INDENT_WIDTH;
    private String rootLabel = Constants.DEFAULT_ROOT_LABEL;
    private String filePrefix = Constants.DEFAULT_FILE_PREFIX;
    private List<String> scopeNamespaces = Constants.DEFAULT_SCOPE_NAMESPACES;
    private List<String> scopeKinds = Constants.DEFAULT_SCOPE_KINDS;
    private String renameFrom = Constants.DEFAULT_RENAME_FROM;
    private String renameTo = Constants.DEFAULT_RENAME_TO;
    private Theme theme = Theme.ansi();
    private boolean colorEnabled = true;

    public int getCommentColumn() {
        return commentColumn;
    }

    public void setCommentColumn(int commentColumn) {
        this.commentColumn = commentColumn;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public void setIndentWidth(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    public String getRootLabel() {
        return rootLabel;
    }

    public void setRootLabel(String rootLabel) {
        this.rootLabel = rootLabel;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public void setFilePrefix(String filePrefix) {
        this.filePrefix = filePrefix;
    }

    public List<String> getScopeNamespaces() {
        return scopeNamespaces;
    }

    public void setScopeNamespaces(List<String> scopeNamespaces) {
        this.scopeNamespaces = List.copyOf(scopeNamespaces);
    }

    public List<String> getScopeKinds() {
        return scopeKinds;
    }

    public void setScopeKinds(List<String> scopeKinds) {
        this.scopeKinds = List.copyOf(scopeKinds);
    }

    public String getRenameFrom() {
        return renameFrom;
    }

    public void setRenameFrom(String renameFrom) {
        this.renameFrom = renameFrom;
    }

    public String getRenameTo() {
        return renameTo;
    }

    public void setRenameTo(String renameTo) {
        this.renameTo = renameTo;
    }

    public Theme getTheme() {
        return theme;
    }

    public void setTheme(Theme theme) {
        this.theme = theme;
    }

    public boolean isColorEnabled() {
        return colorEnabled;
    }

    /**
     * 关闭颜色时同时切换为无色主题
     */
    public void setColorEnabled(boolean colorEnabled) {
        this.colorEnabled = colorEnabled;
        if (!colorEnabled) {
            this.theme = Theme.plain();
        }
    }

    /**
     * 长字符串折行宽度，跟随注释列。
     */
    public int getWrapWidth() {
        return commentColumn - Constants.WRAP_BUFFER;
    }

    /**
     * 使用默认配置创建实例
     */
    public static RenderConfig defaults() {
        return new RenderConfig();
    }

    /**
     * 无颜色的默认配置
     */
    public static RenderConfig plain() {
        RenderConfig config = new RenderConfig();
        config.setColorEnabled(false);
        return config;
    }
}
