package com.configlens.path;

/**
 * 渲染文本中一行对应的逻辑地址。
 *
 * @param path         逻辑路径，如 {@code vars.items[1].name}
 * @param keyLine      是否为键行（或序列元素行），只有键行会被标注
 * @param continuation 是否为多行块标量的续行，续行与起始键行共享路径
 */
public record LineAddress(String path, boolean keyLine, boolean continuation) {

    static LineAddress key(String path) {
        return new LineAddress(path, true, false);
    }

    static LineAddress continuationOf(String path) {
        return new LineAddress(path, false, true);
    }
}
