package com.configlens.path;

import com.configlens.config.Constants;
import com.configlens.config.RenderConfig;

import java.util.List;
import java.util.Set;

/**
 * 去掉继承作用域前缀，使渲染侧路径与合并记录侧路径可以直接比较。
 * <ul>
 *   <li>{@code components.terraform.vpc.vars.enabled} → {@code vars.enabled}</li>
 *   <li>{@code terraform.vars.tags} → {@code vars.tags}</li>
 *   <li>{@code vars.enabled} → 原样返回</li>
 * </ul>
 */
public class PathNormalizer {
    private final Set<String> namespaces;
    private final Set<String> kinds;

    public PathNormalizer() {
        this(Constants.DEFAULT_SCOPE_NAMESPACES, Constants.DEFAULT_SCOPE_KINDS);
    }

    public PathNormalizer(RenderConfig config) {
        this(config.getScopeNamespaces(), config.getScopeKinds());
    }

    public PathNormalizer(List<String> namespaces, List<String> kinds) {
        this.namespaces = Set.copyOf(namespaces);
        this.kinds = Set.copyOf(kinds);
    }

    public String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        int first = path.indexOf('.');
        if (first < 0) {
            return path;
        }
        String head = path.substring(0, first);
        int second = path.indexOf('.', first + 1);
        String kind = second < 0 ? path.substring(first + 1) : path.substring(first + 1, second);

        // <namespace>.<kind>.<name>[.rest]
        if (namespaces.contains(head) && kinds.contains(kind) && second > 0) {
            int third = path.indexOf('.', second + 1);
            return third < 0 ? "" : path.substring(third + 1);
        }
        // <kind>.rest
        if (kinds.contains(head)) {
            return path.substring(first + 1);
        }
        return path;
    }
}
