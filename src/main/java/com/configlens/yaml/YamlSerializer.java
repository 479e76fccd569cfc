package com.configlens.yaml;

import com.configlens.document.Node;

import java.io.IOException;

/**
 * 文档 → YAML 文本。
 */
public interface YamlSerializer {

    String serialize(Node document, int indentWidth) throws IOException;
}
