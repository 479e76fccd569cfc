package com.configlens.path;

import com.configlens.text.Ansi;
import com.configlens.yaml.YamlLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从已序列化、已着色的 YAML 文本重建每一行的逻辑路径。
 *
 * 只依据缩进与标点（{@code - }、{@code :}、块标记）判断结构，单次前向扫描。
 * 空行、注释行和文档分隔符不产生地址，也不影响解析栈。
 */
public class PathReconstructor {
    private static final Logger logger = LoggerFactory.getLogger(PathReconstructor.class);

    public Map<Integer, LineAddress> reconstruct(String text) {
        return reconstruct(Arrays.asList(text.split("\n", -1)));
    }

    /**
     * @return 行号（从 0 开始）→ 地址，按行号升序
     */
    public Map<Integer, LineAddress> reconstruct(List<String> lines) {
        Map<Integer, LineAddress> addresses = new LinkedHashMap<>();
        Deque<ParseFrame> stack = new ArrayDeque<>();
        stack.push(ParseFrame.root());

        String blockPath = null;
        int blockIndent = -1;

        for (int lineNumber = 0; lineNumber < lines.size(); lineNumber++) {
            String plain = Ansi.strip(lines.get(lineNumber));
            int indent = leadingSpaces(plain);
            String content = plain.substring(indent).stripTrailing();
            if (content.isEmpty()) {
                continue;
            }

            if (blockPath != null) {
                if (indent > blockIndent) {
                    addresses.put(lineNumber, LineAddress.continuationOf(blockPath));
                    continue;
                }
                blockPath = null;
            }

            if (YamlLines.isComment(content) || YamlLines.isDocumentMarker(content)) {
                continue;
            }

            popFrames(stack, indent, YamlLines.isSequenceMarker(content));
            stack.peek().children++;

            Outcome outcome = processLine(stack, indent, content);
            if (outcome.address() != null) {
                addresses.put(lineNumber, outcome.address());
            }
            if (outcome.blockIndent() >= 0) {
                blockPath = outcome.address().path();
                blockIndent = outcome.blockIndent();
            }
        }

        logger.debug("路径重建完成: {} 行, {} 个地址", lines.size(), addresses.size());
        return Collections.unmodifiableMap(addresses);
    }

    /**
     * 出栈所有缩进 ≥ 当前行的层，根层永不出栈。
     * 序列行与尚无其他子行的同缩进键层视为紧凑序列，保留该键层。
     */
    private void popFrames(Deque<ParseFrame> stack, int indent, boolean sequenceLine) {
        while (stack.size() > 1) {
            ParseFrame top = stack.peek();
            if (top.indent < indent) {
                return;
            }
            if (sequenceLine && top.indent == indent && !top.element
                    && (top.children == 0 || top.compactSequence)) {
                top.compactSequence = true;
                return;
            }
            stack.pop();
        }
    }

    private Outcome processLine(Deque<ParseFrame> stack, int indent, String content) {
        int column = indent;
        String rest = content;

        // 每个 "- " 打开所属数组的下一个元素；嵌套数组 "- - x" 逐个处理
        while (YamlLines.isSequenceMarker(rest)) {
            String after = rest.length() == 1 ? "" : rest.substring(2);
            int extraSpaces = leadingSpaces(after);
            after = after.substring(extraSpaces);

            ParseFrame owner = stack.peek();
            int index = owner.takeIndex();

            if (!after.isEmpty() && !YamlLines.isSequenceMarker(after)
                    && YamlLines.keySeparatorIndex(after) < 0) {
                String path = ParseFrame.join(owner.path, "[" + index + "]");
                int blockIndent = YamlLines.isBlockIndicator(after) ? column : -1;
                return new Outcome(LineAddress.key(path), blockIndent);
            }

            ParseFrame element = ParseFrame.forElement(owner, index, column);
            stack.push(element);
            if (after.isEmpty()) {
                return new Outcome(LineAddress.key(element.path), -1);
            }
            element.children++;
            column = column + 2 + extraSpaces;
            rest = after;
        }

        int separator = YamlLines.keySeparatorIndex(rest);
        ParseFrame parent = stack.peek();
        if (separator < 0) {
            // 键之外的裸标量（如多行纯量的后续行），归属当前层，不单独标注
            if (parent.path.isEmpty()) {
                return new Outcome(null, -1);
            }
            return new Outcome(LineAddress.continuationOf(parent.path), -1);
        }

        String key = YamlLines.keyText(rest, separator);
        String value = YamlLines.valueText(rest, separator);
        if (value.startsWith("#")) {
            value = "";
        }
        String path = ParseFrame.join(parent.path, key);
        if (YamlLines.opensNestedScope(value)) {
            stack.push(ParseFrame.forKey(parent, key, column));
        }
        int blockIndent = YamlLines.isBlockIndicator(value) ? column : -1;
        return new Outcome(LineAddress.key(path), blockIndent);
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private record Outcome(LineAddress address, int blockIndent) {
    }
}
