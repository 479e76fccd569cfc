package com.configlens.path;

import com.configlens.yaml.AnsiYamlHighlighter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 路径重建测试
 */
class PathReconstructorTest {
    private final PathReconstructor reconstructor = new PathReconstructor();

    @Test
    @DisplayName("嵌套映射按缩进拼接键路径")
    void testNestedMappings() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "vars:",
                "  name: vpc",
                "  tags:",
                "    team: platform",
                "settings:",
                "  enabled: true"));

        assertPath(addresses, 0, "vars");
        assertPath(addresses, 1, "vars.name");
        assertPath(addresses, 2, "vars.tags");
        assertPath(addresses, 3, "vars.tags.team");
        assertPath(addresses, 4, "settings");
        assertPath(addresses, 5, "settings.enabled");
    }

    @Test
    @DisplayName("标量数组元素获得下标路径")
    void testScalarArray() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "vars:",
                "  tags:",
                "    - a",
                "    - b",
                "    - c"));

        assertPath(addresses, 2, "vars.tags[0]");
        assertPath(addresses, 3, "vars.tags[1]");
        assertPath(addresses, 4, "vars.tags[2]");
    }

    @Test
    @DisplayName("对象数组的兄弟键共享同一下标")
    void testArrayOfMaps() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "subnets:",
                "  - name: public",
                "    size: 24",
                "  - name: private",
                "    size: 20",
                "region: us-east-2"));

        assertPath(addresses, 1, "subnets[0].name");
        assertPath(addresses, 2, "subnets[0].size");
        assertPath(addresses, 3, "subnets[1].name");
        assertPath(addresses, 4, "subnets[1].size");
        assertPath(addresses, 5, "region");
    }

    @Test
    @DisplayName("根级数组第三个元素下标为 2")
    void testRootSequenceIndexing() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "- a",
                "- b",
                "- c"));

        assertPath(addresses, 0, "[0]");
        assertPath(addresses, 1, "[1]");
        assertPath(addresses, 2, "[2]");
    }

    @Test
    @DisplayName("根级对象数组")
    void testRootSequenceOfMaps() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "- name: a",
                "  port: 1",
                "- name: b"));

        assertPath(addresses, 0, "[0].name");
        assertPath(addresses, 1, "[0].port");
        assertPath(addresses, 2, "[1].name");
    }

    @Test
    @DisplayName("vars.items 标量数组")
    void testVarsItemsScalarArray() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(
                "vars:\n  items:\n    - scalar1\n    - scalar2");

        assertPath(addresses, 2, "vars.items[0]");
        assertPath(addresses, 3, "vars.items[1]");
    }

    @Test
    @DisplayName("vars.items 对象数组")
    void testVarsItemsArrayOfMaps() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(
                "vars:\n  items:\n    - name: widget\n      color: blue\n    - name: gadget\n      color: red");

        assertPath(addresses, 2, "vars.items[0].name");
        assertPath(addresses, 3, "vars.items[0].color");
        assertPath(addresses, 4, "vars.items[1].name");
        assertPath(addresses, 5, "vars.items[1].color");
    }

    @Test
    @DisplayName("根级三个元素各含嵌套映射时下标依次递增")
    void testRootElementsWithNestedMapsEnumerate() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "- metadata:",
                "    name: alpha",
                "    id: 1",
                "- metadata:",
                "    name: beta",
                "    id: 2",
                "- metadata:",
                "    name: gamma",
                "    id: 3"));

        for (int element = 0; element < 3; element++) {
            int line = element * 3;
            assertPath(addresses, line, "[" + element + "].metadata");
            assertPath(addresses, line + 1, "[" + element + "].metadata.name");
            assertPath(addresses, line + 2, "[" + element + "].metadata.id");
        }
    }

    @Test
    @DisplayName("同缩进的两个数组下标互不干扰")
    void testSiblingArraysHaveIndependentCounters() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "first:",
                "  - a",
                "  - b",
                "second:",
                "  - c"));

        assertPath(addresses, 2, "first[1]");
        assertPath(addresses, 4, "second[0]");
    }

    @Test
    @DisplayName("嵌套数组 - - x")
    void testNestedSequences() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "matrix:",
                "  - - 1",
                "    - 2",
                "  - - 3"));

        assertPath(addresses, 1, "matrix[0][0]");
        assertPath(addresses, 2, "matrix[0][1]");
        assertPath(addresses, 3, "matrix[1][0]");
    }

    @Test
    @DisplayName("数组元素内的嵌套映射")
    void testMappingInsideArrayElement() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "rules:",
                "  - match:",
                "      host: example.com",
                "    action: allow",
                "  - action: deny"));

        assertPath(addresses, 1, "rules[0].match");
        assertPath(addresses, 2, "rules[0].match.host");
        assertPath(addresses, 3, "rules[0].action");
        assertPath(addresses, 4, "rules[1].action");
    }

    @Test
    @DisplayName("块标量续行与起始键共享路径且不是键行")
    void testBlockScalarContinuation() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "vars:",
                "  script: |-",
                "    echo one",
                "    name: not-a-key",
                "  name: x"));

        assertPath(addresses, 1, "vars.script");
        assertTrue(addresses.get(1).keyLine());

        LineAddress continuation = addresses.get(3);
        assertEquals("vars.script", continuation.path());
        assertTrue(continuation.continuation());
        assertFalse(continuation.keyLine());
        assertTrue(addresses.get(2).continuation());

        assertPath(addresses, 4, "vars.name");
    }

    @Test
    @DisplayName("数组中的块标量")
    void testBlockScalarInSequence() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "commands:",
                "  - |",
                "    make build",
                "  - make test"));

        assertPath(addresses, 1, "commands[0]");
        assertEquals("commands[0]", addresses.get(2).path());
        assertTrue(addresses.get(2).continuation());
        assertPath(addresses, 3, "commands[1]");
    }

    @Test
    @DisplayName("着色文本与纯文本得到相同路径")
    void testAnsiInputMatchesPlain() throws Exception {
        String plain = String.join("\n",
                "vars:",
                "  tags:",
                "    - a",
                "  subnets:",
                "    - name: public",
                "      size: 24",
                "enabled: true");
        String colored = new AnsiYamlHighlighter().highlight(plain);
        assertNotEquals(plain, colored);

        assertEquals(reconstructor.reconstruct(plain), reconstructor.reconstruct(colored));
    }

    @Test
    @DisplayName("空行、注释和文档分隔符不产生地址")
    void testBlankCommentAndMarkerLines() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "---",
                "# header",
                "vars:",
                "",
                "  # inner",
                "  name: vpc"));

        assertFalse(addresses.containsKey(0));
        assertFalse(addresses.containsKey(1));
        assertFalse(addresses.containsKey(3));
        assertFalse(addresses.containsKey(4));
        assertPath(addresses, 2, "vars");
        assertPath(addresses, 5, "vars.name");
    }

    @Test
    @DisplayName("序列与父键同缩进的紧凑写法")
    void testCompactSequence() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "tags:",
                "- a",
                "- b",
                "name: x"));

        assertPath(addresses, 1, "tags[0]");
        assertPath(addresses, 2, "tags[1]");
        assertPath(addresses, 3, "name");
    }

    @Test
    @DisplayName("带引号的键与值中的冒号")
    void testQuotedKeysAndColonsInValues() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "\"app.kubernetes.io/name\": web",
                "url: http://example.com:8080",
                "flow: {a: 1}"));

        assertPath(addresses, 0, "app.kubernetes.io/name");
        assertPath(addresses, 1, "url");
        assertPath(addresses, 2, "flow");
    }

    @Test
    @DisplayName("空集合值不吞掉后续兄弟键")
    void testEmptyCollectionsKeepSiblings() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct(String.join("\n",
                "backend: {}",
                "overrides: []",
                "vars:",
                "  name: x"));

        assertPath(addresses, 0, "backend");
        assertPath(addresses, 1, "overrides");
        assertPath(addresses, 3, "vars.name");
    }

    @Test
    @DisplayName("重复重建结果一致")
    void testIdempotent() {
        List<String> lines = List.of("vars:", "  tags:", "    - a", "    - b");
        Map<Integer, LineAddress> first = reconstructor.reconstruct(lines);
        Map<Integer, LineAddress> second = reconstructor.reconstruct(lines);

        assertEquals(first, second);
        assertEquals(first, reconstructor.reconstruct(String.join("\n", lines)));
    }

    @Test
    @DisplayName("返回结果不可修改")
    void testResultIsUnmodifiable() {
        Map<Integer, LineAddress> addresses = reconstructor.reconstruct("a: 1");
        assertThrows(UnsupportedOperationException.class,
                () -> addresses.put(5, new LineAddress("x", true, false)));
    }

    private static void assertPath(Map<Integer, LineAddress> addresses, int line, String expected) {
        LineAddress address = addresses.get(line);
        assertNotNull(address, "第 " + line + " 行应有地址");
        assertEquals(expected, address.path(), "第 " + line + " 行路径");
        assertTrue(address.keyLine(), "第 " + line + " 行应为键行");
    }
}
