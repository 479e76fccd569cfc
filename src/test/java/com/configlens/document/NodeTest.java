package com.configlens.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    @DisplayName("标量转换")
    void testScalars() {
        assertSame(Node.NULL, Node.of(null));
        assertEquals(new Node.BoolNode(true), Node.of(true));
        assertEquals(new Node.NumberNode(42), Node.of(42));
        assertEquals(new Node.NumberNode(new BigDecimal("1.5")), Node.of(new BigDecimal("1.5")));
        assertEquals(new Node.StrNode("vpc"), Node.of(new StringBuilder("vpc")));
        assertEquals(new Node.StrNode("x"), Node.of('x'));
        assertEquals(new Node.StrNode("SECONDS"), Node.of(TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("映射保持插入顺序，键转换为字符串")
    void testMapOrder() {
        Map<Object, Object> raw = new LinkedHashMap<>();
        raw.put("zeta", 1);
        raw.put("alpha", 2);
        raw.put(3, "three");

        Node.MapNode node = (Node.MapNode) Node.of(raw);

        assertEquals(List.of("zeta", "alpha", "3"), List.copyOf(node.entries().keySet()));
        assertEquals(new Node.StrNode("three"), node.get("3"));
    }

    @Test
    @DisplayName("数组与集合转换为序列，允许空元素")
    void testSequences() {
        Node.SeqNode fromArray = (Node.SeqNode) Node.of(new Object[]{"a", null, 1});
        Node.SeqNode fromList = (Node.SeqNode) Node.of(Arrays.asList("a", null, 1));

        assertEquals(fromList, fromArray);
        assertSame(Node.NULL, fromArray.items().get(1));
    }

    @Test
    @DisplayName("已是节点时原样返回")
    void testNodePassthrough() {
        Node node = new Node.StrNode("x");
        assertSame(node, Node.of(node));
    }

    @Test
    @DisplayName("不支持的类型报告所在路径")
    void testUnsupportedType() {
        Map<String, Object> raw = Map.of("vars", Map.of("items", List.of("ok", new Object())));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> Node.of(raw));

        assertTrue(exception.getMessage().contains("java.lang.Object"));
        assertTrue(exception.getMessage().contains("vars.items[1]"));
    }

    @Test
    @DisplayName("节点集合不可修改")
    void testImmutable() {
        Node.MapNode map = (Node.MapNode) Node.of(Map.of("a", List.of(1)));
        Node.SeqNode seq = (Node.SeqNode) map.get("a");

        assertThrows(UnsupportedOperationException.class, () -> map.entries().put("b", Node.NULL));
        assertThrows(UnsupportedOperationException.class, () -> seq.items().add(Node.NULL));
    }

    @Test
    @DisplayName("折叠字符串要求正数宽度")
    void testLongStrNodeValidation() {
        assertEquals("text", new Node.LongStrNode("text", 4).value());
        assertThrows(IllegalArgumentException.class, () -> new Node.LongStrNode("text", 0));
        assertThrows(NullPointerException.class, () -> new Node.LongStrNode(null, 4));
    }
}
