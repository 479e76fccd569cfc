package com.configlens.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineWrapperTest {

    @Test
    @DisplayName("未超宽时原样返回")
    void testShortLine() {
        assertEquals(List.of("short"), LineWrapper.wrap("short", 10));
        assertEquals(List.of("exactly10!"), LineWrapper.wrap("exactly10!", 10));
        assertEquals(List.of("anything"), LineWrapper.wrap("anything", 0));
    }

    @Test
    @DisplayName("在最后一个空白处断行且丢弃该空白")
    void testBreakAtWhitespace() {
        assertEquals(List.of("alpha beta", "gamma"), LineWrapper.wrap("alpha beta gamma", 12));
        assertEquals(List.of("aaaa", "bbbb"), LineWrapper.wrap("aaaa bbbb", 4));
    }

    @Test
    @DisplayName("没有空白时硬切")
    void testHardWrap() {
        assertEquals(List.of("abcd", "efgh", "ij"), LineWrapper.wrap("abcdefghij", 4));
    }

    @Test
    @DisplayName("行首缩进不作为断点，不产生只有空白的行")
    void testIndentIsNotABreakPoint() {
        String line = "        " + "a".repeat(24);

        List<String> wrapped = LineWrapper.wrap(line, 20);

        assertEquals(List.of("        " + "a".repeat(12), "a".repeat(12)), wrapped);
    }

    @Test
    @DisplayName("缩进之后的空白仍可断行")
    void testBreakAfterIndentedKey() {
        String line = "        key: " + "a".repeat(30);

        List<String> wrapped = LineWrapper.wrap(line, 20);

        assertEquals("        key:", wrapped.get(0));
        for (String part : wrapped) {
            assertFalse(part.isBlank(), wrapped.toString());
            assertTrue(part.length() <= 20, part);
        }
    }

    @Test
    @DisplayName("转义序列不计宽度且不会被截断")
    void testAnsiPreserved() {
        String blue = "\u001B[34m";
        String reset = "\u001B[0m";
        String line = blue + "abcdef" + reset + " ghij";

        List<String> wrapped = LineWrapper.wrap(line, 6);

        assertEquals(2, wrapped.size());
        assertEquals(blue + "abcdef" + reset, wrapped.get(0));
        assertEquals("ghij", wrapped.get(1));
        for (String part : wrapped) {
            assertTrue(Ansi.visibleLength(part) <= 6);
        }
        assertEquals("abcdefghij", Ansi.strip(String.join("", wrapped)));
    }

    @Test
    @DisplayName("每段宽度都不超过上限")
    void testWidthBound() {
        String line = "key: " + "lorem ipsum dolor sit amet ".repeat(6);
        for (String part : LineWrapper.wrap(line, 15)) {
            assertTrue(Ansi.visibleLength(part) <= 15, part);
        }
    }
}
