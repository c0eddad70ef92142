package com.vibeforge.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeFencesTest {

    @Test
    void testStripsJavascriptFence() {
        String text = "```javascript\nexport default function A() {}\n```\n";

        assertEquals("export default function A() {}", CodeFences.strip(text));
    }

    @Test
    void testStripsJsxFenceWithoutLeavingLanguageTag() {
        assertEquals("const x = 1;", CodeFences.strip("```jsx\nconst x = 1;\n```"));
    }

    @Test
    void testStripsBareFence() {
        assertEquals("{\"a\": 1}", CodeFences.strip("```\n{\"a\": 1}\n```"));
    }

    @Test
    void testLeavesUnfencedCodeAlone() {
        assertEquals("const y = 2;", CodeFences.strip("  const y = 2;\n"));
    }

    @Test
    void testNullBecomesEmpty() {
        assertEquals("", CodeFences.strip(null));
    }
}
