package org.dxworks.markframe.reader.markdown.block;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LineTest {

    @Test
    void scan_countsSpaces() {
        Line line = Line.scan("  foo", 0);
        assertEquals(2, line.indent());
        assertEquals(2, line.column());
        assertEquals("foo", line.text());
    }

    @Test
    void scan_tabAdvancesToNextStop() {
        assertEquals(4, Line.scan("\tfoo", 0).indent());
        assertEquals(4, Line.scan(" \tfoo", 0).indent());
        assertEquals(8, Line.scan("    \tfoo", 0).indent());
    }

    @Test
    void scan_tabStopsUseAbsoluteColumn() {
        Line line = Line.scan("\tfoo", 2);
        assertEquals(2, line.indent());
        assertEquals(4, line.column());
    }

    @Test
    void rest_rescansAfterMarker() {
        Line quoted = Line.scan("> \tfoo", 0).rest();
        assertEquals(3, quoted.indent());
        assertEquals("foo", quoted.text());
        assertEquals("  foo", quoted.withoutIndent(1).content());
    }

    @Test
    void after_skipsListMarker() {
        Line content = Line.scan("10. item", 0).after(3);
        assertEquals(1, content.indent());
        assertEquals(4, content.column());
        assertEquals("item", content.text());
    }

    @Test
    void blankLine() {
        Line line = Line.scan(" \t ", 0);
        assertTrue(line.isBlank());
        assertEquals(5, line.indent());
    }

    @Test
    void withoutIndent_neverGoesNegative() {
        assertEquals("x", Line.scan("  x", 0).withoutIndent(5).content());
    }
}
