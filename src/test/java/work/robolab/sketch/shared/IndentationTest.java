package work.robolab.sketch.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class IndentationTest {
    @Test
    void indentsEveryNonBlankLine() {
        assertEquals("    a\n\n    b", Indentation.indent("a\n  \nb", 2));
    }

    @Test
    void levelZeroBlanksWhitespaceOnlyLines() {
        assertEquals("a\n\nb", Indentation.indent("a\n   \nb", 0));
    }

    @Test
    void emptyTextStaysEmpty() {
        assertEquals("", Indentation.indent("", 3));
        assertEquals("", Indentation.indent(null, 1));
    }

    @Test
    void linesIgnoreSingleTrailingNewlineAndCarriageReturns() {
        assertEquals(List.of("a", "b"), Indentation.lines("a\r\nb\n"));
        assertEquals(List.of("a", ""), Indentation.lines("a\n\n"));
        assertTrue(Indentation.lines("").isEmpty());
    }
}
