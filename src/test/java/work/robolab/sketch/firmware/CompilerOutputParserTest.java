package work.robolab.sketch.firmware;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.robolab.sketch.catalog.Section;
import work.robolab.sketch.generator.SketchBundle;

class CompilerOutputParserTest {
    @TempDir
    Path tempDir;

    @Test
    void keepsOnlyErrorLines() {
        var output = String.join("\n",
            "blink.ino:8:3: error: 'digitalWrit' was not declared in this scope",
            "blink.ino:9:5: warning: unused variable 'x'",
            "In file included from blink.ino:1:0:",
            "Sketch uses 924 bytes",
            "blink.ino:x:3: error: bogus");

        var errors = CompilerOutputParser.parse(output);

        assertEquals(List.of(new CompileError("blink.ino", 8, 3, "error: 'digitalWrit' was not declared in this scope")), errors);
    }

    @Test
    void windowsPathsKeepTheirDriveLetter() {
        var errors = CompilerOutputParser.parse(
            "C:\\Users\\kid\\sketch\\blink\\blink.ino:8:3: error: 'foo' was not declared in this scope");

        assertEquals(List.of(new CompileError(
            "C:\\Users\\kid\\sketch\\blink\\blink.ino", 8, 3, "error: 'foo' was not declared in this scope")), errors);
    }

    @Test
    void nullOutputYieldsNoErrors() {
        assertTrue(CompilerOutputParser.parse(null).isEmpty());
    }

    @Test
    void errorsAreAttributedToBlocks() {
        var bundle = new SketchBundle("a\nb\n", Map.of("led", List.of(2)), Map.<Section, List<String>>of());
        var errors = List.of(new CompileError("s.ino", 2, 1, "error: x"), new CompileError("s.ino", 1, 1, "error: y"));

        var attributed = CompileErrors.attribute(errors, bundle);

        assertEquals(List.of("led"), attributed.get(errors.get(0)));
        assertEquals(List.of(), attributed.get(errors.get(1)));
    }

    @Test
    void sketchWriterUsesArduinoLayout() throws Exception {
        var bundle = new SketchBundle("void setup() {}\n", Map.of(), Map.<Section, List<String>>of());

        var file = SketchWriter.write(tempDir, "blink", bundle);

        assertEquals(tempDir.resolve("blink").resolve("blink.ino"), file);
        assertEquals("void setup() {}\n", Files.readString(file));
    }
}
