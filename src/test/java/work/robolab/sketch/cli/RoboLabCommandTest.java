package work.robolab.sketch.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.robolab.sketch.generator.CodeGenerationException;

class RoboLabCommandTest {
    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void generatePrintsSketch() throws Exception {
        int exit = run("generate", "-p", fixture("blink.robojson"));

        assertEquals(0, exit);
        assertTrue(out.toString().contains("  digitalWrite(12, HIGH);\n  delay(250);\n  digitalWrite(12, LOW);\n  delay(250);"));
    }

    @Test
    void generateWritesSketchDirectoryAndMapping() throws Exception {
        int exit = run("generate", "-p", fixture("blink.robojson"), "-o", tempDir.toString(), "--mapping");

        assertEquals(0, exit);
        var sketch = tempDir.resolve("blink").resolve("blink.ino");
        assertTrue(Files.readString(sketch).startsWith("#include <Arduino.h>\n"));
        assertTrue(Files.readString(tempDir.resolve("blink").resolve("blink.map.json")).contains("\"n2\""));
    }

    @Test
    void strictGenerateRefusesEmptyLoop() throws Exception {
        int exit = run("generate", "--strict", "-p", fixture("empty-loop.robojson"));

        assertEquals(2, exit);
        assertTrue(err.toString().contains("LOOP_EMPTY") || err.toString().contains("loop() has no executable blocks"));
    }

    @Test
    void validateExitsWithTwoOnErrors() throws Exception {
        assertEquals(2, run("validate", "-p", fixture("empty-loop.robojson")));
        assertTrue(out.toString().contains("LOOP_EMPTY"));
    }

    @Test
    void validateReportsOk() throws Exception {
        assertEquals(0, run("validate", "-p", fixture("blink.robojson")));
        assertTrue(out.toString().startsWith("OK"));
    }

    @Test
    void listsBoardsAndBlocks() {
        assertEquals(0, run("boards"));
        assertTrue(out.toString().contains("arduino:avr:uno"));

        out.getBuffer().setLength(0);
        assertEquals(0, run("blocks", "--category", "timing"));
        assertTrue(out.toString().contains("TM_DELAY"));
        assertFalse(out.toString().contains("LS_LED_ON"));
    }

    @Test
    void missingProjectFileIsShortError() {
        int exit = run("validate", "-p", tempDir.resolve("nope.robojson").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Unable to read project"));
    }

    @Test
    void failedGenerationNamesTheBlock() throws Exception {
        int exit = run("generate", "-p", fixture("unknown-block.robojson"));

        assertEquals(1, exit);
        assertTrue(err.toString().contains("NO_SUCH_BLOCK"));
        assertTrue(err.toString().contains("[block mystery]"));
    }

    @Test
    void errorHandlerAppendsBlockOfGenerationFailure() {
        var commandLine = Main.newCommandLine();
        commandLine.setErr(new PrintWriter(err, true));

        int exit = new ShortErrorHandler().handleExecutionException(
            new CodeGenerationException("Block LS_LED_ON has no section", "led", null), commandLine, null);

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Block LS_LED_ON has no section [block led]"));
    }

    @Test
    void flashRequiresPortAndHex() throws Exception {
        assertEquals(2, run("flash", "-p", fixture("blink.robojson")));
    }

    private int run(String... args) {
        CommandLine commandLine = Main.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String fixture(String name) throws Exception {
        return Path.of(getClass().getResource("/projects/" + name).toURI()).toString();
    }
}
