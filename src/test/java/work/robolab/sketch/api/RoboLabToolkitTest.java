package work.robolab.sketch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.firmware.CommandResult;
import work.robolab.sketch.validate.DiagnosticCode;

class RoboLabToolkitTest {
    @TempDir
    Path tempDir;

    private final RoboLabToolkit toolkit = new RoboLabToolkit(
        ToolkitConfiguration.defaults(),
        command -> new CommandResult(command, 0, "", "")
    );

    @Test
    void generatesFromBundledDefinitions() {
        var program = start("uno");
        program.createChild("start", "loop", "led", "LS_LED_ON").setValue("pin", 13);

        var result = toolkit.generate(program);

        assertEquals(GenerationResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertTrue(result.bundle().orElseThrow().code().contains("digitalWrite(13, HIGH);"));
        assertEquals("uno", result.metadata().get("board"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
    }

    @Test
    void strictModeRefusesInvalidPrograms() {
        var strict = new RoboLabToolkit(ToolkitConfiguration.builder().strict(true).build(), command -> null);
        var program = start("uno");

        var result = strict.generate(program);

        assertEquals(GenerationResult.Status.INVALID, result.status());
        assertEquals(2, result.status().exitCode());
        assertTrue(result.bundle().isEmpty());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.code() == DiagnosticCode.LOOP_EMPTY));
    }

    @Test
    void lenientModeStillGeneratesWithDiagnostics() {
        var result = toolkit.generate(start("uno"));
        assertEquals(GenerationResult.Status.SUCCESS, result.status());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.code() == DiagnosticCode.LOOP_EMPTY));
    }

    @Test
    void generationErrorsBecomeFailures() {
        var program = new Program("uno");
        var result = toolkit.generate(program);

        assertEquals(GenerationResult.Status.FAILURE, result.status());
        assertTrue(String.valueOf(result.metadata().get("error")).contains("no entry block"));
    }

    @Test
    void unknownProgramBoardFallsBackToConfiguredDefault() {
        assertEquals("uno", toolkit.boardFor(start("zx81")).id());
        assertEquals("mega", toolkit.boardFor(start("mega")).id());
        assertEquals("mega", toolkit.board("mega").id());
    }

    @Test
    void savedProjectLoadsBack() {
        var program = start("nano");
        program.createChild("start", "loop", "wait", "TM_DELAY").setValue("ms", 250);
        var file = tempDir.resolve("p.robojson");

        toolkit.saveProject(file, program, "COM9");
        var loaded = toolkit.loadProject(file);

        assertEquals("nano", loaded.boardId());
        assertEquals(List.of("wait"), loaded.instance("start").childIds("loop"));
        assertEquals(250, loaded.instance("wait").value("ms"));
    }

    private static Program start(String board) {
        var program = new Program(board);
        program.create("start", "EV_START");
        program.setRoot("start");
        return program;
    }
}
