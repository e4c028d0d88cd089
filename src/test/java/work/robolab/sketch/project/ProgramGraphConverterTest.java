package work.robolab.sketch.project;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockCatalogLoader;

class ProgramGraphConverterTest {
    private final BlockCatalog catalog = BlockCatalogLoader.bundled();
    private final ProgramGraphConverter converter = new ProgramGraphConverter(catalog);

    @Test
    void chainsSuccessorsIntoTheEventLoop() throws URISyntaxException {
        var document = ProjectFiles.read(Path.of(getClass().getResource("/projects/blink.robojson").toURI()), catalog);

        var program = converter.toProgram(document);

        assertEquals("n1", program.root().orElseThrow().id());
        assertEquals(List.of("n2", "n3", "n4", "n5"), program.instance("n1").childIds("loop"));
        assertTrue(program.parentOf("n6").isEmpty());
        assertEquals("uno", program.boardId());
        assertEquals(12, program.instance("n2").value("pin"));
    }

    @Test
    void successorEdgesMayArriveBeforeTheirAnchor() {
        var document = new ProjectDocument(1, "uno", null,
            List.of(node("s", "EV_START"), node("a", "TM_DELAY"), node("b", "TM_DELAY"), node("c", "TM_DELAY")),
            List.of(
                new ProjectEdge("b", "next", "c", "in"),
                new ProjectEdge("a", "next", "b", "in"),
                new ProjectEdge("s", "loop", "a", "in")
            ));

        var program = converter.toProgram(document);

        assertEquals(List.of("a", "b", "c"), program.instance("s").childIds("loop"));
    }

    @Test
    void undeclaredEventPortFallsIntoLoop() {
        var document = new ProjectDocument(1, "uno", null,
            List.of(node("s", "EV_START"), node("a", "TM_DELAY")),
            List.of(new ProjectEdge("s", "out", "a", "in")));

        assertEquals(List.of("a"), converter.toProgram(document).instance("s").childIds("loop"));
    }

    @Test
    void secondParentIsRejected() {
        var document = new ProjectDocument(1, "uno", null,
            List.of(node("s", "EV_START"), node("i", "CTL_IF"), node("a", "TM_DELAY")),
            List.of(
                new ProjectEdge("s", "loop", "i", "in"),
                new ProjectEdge("i", "then", "a", "in"),
                new ProjectEdge("s", "setup", "a", "in")
            ));

        assertThrows(ProjectFormatException.class, () -> converter.toProgram(document));
    }

    @Test
    void duplicateUidsAreRejected() {
        var document = new ProjectDocument(1, "uno", null, List.of(node("s", "EV_START"), node("s", "TM_DELAY")), List.of());
        assertThrows(ProjectFormatException.class, () -> converter.toProgram(document));
    }

    @Test
    void unplacedChainsStayDetachedAndSurviveSaving() {
        var document = new ProjectDocument(1, "uno", null,
            List.of(node("s", "EV_START"), node("x", "TM_DELAY"), node("y", "TM_DELAY")),
            List.of(new ProjectEdge("x", "next", "y", "in")));

        var program = converter.toProgram(document);
        assertTrue(program.parentOf("y").isEmpty());

        var saved = converter.toDocument(program, null);
        assertTrue(saved.edges().contains(new ProjectEdge("x", "next", "y", "in")));
    }

    @Test
    void programSurvivesRoundTrip() {
        var program = new Program("nano");
        program.create("start", "EV_START");
        program.setRoot("start");
        program.createChild("start", "setup", "serial", "SR_BEGIN").setValue("baud", 115200);
        program.createChild("start", "loop", "if", "CTL_IF_ELSE").setValue("condition", "digitalRead(2) == LOW");
        program.createChild("if", "then", "on", "LS_LED_ON").setValue("pin", 12);
        program.createChild("if", "then", "pause", "TM_DELAY").setValue("ms", 100);
        program.createChild("if", "else", "off", "LS_LED_OFF").setValue("pin", 12);
        program.createChild("start", "loop", "wait", "TM_DELAY");
        program.create("loose", "SR_PRINTLN").setValue("text", "\"idle\"");
        program.createChild("loose", "custom", "under", "TM_DELAY");

        var document = converter.toDocument(program, "COM7");
        var restored = converter.toProgram(document);

        assertEquals("COM7", document.port());
        assertEquals("nano", restored.boardId());
        assertEquals("start", restored.root().orElseThrow().id());
        assertEquals(program.size(), restored.size());
        for (var instance : program.instances()) {
            var copy = restored.instance(instance.id());
            assertEquals(instance.definitionId(), copy.definitionId());
            assertEquals(instance.values(), copy.values());
            assertEquals(instance.containerNames(), copy.containerNames());
            for (var container : instance.containerNames()) {
                assertEquals(instance.childIds(container), copy.childIds(container));
            }
        }
        assertTrue(restored.parentOf("loose").isEmpty());
    }

    @Test
    void looselyTypedLayoutFallsBackPerAxis() {
        var program = new Program("uno");
        program.create("start", "EV_START");
        program.setRoot("start");
        program.create("wait", "TM_DELAY");
        program.create("note", "TM_DELAY");
        program.metadata().put(ProgramGraphConverter.LAYOUT_KEY, Map.of(
            "start", Map.of("x", 10, "y", 20L),
            "wait", Map.of("y", "far"),
            "note", "nowhere"));

        var nodes = converter.toDocument(program, "COM3").nodes();

        assertEquals(10.0, nodes.get(0).x());
        assertEquals(20.0, nodes.get(0).y());
        assertEquals(260.0, nodes.get(1).x());
        assertEquals(40.0, nodes.get(1).y());
        assertEquals(480.0, nodes.get(2).x());
    }

    @Test
    void savedLayoutIsReused() {
        var document = new ProjectDocument(1, "uno", null,
            List.of(new ProjectNode("s", "EV_START", 15, 25, Map.of())),
            List.of());

        var saved = converter.toDocument(converter.toProgram(document), null);

        assertEquals(15.0, saved.nodes().get(0).x());
        assertEquals(25.0, saved.nodes().get(0).y());
    }

    private static ProjectNode node(String uid, String type) {
        return new ProjectNode(uid, type, 0, 0, Map.of());
    }
}
