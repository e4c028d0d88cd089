package work.robolab.sketch.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ProgramTest {
    @Test
    void newProgramHasNoRoot() {
        var program = new Program("uno");
        assertFalse(program.hasRoot());
        assertTrue(program.root().isEmpty());
        assertTrue(program.traverse().isEmpty());
    }

    @Test
    void traversesPreOrderInContainerOrder() {
        var program = sample();
        var ids = program.traverse().stream().map(BlockInstance::id).collect(Collectors.toList());
        assertEquals(List.of("start", "init", "if", "led", "wait"), ids);
    }

    @Test
    void rejectsDuplicateIds() {
        var program = sample();
        assertThrows(IllegalArgumentException.class, () -> program.create("led", "LS_LED_OFF"));
    }

    @Test
    void blockHasAtMostOneParent() {
        var program = sample();
        assertThrows(IllegalStateException.class, () -> program.attach("start", "setup", "led"));
    }

    @Test
    void rejectsCyclesAndNestingTheRoot() {
        var program = sample();
        program.detach("if");
        assertThrows(IllegalArgumentException.class, () -> program.attach("led", "body", "if"));
        assertThrows(IllegalStateException.class, () -> program.attach("if", "then", "start"));
    }

    @Test
    void detachedBlocksStayInArenaButLeaveTraversal() {
        var program = sample();
        program.detach("if");
        assertTrue(program.contains("if"));
        assertTrue(program.parentOf("if").isEmpty());
        assertEquals(List.of("start", "init", "wait"),
            program.traverse().stream().map(BlockInstance::id).collect(Collectors.toList()));
        assertEquals(List.of("led"), program.instance("if").childIds("then"));
    }

    @Test
    void removeDropsWholeSubtree() {
        var program = sample();
        program.remove("if");
        assertFalse(program.contains("if"));
        assertFalse(program.contains("led"));
        assertEquals(3, program.size());
        assertEquals(List.of("wait"), program.instance("start").childIds("loop"));
    }

    @Test
    void removingTheRootClearsIt() {
        var program = sample();
        program.remove("start");
        assertFalse(program.hasRoot());
        assertEquals(0, program.size());
    }

    @Test
    void insertPlacesChildAtIndexAndReportsContainer() {
        var program = sample();
        program.create("first", "TM_DELAY");
        program.insert("start", "loop", 0, "first");
        assertEquals(List.of("first", "if", "wait"), program.instance("start").childIds("loop"));
        assertEquals("loop", program.containerOf("first").orElseThrow());
        assertEquals("start", program.parentOf("first").orElseThrow().id());
    }

    @Test
    void nullValueRemovesParameter() {
        var block = new BlockInstance("b", "TM_DELAY").setValue("ms", 10);
        assertTrue(block.hasValue("ms"));
        block.setValue("ms", null);
        assertFalse(block.hasValue("ms"));
    }

    static Program sample() {
        var program = new Program("uno");
        program.create("start", "EV_START");
        program.setRoot("start");
        program.createChild("start", "setup", "init", "SR_BEGIN");
        program.createChild("start", "loop", "if", "CTL_IF").setValue("condition", "digitalRead(2) == LOW");
        program.createChild("if", "then", "led", "LS_LED_ON").setValue("pin", 12);
        program.createChild("start", "loop", "wait", "TM_DELAY").setValue("ms", 500);
        return program;
    }
}
