package work.robolab.sketch.board;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class BoardProfileLoaderTest {
    @Test
    void missingUploadSpeedDefaultsTo115200() throws URISyntaxException {
        var registry = BoardProfileLoader.load(Path.of(getClass().getResource("/boards/no-speed.json").toURI()));
        var uno = registry.get("uno");
        assertEquals(115200, uno.uploadSpeed());
        assertEquals("avrdude", uno.uploadTool());
        assertTrue(uno.supportsDigital(13));
        assertFalse(uno.supportsDigital(14));
        assertTrue(uno.supportsPwm(9));
    }

    @Test
    void boardWithOnlyIdGetsDefaults() throws URISyntaxException {
        var registry = BoardProfileLoader.load(Path.of(getClass().getResource("/boards/no-speed.json").toURI()));
        var bare = registry.get("bare");
        assertEquals("bare", bare.name());
        assertEquals("bare", bare.fqbn());
        assertEquals(BoardProfile.DEFAULT_UPLOAD_SPEED, bare.uploadSpeed());
        assertTrue(bare.pins().digital().isEmpty());
    }

    @Test
    void bundledProfilesIncludeUno() {
        var registry = BoardProfileLoader.bundled();
        assertTrue(registry.ids().contains("uno"));
        assertEquals("arduino:avr:uno", registry.get("uno").fqbn());
        assertEquals(57600, registry.get("nano").uploadSpeed());
    }

    @Test
    void rejectsNonNumericSpeed() {
        var ex = assertThrows(BoardLoadException.class, () -> BoardProfileLoader.fromJson(
            "{\"boards\": [{\"id\": \"x\", \"upload\": {\"speed\": \"fast\"}}]}"
        ));
        assertTrue(ex.getMessage().contains("x"));
    }

    @Test
    void rejectsDocumentsWithoutBoardsOrIds() {
        assertThrows(BoardLoadException.class, () -> BoardProfileLoader.fromJson("{}"));
        assertThrows(BoardLoadException.class, () -> BoardProfileLoader.fromJson("{\"boards\": [{\"name\": \"anon\"}]}"));
        assertThrows(BoardLoadException.class, () -> BoardProfileLoader.fromJson(
            "{\"boards\": [{\"id\": \"x\", \"pins\": {\"digital\": [\"D1\"]}}]}"
        ));
    }

    @Test
    void unknownBoardLookupThrows() {
        assertThrows(UnknownBoardException.class, () -> BoardProfileLoader.bundled().get("pdp11"));
    }
}
