package work.robolab.sketch.board;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.shared.JsonValues;
import work.robolab.sketch.shared.Values;

/**
 * Reads {@code {"boards": [...]}} documents into a {@link BoardRegistry}.
 */
public final class BoardProfileLoader {
    private static final Logger LOG = LoggerFactory.getLogger(BoardProfileLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final String BUNDLED_BOARDS = "/robolab/boards.json";

    private BoardProfileLoader() {}

    public static BoardRegistry load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new BoardLoadException("Board profiles not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return fromTree(JSON.readTree(in));
        } catch (IOException ex) {
            throw new BoardLoadException("Invalid board profiles " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static BoardRegistry bundled() {
        try (InputStream in = BoardProfileLoader.class.getResourceAsStream(BUNDLED_BOARDS)) {
            if (in == null) {
                throw new BoardLoadException("Bundled board profiles missing: " + BUNDLED_BOARDS);
            }
            return fromTree(JSON.readTree(in));
        } catch (IOException ex) {
            throw new BoardLoadException("Unable to read bundled board profiles: " + ex.getMessage(), ex);
        }
    }

    public static BoardRegistry fromJson(String text) {
        try {
            return fromTree(JSON.readTree(text));
        } catch (IOException ex) {
            throw new BoardLoadException("Invalid board profiles JSON: " + ex.getMessage(), ex);
        }
    }

    public static BoardRegistry fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new BoardLoadException("Board profiles document must be an object");
        }
        var boards = root.get("boards");
        if (boards == null || !boards.isArray()) {
            throw new BoardLoadException("Board profiles document has no 'boards' array");
        }
        var profiles = new ArrayList<BoardProfile>();
        int index = 0;
        for (var board : boards) {
            index++;
            profiles.add(readBoard(board, index));
        }
        LOG.debug("Loaded {} board profiles", profiles.size());
        return new BoardRegistry(profiles);
    }

    private static BoardProfile readBoard(JsonNode node, int index) {
        var id = JsonValues.text(node, "id");
        if (!node.isObject() || id == null) {
            throw new BoardLoadException("Board #" + index + " has no id");
        }
        var upload = Optional.ofNullable(node.get("upload")).filter(JsonNode::isObject);
        var pins = Optional.ofNullable(node.get("pins")).filter(JsonNode::isObject);
        int speed = upload.map(value -> value.get("speed"))
            .filter(value -> !value.isNull())
            .map(value -> Values.asInt(JsonValues.toJava(value))
                .orElseThrow(() -> new BoardLoadException("Board " + id + " has a non-numeric upload speed: " + value)))
            .orElse(BoardProfile.DEFAULT_UPLOAD_SPEED);
        return new BoardProfile(
            id,
            JsonValues.text(node, "name"),
            JsonValues.text(node, "fqbn"),
            upload.map(value -> JsonValues.text(value, "command")).orElse(""),
            upload.map(value -> JsonValues.text(value, "tool")).orElse(""),
            speed,
            new PinCapabilities(
                intPins(pins.map(value -> value.get("digital")).orElse(null), id, "digital"),
                intPins(pins.map(value -> value.get("pwm")).orElse(null), id, "pwm"),
                namedPins(pins.map(value -> value.get("analog")).orElse(null))
            )
        );
    }

    private static List<Integer> intPins(JsonNode node, String boardId, String kind) {
        var pins = new ArrayList<Integer>();
        if (node == null || node.isNull()) {
            return pins;
        }
        if (!node.isArray()) {
            throw new BoardLoadException("Board " + boardId + " has malformed " + kind + " pins");
        }
        for (var item : node) {
            int pin = Values.asInt(JsonValues.toJava(item))
                .orElseThrow(() -> new BoardLoadException("Board " + boardId + " has a non-integer " + kind + " pin: " + item));
            pins.add(pin);
        }
        return pins;
    }

    private static List<String> namedPins(JsonNode node) {
        var pins = new ArrayList<String>();
        if (node == null || !node.isArray()) {
            return pins;
        }
        for (var item : node) {
            pins.add(item.asText());
        }
        return pins;
    }
}
