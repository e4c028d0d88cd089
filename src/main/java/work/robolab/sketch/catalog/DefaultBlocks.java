package work.robolab.sketch.catalog;

import java.util.List;
import java.util.Map;

/**
 * Minimal generation definitions used when the catalog document only carries palette data.
 */
final class DefaultBlocks {
    static final String START = "EV_START";

    private DefaultBlocks() {}

    static List<BlockDefinition> definitions() {
        return List.of(
            BlockDefinition.builder(START, BlockKind.EVENT)
                .name("Start")
                .category("events")
                .container(BlockContainerSpec.of("setup", Section.SETUP))
                .container(BlockContainerSpec.of("loop", Section.LOOP))
                .build(),
            BlockDefinition.builder("LS_LED_ON", BlockKind.STATEMENT)
                .name("LED on")
                .category("logic")
                .section(Section.LOOP)
                .template("digitalWrite({pin}, HIGH);")
                .parameter("pin", BlockParameter.INT, 13)
                .setup("pinMode({pin}, OUTPUT);")
                .build(),
            BlockDefinition.builder("TM_DELAY", BlockKind.STATEMENT)
                .name("Delay")
                .category("timing")
                .section(Section.LOOP)
                .template("delay({ms});")
                .parameter("ms", BlockParameter.INT, 1000)
                .build(),
            BlockDefinition.builder("CTL_IF", BlockKind.STATEMENT)
                .name("If")
                .category("logic")
                .section(Section.LOOP)
                .template("if ({condition}) {\n{then}\n}")
                .parameter("condition", "string", "true")
                .container(BlockContainerSpec.withPlaceholder("then", Section.LOOP, "then"))
                .build()
        );
    }

    static Map<String, Category> categories() {
        return Map.of(
            "events", new Category("events", "Events", "#607D8B"),
            "logic", new Category("logic", "Logic", "#4CAF50"),
            "timing", new Category("timing", "Timing", "#FFC107")
        );
    }
}
