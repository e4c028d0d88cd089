package work.robolab.sketch.generator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.board.BoardProfile;
import work.robolab.sketch.board.BoardProfileLoader;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockCatalogLoader;
import work.robolab.sketch.catalog.Section;

class CodeGeneratorTest {
    private static final BoardProfile UNO = BoardProfileLoader.bundled().get("uno");

    @Test
    void ledThenDelayLandsInSetupAndLoop() {
        var program = start();
        program.createChild("start", "loop", "led", "LS_LED_ON").setValue("pin", 13);
        program.createChild("start", "loop", "wait", "TM_DELAY").setValue("ms", 500);

        var bundle = new CodeGenerator(BlockCatalog.defaults(), UNO).build(program);

        assertEquals(String.join("\n",
            "#include <Arduino.h>",
            "",
            "void setup() {",
            "  pinMode(13, OUTPUT);",
            "}",
            "",
            "void loop() {",
            "  digitalWrite(13, HIGH);",
            "  delay(500);",
            "}",
            ""), bundle.code());
        assertEquals(List.of(4, 8), bundle.linesOf("led"));
        assertEquals(List.of(9), bundle.linesOf("wait"));
        assertEquals(List.of("led"), bundle.blocksAtLine(8));
    }

    @Test
    void ifBodyIsIndentedOneLevelDeeper() {
        var program = start();
        program.createChild("start", "loop", "if", "CTL_IF").setValue("condition", "digitalRead(2) == LOW");
        program.createChild("if", "then", "led", "LS_LED_ON").setValue("pin", 12);

        var lines = new CodeGenerator(BlockCatalog.defaults(), UNO).build(program).lines();

        int header = lines.indexOf("  if (digitalRead(2) == LOW) {");
        assertTrue(header > 0);
        assertEquals("    digitalWrite(12, HIGH);", lines.get(header + 1));
        assertEquals("  }", lines.get(header + 2));
        assertTrue(lines.contains("  pinMode(12, OUTPUT);"));
    }

    @Test
    void nestedContainersCompoundIndentation() {
        var program = start();
        program.createChild("start", "loop", "outer", "CTL_IF");
        program.createChild("outer", "then", "inner", "CTL_IF").setValue("condition", "x > 1");
        program.createChild("inner", "then", "led", "LS_LED_ON");

        var lines = new CodeGenerator(BlockCatalog.defaults(), UNO).build(program).lines();

        int header = lines.indexOf("  if (true) {");
        assertEquals("    if (x > 1) {", lines.get(header + 1));
        assertEquals("      digitalWrite(13, HIGH);", lines.get(header + 2));
        assertEquals("    }", lines.get(header + 3));
        assertEquals("  }", lines.get(header + 4));
    }

    @Test
    void emptyBodyRendersAsUnpaddedBlankLine() {
        var program = start();
        program.createChild("start", "loop", "if", "CTL_IF");

        var lines = new CodeGenerator(BlockCatalog.defaults(), UNO).build(program).lines();

        int header = lines.indexOf("  if (true) {");
        assertEquals("", lines.get(header + 1));
        assertEquals("  }", lines.get(header + 2));
    }

    @Test
    void buildIsIdempotent() {
        var program = start();
        program.createChild("start", "loop", "led", "LS_LED_ON");
        program.createChild("start", "loop", "wait", "TM_DELAY");
        var generator = new CodeGenerator(BlockCatalog.defaults(), UNO);

        var first = generator.build(program);
        var second = generator.build(program);

        assertEquals(first.code(), second.code());
        assertEquals(first.mapping(), second.mapping());
    }

    @Test
    void snippetsAppearOncePerInstanceInTheirSections() {
        var program = start();
        program.createChild("start", "setup", "serial", "SR_BEGIN");
        program.createChild("start", "loop", "servo", "SV_WRITE").setValue("pin", 6).setValue("angle", 45);
        program.createChild("start", "loop", "blink", "FN_BLINK");

        var bundle = new CodeGenerator(BlockCatalogLoader.bundled(), UNO).build(program);
        var code = bundle.code();

        assertEquals(1, occurrences(code, "#include <Servo.h>"));
        assertEquals(1, occurrences(code, "Servo servo6;"));
        assertEquals(1, occurrences(code, "servo6.attach(6);"));
        assertEquals(1, occurrences(code, "void blink(int pin, int ms) {"));
        assertEquals(List.of("Servo servo6;"), bundle.sectionLines(Section.GLOBALS));
        assertTrue(bundle.sectionLines(Section.SETUP).contains("  Serial.begin(9600);"));
        assertTrue(bundle.sectionLines(Section.LOOP).contains("  servo6.write(45);"));
        assertTrue(bundle.sectionLines(Section.LOOP).contains("  blink(13, 500);"));
        assertTrue(code.indexOf(CodeGenerator.GLOBALS_HEADER) < code.indexOf("void setup() {"));
        assertTrue(code.indexOf("void loop() {") < code.indexOf("void blink(int pin, int ms) {"));
        assertTrue(code.endsWith("}\n"));
        assertFalse(code.endsWith("\n\n"));
    }

    @Test
    void sharedIncludesAreDeduplicated() {
        var program = start();
        program.createChild("start", "loop", "s1", "SV_WRITE").setValue("pin", 9);
        program.createChild("start", "loop", "s2", "SV_WRITE").setValue("pin", 10);

        var bundle = new CodeGenerator(BlockCatalogLoader.bundled(), UNO).build(program);
        var code = bundle.code();
        int include = bundle.lines().indexOf("#include <Servo.h>") + 1;

        assertEquals(1, occurrences(code, "#include <Servo.h>"));
        assertEquals(1, occurrences(code, "Servo servo9;"));
        assertEquals(1, occurrences(code, "Servo servo10;"));
        assertTrue(bundle.linesOf("s1").contains(include));
        assertFalse(bundle.linesOf("s2").contains(include));
    }

    @Test
    void expressionChildrenAreSubstitutedInline() {
        var catalog = BlockCatalogLoader.fromJson("{\"blocks\": ["
            + "{\"id\": \"EV_START\", \"name\": \"Start\", \"category\": \"e\", \"kind\": \"event\","
            + " \"containers\": [{\"name\": \"loop\", \"section\": \"loop\"}]},"
            + "{\"id\": \"PRINT\", \"name\": \"Print\", \"category\": \"s\", \"kind\": \"statement\","
            + " \"template\": \"Serial.println({value});\","
            + " \"containers\": [{\"name\": \"value\", \"section\": \"loop\", \"placeholder\": \"value\"}]},"
            + "{\"id\": \"READ\", \"name\": \"Read\", \"category\": \"io\", \"kind\": \"expression\", \"returns\": \"int\","
            + " \"template\": \"analogRead({pin})\", \"parameters\": [{\"name\": \"pin\", \"type\": \"string\", \"default\": \"A0\"}]}]}");
        var program = start();
        program.createChild("start", "loop", "print", "PRINT");
        program.createChild("print", "value", "read", "READ");

        var bundle = new CodeGenerator(catalog, UNO).build(program);

        assertTrue(bundle.sectionLines(Section.LOOP).contains("  Serial.println(analogRead(A0));"));
        assertTrue(bundle.linesOf("read").isEmpty());
    }

    @Test
    void missingRootFails() {
        var program = new Program("uno");
        assertThrows(CodeGenerationException.class, () -> new CodeGenerator(BlockCatalog.defaults(), UNO).build(program));
    }

    @Test
    void unknownBlockFailsWithItsId() {
        var program = start();
        program.createChild("start", "loop", "ghost", "XX_GHOST");
        var ex = assertThrows(CodeGenerationException.class, () -> new CodeGenerator(BlockCatalog.defaults(), UNO).build(program));
        assertEquals("ghost", ex.blockId());
    }

    @Test
    void templateWithoutResolvableSectionFails() {
        var catalog = BlockCatalogLoader.fromJson("{\"blocks\": ["
            + "{\"id\": \"BARE\", \"name\": \"Bare\", \"category\": \"c\", \"kind\": \"statement\", \"template\": \"bare();\"}]}");
        var program = new Program("uno");
        program.create("bare", "BARE");
        program.setRoot("bare");
        var ex = assertThrows(CodeGenerationException.class, () -> new CodeGenerator(catalog, UNO).build(program));
        assertTrue(ex.getMessage().contains("no section"));
    }

    @Test
    void emptyProgramStillHasBothFunctions() {
        var code = new CodeGenerator(BlockCatalog.defaults(), UNO).build(start()).code();
        assertEquals("#include <Arduino.h>\n\nvoid setup() {\n}\n\nvoid loop() {\n}\n", code);
    }

    private static Program start() {
        var program = new Program("uno");
        program.create("start", "EV_START");
        program.setRoot("start");
        return program;
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            count++;
        }
        return count;
    }
}
