package work.robolab.sketch.generator;

/**
 * One physical output line and the block instance that produced it ({@code null} for framing).
 */
public record EmittedLine(String text, String origin) {
    static final EmittedLine BLANK = new EmittedLine("", null);

    static EmittedLine framing(String text) {
        return new EmittedLine(text, null);
    }

    boolean isBlank() {
        return text.isBlank();
    }
}
