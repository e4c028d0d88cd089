package work.robolab.sketch.catalog;

/**
 * Palette category metadata; both fields are optional.
 */
public record Category(String id, String title, String color) {}
