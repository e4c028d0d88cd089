package work.robolab.sketch.validate;

public enum Severity {
    /** The program should not be generated or flashed as is. */
    ERROR,
    /** Advisory finding. */
    WARNING
}
