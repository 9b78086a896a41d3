package org.starledger.parser.frontend.parser;

/**
 * Thrown when snapshot text violates the save-file grammar.
 * <p>
 * This is a checked exception: a malformed snapshot is an expected condition for callers that
 * import files written by an external program, and it must be handled per file.
 */
public class FormatException extends Exception {

    private final int line;

    /**
     * Creates a FormatException for the given source line.
     *
     * @param line    The 1-based line the problem was detected on, or 0 if unknown.
     * @param message Description of the expected input.
     */
    public FormatException(int line, String message) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    /**
     * Creates a FormatException with an underlying cause.
     *
     * @param line    The 1-based line the problem was detected on, or 0 if unknown.
     * @param message Description of the expected input.
     * @param cause   The underlying exception.
     */
    public FormatException(int line, String message, Throwable cause) {
        super("Line " + line + ": " + message, cause);
        this.line = line;
    }

    /**
     * @return The line the problem was detected on.
     */
    public int getLine() {
        return line;
    }
}
