package scadlite.error;

/**
 * Base of the three compile failures. Every instance is immutable and carries
 * the 1-based position of the offending token or node (0 when unknown).
 */
public abstract class ScadException extends RuntimeException {

    private final int line;
    private final int column;
    private final String found;

    protected ScadException(String message, int line, int column, String found) {
        super(message);
        this.line = line;
        this.column = column;
        this.found = found;
    }

    public abstract ErrorKind kind();

    public int line() { return line; }

    public int column() { return column; }

    /** Offending lexeme, or an empty string when there is none. */
    public String found() { return found; }
}
