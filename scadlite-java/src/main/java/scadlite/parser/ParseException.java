package scadlite.parser;

import scadlite.error.ErrorKind;
import scadlite.error.ScadException;

import java.util.List;

/**
 * Grammar or argument-shape violation. {@link #expected()} lists the
 * alternatives that would have been accepted; it is empty for hard rejections
 * of unsupported language features.
 */
public final class ParseException extends ScadException {

    private final List<String> expected;

    public ParseException(String message, int line, int column, String found, List<String> expected) {
        super(message, line, column, found);
        this.expected = List.copyOf(expected);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PARSE;
    }

    public List<String> expected() { return expected; }

    /**
     * Fixed four-line summary fed back to an automated repair loop. The layout
     * is a public contract and must not change.
     */
    public String toRetryContext() {
        return "Parse Error at line " + line() + ", column " + column() + ":\n"
                + "Found: \"" + found() + "\"\n"
                + "Expected: " + String.join(", ", expected) + "\n"
                + "Message: " + getMessage();
    }
}
