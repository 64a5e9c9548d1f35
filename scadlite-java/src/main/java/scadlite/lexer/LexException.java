package scadlite.lexer;

import scadlite.error.ErrorKind;
import scadlite.error.ScadException;

public final class LexException extends ScadException {

    public LexException(String message, int line, int column, String found) {
        super(message, line, column, found);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.LEX;
    }
}
