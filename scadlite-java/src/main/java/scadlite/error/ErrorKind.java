package scadlite.error;

/** Pipeline stage that raised a {@link ScadException}. */
public enum ErrorKind {
    LEX,
    PARSE,
    TRANSPILE
}
