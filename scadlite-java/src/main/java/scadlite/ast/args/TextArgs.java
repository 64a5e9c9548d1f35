package scadlite.ast.args;

public record TextArgs(
        String text,
        Double size,
        String font,
        String halign,
        String valign,
        Double spacing,
        String direction,
        String language,
        String script,
        Double fn
) implements PrimitiveArgs {}
