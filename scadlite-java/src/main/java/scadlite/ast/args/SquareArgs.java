package scadlite.ast.args;

import scadlite.ast.value.Value;

public record SquareArgs(Value size, Boolean center) implements PrimitiveArgs {}
