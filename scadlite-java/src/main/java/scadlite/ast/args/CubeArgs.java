package scadlite.ast.args;

import scadlite.ast.value.Value;

/** {@code size} is a number or a vector. */
public record CubeArgs(Value size, Boolean center) implements PrimitiveArgs {}
