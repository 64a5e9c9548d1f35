package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;

/** Row-major 3x4 or 4x4 matrix. */
public record MultmatrixArgs(ArrayValue m) implements TransformArgs {}
