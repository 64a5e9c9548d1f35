package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;
import scadlite.ast.value.Value;

public record ResizeArgs(ArrayValue newsize, Value auto) implements TransformArgs {}
