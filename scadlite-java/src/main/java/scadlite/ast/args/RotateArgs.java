package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;
import scadlite.ast.value.Value;

/** {@code a} is a single angle (about z) or per-axis angles. */
public record RotateArgs(Value a, ArrayValue v) implements TransformArgs {}
