package scadlite.ast.args;

import scadlite.ast.value.Value;

/** {@code c} is a color name or an RGB(A) vector. */
public record ColorArgs(Value c, Double alpha) implements TransformArgs {}
