package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;

public record MirrorArgs(ArrayValue v) implements TransformArgs {}
