package scadlite.ast.args;

import scadlite.ast.value.Value;

public record ScaleArgs(Value v) implements TransformArgs {}
