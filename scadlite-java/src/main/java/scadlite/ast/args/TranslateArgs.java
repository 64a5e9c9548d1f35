package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;

public record TranslateArgs(ArrayValue v) implements TransformArgs {}
