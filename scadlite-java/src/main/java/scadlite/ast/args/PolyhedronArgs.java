package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;

public record PolyhedronArgs(ArrayValue points, ArrayValue faces, Double convexity) implements PrimitiveArgs {}
