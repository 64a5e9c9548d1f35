package scadlite.ast.args;

import scadlite.ast.value.ArrayValue;

public record PolygonArgs(ArrayValue points, ArrayValue paths, Double convexity) implements PrimitiveArgs {}
