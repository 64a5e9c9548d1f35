package scadlite.ast.args;

import scadlite.ast.value.Value;

public record LinearExtrudeArgs(
        Double height,
        Boolean center,
        Double convexity,
        Double twist,
        Double slices,
        Value scale,
        Double fn
) implements ExtrudeArgs {}
