package scadlite.ast.args;

public record RotateExtrudeArgs(
        Double angle,
        Double convexity,
        Double fn,
        Double fa,
        Double fs
) implements ExtrudeArgs {}
