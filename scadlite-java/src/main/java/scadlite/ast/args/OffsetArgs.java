package scadlite.ast.args;

public record OffsetArgs(Double r, Double delta, Boolean chamfer) implements TransformArgs {}
