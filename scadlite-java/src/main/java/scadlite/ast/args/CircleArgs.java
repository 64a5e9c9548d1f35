package scadlite.ast.args;

public record CircleArgs(Double r, Double fn, Double fa, Double fs) implements PrimitiveArgs {}
