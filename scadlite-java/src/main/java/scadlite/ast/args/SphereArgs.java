package scadlite.ast.args;

public record SphereArgs(Double r, Double fn, Double fa, Double fs) implements PrimitiveArgs {}
