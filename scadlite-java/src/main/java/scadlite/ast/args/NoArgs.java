package scadlite.ast.args;

/** hull and minkowski take no arguments. */
public record NoArgs() implements TransformArgs {}
