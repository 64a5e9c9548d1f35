package scadlite.ast.args;

public sealed interface ExtrudeArgs
        permits LinearExtrudeArgs, RotateExtrudeArgs {}
