package scadlite.ast;

/** Discriminant of {@link Node}; consumers switch over it exhaustively. */
public enum NodeType {
    PROGRAM,
    PRIMITIVE_CALL,
    TRANSFORM,
    BOOLEAN_OP,
    EXTRUDE,
    SPECIAL_VAR_ASSIGN
}
