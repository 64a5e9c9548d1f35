package scadlite.ast;

public sealed interface Node
        permits Program, PrimitiveCall, Transform,
        BooleanOp, Extrude, SpecialVarAssign {

    NodeType nodeType();

    Position position();
}
