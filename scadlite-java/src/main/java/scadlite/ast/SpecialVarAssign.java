package scadlite.ast;

import scadlite.ast.value.Value;

/** {@code $fn = 32;} and friends. The value is a number or a numeric vector. */
public record SpecialVarAssign(
        String variable,
        Value value,
        Position position
) implements Node {

    @Override
    public NodeType nodeType() { return NodeType.SPECIAL_VAR_ASSIGN; }
}
