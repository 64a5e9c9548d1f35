package scadlite.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * union / difference / intersection. For the last two the first child is the
 * base operand and the rest apply to it in order.
 */
public record BooleanOp(
        Operation operation,
        List<Node> children,
        Position position
) implements Node {

    public enum Operation {
        UNION, DIFFERENCE, INTERSECTION;

        public String keyword() { return name().toLowerCase(Locale.ROOT); }
    }

    public BooleanOp {
        Objects.requireNonNull(operation, "operation");
        children = List.copyOf(children);
    }

    @Override
    public NodeType nodeType() { return NodeType.BOOLEAN_OP; }
}
