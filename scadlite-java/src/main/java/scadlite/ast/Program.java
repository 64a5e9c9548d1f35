package scadlite.ast;

import java.util.List;

public record Program(
        List<Node> body,
        Position position
) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public NodeType nodeType() { return NodeType.PROGRAM; }
}
