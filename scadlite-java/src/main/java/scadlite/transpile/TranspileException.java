package scadlite.transpile;

import scadlite.ast.Node;
import scadlite.ast.Position;
import scadlite.error.ErrorKind;
import scadlite.error.ScadException;

/** A well-formed tree that has no mapping onto the builder API. */
public final class TranspileException extends ScadException {

    private final transient Node node;

    public TranspileException(String message, Node node) {
        super(message, lineOf(node), columnOf(node), "");
        this.node = node;
    }

    public TranspileException(String message) {
        this(message, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSPILE;
    }

    /** Offending node, or null when the failure is not tied to one. */
    public Node node() { return node; }

    private static int lineOf(Node node) {
        Position p = node == null ? null : node.position();
        return p == null ? 0 : p.line();
    }

    private static int columnOf(Node node) {
        Position p = node == null ? null : node.position();
        return p == null ? 0 : p.column();
    }
}
