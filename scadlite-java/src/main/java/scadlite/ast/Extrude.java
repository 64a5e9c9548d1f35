package scadlite.ast;

import scadlite.ast.args.ExtrudeArgs;
import scadlite.ast.args.LinearExtrudeArgs;
import scadlite.ast.args.RotateExtrudeArgs;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record Extrude(
        Kind extrude,
        ExtrudeArgs args,
        List<Node> children,
        Position position
) implements Node {

    public enum Kind {
        LINEAR_EXTRUDE(LinearExtrudeArgs.class),
        ROTATE_EXTRUDE(RotateExtrudeArgs.class);

        private final Class<? extends ExtrudeArgs> argsType;

        Kind(Class<? extends ExtrudeArgs> argsType) {
            this.argsType = argsType;
        }

        public Class<? extends ExtrudeArgs> argsType() { return argsType; }

        public String keyword() { return name().toLowerCase(Locale.ROOT); }
    }

    public Extrude {
        Objects.requireNonNull(extrude, "extrude");
        if (!extrude.argsType().isInstance(args)) {
            throw new IllegalArgumentException(extrude.keyword() + " requires " + extrude.argsType().getSimpleName());
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeType nodeType() { return NodeType.EXTRUDE; }
}
