package scadlite.ast;

import scadlite.ast.args.*;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record Transform(
        Kind transform,
        TransformArgs args,
        List<Node> children,
        Position position
) implements Node {

    public enum Kind {
        TRANSLATE(TranslateArgs.class),
        ROTATE(RotateArgs.class),
        SCALE(ScaleArgs.class),
        MIRROR(MirrorArgs.class),
        RESIZE(ResizeArgs.class),
        MULTMATRIX(MultmatrixArgs.class),
        COLOR(ColorArgs.class),
        OFFSET(OffsetArgs.class),
        HULL(NoArgs.class),
        MINKOWSKI(NoArgs.class);

        private final Class<? extends TransformArgs> argsType;

        Kind(Class<? extends TransformArgs> argsType) {
            this.argsType = argsType;
        }

        public Class<? extends TransformArgs> argsType() { return argsType; }

        public String keyword() { return name().toLowerCase(Locale.ROOT); }
    }

    public Transform {
        Objects.requireNonNull(transform, "transform");
        if (!transform.argsType().isInstance(args)) {
            throw new IllegalArgumentException(transform.keyword() + " requires " + transform.argsType().getSimpleName());
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeType nodeType() { return NodeType.TRANSFORM; }
}
