package scadlite.ast;

import scadlite.ast.args.*;

import java.util.Locale;
import java.util.Objects;

public record PrimitiveCall(
        Primitive primitive,
        PrimitiveArgs args,
        Position position
) implements Node {

    public enum Primitive {
        CUBE(CubeArgs.class),
        SPHERE(SphereArgs.class),
        CYLINDER(CylinderArgs.class),
        CIRCLE(CircleArgs.class),
        SQUARE(SquareArgs.class),
        POLYGON(PolygonArgs.class),
        POLYHEDRON(PolyhedronArgs.class),
        TEXT(TextArgs.class);

        private final Class<? extends PrimitiveArgs> argsType;

        Primitive(Class<? extends PrimitiveArgs> argsType) {
            this.argsType = argsType;
        }

        public Class<? extends PrimitiveArgs> argsType() { return argsType; }

        public String keyword() { return name().toLowerCase(Locale.ROOT); }
    }

    public PrimitiveCall {
        Objects.requireNonNull(primitive, "primitive");
        if (!primitive.argsType().isInstance(args)) {
            throw new IllegalArgumentException(primitive.keyword() + " requires " + primitive.argsType().getSimpleName());
        }
    }

    @Override
    public NodeType nodeType() { return NodeType.PRIMITIVE_CALL; }
}
