package scadlite.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scadlite.ast.BooleanOp;
import scadlite.ast.Extrude;
import scadlite.ast.PrimitiveCall;
import scadlite.ast.Transform;
import scadlite.ast.args.*;
import scadlite.ast.value.*;
import scadlite.lexer.Token;

import java.util.List;
import java.util.Set;

/**
 * Maps a generic {@link ArgList} onto the typed argument record of one
 * construct. Diameters ({@code d}, {@code d1}, {@code d2}) become radii here and
 * never reach the tree. Absent arguments stay null.
 */
final class ArgumentMapper {

    private static final Logger logger = LoggerFactory.getLogger(ArgumentMapper.class);

    private final String construct;
    private final ArgList args;

    private ArgumentMapper(String construct, ArgList args) {
        this.construct = construct;
        this.args = args;
    }

    // ---------- primitives ----------

    static PrimitiveArgs primitive(PrimitiveCall.Primitive primitive, ArgList args) {
        var m = new ArgumentMapper(primitive.keyword(), args);
        return switch (primitive) {
            case CUBE -> {
                m.checkKnown(1, "size", "center");
                yield new CubeArgs(m.numberOrVector("size", 0), m.bool("center", -1));
            }
            case SPHERE -> {
                m.checkKnown(1, "r", "d", "$fn", "$fa", "$fs");
                yield new SphereArgs(m.radius("r", "d", 0), m.number("$fn", -1), m.number("$fa", -1), m.number("$fs", -1));
            }
            case CYLINDER -> {
                m.checkKnown(4, "h", "r", "r1", "r2", "d", "d1", "d2", "center", "$fn", "$fa", "$fs");
                yield new CylinderArgs(
                        m.number("h", 0),
                        m.radius("r", "d", -1),
                        m.radius("r1", "d1", 1),
                        m.radius("r2", "d2", 2),
                        m.bool("center", 3),
                        m.number("$fn", -1),
                        m.number("$fa", -1),
                        m.number("$fs", -1));
            }
            case CIRCLE -> {
                m.checkKnown(1, "r", "d", "$fn", "$fa", "$fs");
                yield new CircleArgs(m.radius("r", "d", 0), m.number("$fn", -1), m.number("$fa", -1), m.number("$fs", -1));
            }
            case SQUARE -> {
                m.checkKnown(1, "size", "center");
                yield new SquareArgs(m.numberOrVector("size", 0), m.bool("center", -1));
            }
            case POLYGON -> {
                m.checkKnown(3, "points", "paths", "convexity");
                yield new PolygonArgs(m.array("points", 0), m.array("paths", 1), m.number("convexity", 2));
            }
            case POLYHEDRON -> {
                m.checkKnown(3, "points", "faces", "triangles", "convexity");
                ArrayValue faces = m.array("faces", 1);
                if (faces == null) faces = m.array("triangles", -1);
                yield new PolyhedronArgs(m.array("points", 0), faces, m.number("convexity", 2));
            }
            case TEXT -> {
                m.checkKnown(3, "text", "size", "font", "halign", "valign", "spacing",
                        "direction", "language", "script", "$fn");
                yield new TextArgs(
                        m.string("text", 0),
                        m.number("size", 1),
                        m.string("font", 2),
                        m.string("halign", -1),
                        m.string("valign", -1),
                        m.number("spacing", -1),
                        m.string("direction", -1),
                        m.string("language", -1),
                        m.string("script", -1),
                        m.number("$fn", -1));
            }
        };
    }

    // ---------- transforms ----------

    static TransformArgs transform(Transform.Kind kind, ArgList args) {
        var m = new ArgumentMapper(kind.keyword(), args);
        return switch (kind) {
            case TRANSLATE -> {
                m.checkKnown(1, "v");
                yield new TranslateArgs(m.vector("v", 0));
            }
            case ROTATE -> {
                m.checkKnown(2, "a", "v");
                yield new RotateArgs(m.numberOrVector("a", 0), m.vector("v", 1));
            }
            case SCALE -> {
                m.checkKnown(1, "v");
                yield new ScaleArgs(m.numberOrVector("v", 0));
            }
            case MIRROR -> {
                m.checkKnown(1, "v");
                yield new MirrorArgs(m.vector("v", 0));
            }
            case RESIZE -> {
                m.checkKnown(2, "newsize", "auto");
                yield new ResizeArgs(m.vector("newsize", 0), m.boolOrArray("auto", 1));
            }
            case MULTMATRIX -> {
                m.checkKnown(1, "m");
                yield new MultmatrixArgs(m.array("m", 0));
            }
            case COLOR -> {
                m.checkKnown(2, "c", "alpha");
                yield new ColorArgs(m.stringOrVector("c", 0), m.number("alpha", 1));
            }
            case OFFSET -> {
                m.checkKnown(1, "r", "delta", "chamfer");
                yield new OffsetArgs(m.number("r", 0), m.number("delta", -1), m.bool("chamfer", -1));
            }
            case HULL, MINKOWSKI -> {
                m.checkKnown(0);
                yield new NoArgs();
            }
        };
    }

    static void booleanOp(BooleanOp.Operation operation, ArgList args) {
        new ArgumentMapper(operation.keyword(), args).checkKnown(0);
    }

    // ---------- extrusions ----------

    static ExtrudeArgs extrude(Extrude.Kind kind, ArgList args) {
        var m = new ArgumentMapper(kind.keyword(), args);
        return switch (kind) {
            case LINEAR_EXTRUDE -> {
                m.checkKnown(1, "height", "center", "convexity", "twist", "slices", "scale", "$fn");
                yield new LinearExtrudeArgs(
                        m.number("height", 0),
                        m.bool("center", -1),
                        m.number("convexity", -1),
                        m.number("twist", -1),
                        m.number("slices", -1),
                        m.numberOrVector("scale", -1),
                        m.number("$fn", -1));
            }
            case ROTATE_EXTRUDE -> {
                m.checkKnown(0, "angle", "convexity", "$fn", "$fa", "$fs");
                yield new RotateExtrudeArgs(
                        m.number("angle", -1),
                        m.number("convexity", -1),
                        m.number("$fn", -1),
                        m.number("$fa", -1),
                        m.number("$fs", -1));
            }
        };
    }

    // ---------- readers ----------

    private void checkKnown(int positionalSlots, String... names) {
        Set<String> known = Set.of(names);
        for (String name : args.named().keySet()) {
            if (!known.contains(name)) {
                logger.debug("Ignoring unknown argument '{}' of {}", name, construct);
            }
        }
        if (args.positional().size() > positionalSlots) {
            logger.debug("Ignoring {} surplus positional argument(s) of {}",
                    args.positional().size() - positionalSlots, construct);
        }
    }

    private Double number(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        if (a.value() instanceof NumberValue n) return n.value();
        throw shapeError(name, a, "number");
    }

    private Boolean bool(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        if (a.value() instanceof BoolValue b) return b.value();
        throw shapeError(name, a, "true", "false");
    }

    private String string(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        if (a.value() instanceof StringValue s) return s.value();
        throw shapeError(name, a, "string");
    }

    private ArrayValue array(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        if (a.value() instanceof ArrayValue arr) return arr;
        throw shapeError(name, a, "array");
    }

    private ArrayValue vector(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        if (a.value() instanceof ArrayValue arr && arr.isNumeric()) return arr;
        throw shapeError(name, a, "numeric vector");
    }

    private Value numberOrVector(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        Value v = a.value();
        if (v instanceof NumberValue) return v;
        if (v instanceof ArrayValue arr && arr.isNumeric()) return v;
        throw shapeError(name, a, "number", "numeric vector");
    }

    private Value stringOrVector(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        Value v = a.value();
        if (v instanceof StringValue) return v;
        if (v instanceof ArrayValue arr && arr.isNumeric()) return v;
        throw shapeError(name, a, "string", "numeric vector");
    }

    private Value boolOrArray(String name, int index) {
        ArgList.Argument a = args.find(name, index);
        if (a == null) return null;
        Value v = a.value();
        if (v instanceof BoolValue || v instanceof ArrayValue) return v;
        throw shapeError(name, a, "true", "false", "array");
    }

    /** Radius from {@code radiusName}, or half of {@code diameterName}; the diameter wins when both are given. */
    private Double radius(String radiusName, String diameterName, int index) {
        Double d = number(diameterName, -1);
        if (d != null) return d / 2;
        return number(radiusName, index);
    }

    private ParseException shapeError(String name, ArgList.Argument a, String... accepted) {
        Token at = a.at();
        return new ParseException(
                "Argument '" + name + "' of " + construct + " must be " + String.join(" or ", accepted)
                        + ", found " + a.value().describe(),
                at.line(), at.column(), at.lexeme(), List.of(accepted));
    }
}
