package scadlite.transpile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scadlite.ast.*;
import scadlite.ast.args.*;
import scadlite.ast.value.ArrayValue;
import scadlite.ast.value.NumberValue;
import scadlite.ast.value.Value;
import scadlite.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Lowers a {@link Program} to JavaScript against the Manifold API, reached
 * through the variable {@code M}. The output is a function body: temporaries
 * are declared with {@code const _vN}, released with {@code delete()}, and the
 * final solid is returned.
 *
 * <p>Holds per-call state, so an instance must not be shared between threads.
 * {@link scadlite.ScadCompiler} creates a fresh one for every call.
 */
public final class Transpiler {

    private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);

    // a leaf sits one level below its innermost block
    private static final int MAX_DEPTH = Parser.MAX_NESTING_DEPTH + 1;

    private final TranspileOptions options;

    private Emitter out;
    private double fn;
    private String extrusion; // enclosing extrusion keyword, null outside one
    private int depth;

    public Transpiler() {
        this(new TranspileOptions());
    }

    public Transpiler(TranspileOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public String transpile(Program program) {
        out = new Emitter();
        fn = options.defaultFn();
        extrusion = null;
        depth = 0;

        List<String> results = emitAll(program.body());
        if (results.isEmpty()) {
            return out.render("undefined");
        }
        return out.render(combine(results, "add"));
    }

    // ---------- dispatch ----------

    /** Emits siblings in order; {@code $fn} assigned among them does not leak out. */
    private List<String> emitAll(List<Node> nodes) {
        double savedFn = fn;
        List<String> results = new ArrayList<>();
        for (Node n : nodes) {
            String r = emitNode(n);
            if (r != null) results.add(r);
        }
        fn = savedFn;
        return results;
    }

    private String emitNode(Node node) {
        if (++depth > MAX_DEPTH) {
            throw new TranspileException("Maximum nesting depth of " + Parser.MAX_NESTING_DEPTH + " exceeded", node);
        }
        String result = switch (node.nodeType()) {
            case PROGRAM -> throw new TranspileException("Nested program node", node);
            case PRIMITIVE_CALL -> emitPrimitive((PrimitiveCall) node);
            case TRANSFORM -> emitTransform((Transform) node);
            case BOOLEAN_OP -> emitBoolean((BooleanOp) node);
            case EXTRUDE -> emitExtrude((Extrude) node);
            case SPECIAL_VAR_ASSIGN -> {
                assignSpecialVar((SpecialVarAssign) node);
                yield null;
            }
        };
        depth--;
        return result;
    }

    private void assignSpecialVar(SpecialVarAssign node) {
        if (node.variable().equals("$fn") && node.value() instanceof NumberValue n) {
            fn = n.value();
        } else {
            logger.debug("Ignoring {} at {}; it has no effect on generated code", node.variable(), node.position());
        }
    }

    // ---------- primitives ----------

    private String emitPrimitive(PrimitiveCall node) {
        return switch (node.primitive()) {
            case CUBE -> cube(node, (CubeArgs) node.args());
            case SPHERE -> sphere(node, (SphereArgs) node.args());
            case CYLINDER -> cylinder(node, (CylinderArgs) node.args());
            case CIRCLE -> circle(node, (CircleArgs) node.args());
            case SQUARE -> square(node, (SquareArgs) node.args());
            case POLYGON -> polygon(node, (PolygonArgs) node.args());
            case POLYHEDRON, TEXT ->
                    throw new TranspileException("Unsupported primitive: " + node.primitive().keyword(), node);
        };
    }

    private String cube(PrimitiveCall node, CubeArgs args) {
        require3D(node);
        String size;
        if (args.size() == null) {
            size = Numbers.array(1, 1, 1);
        } else if (args.size() instanceof NumberValue n) {
            size = Numbers.array(n.value(), n.value(), n.value());
        } else {
            size = Numbers.array(components(node, "cube size", args.size(), 3, 3, 0));
        }
        boolean center = Boolean.TRUE.equals(args.center());
        return "M.Manifold.cube(" + size + ", " + center + ")";
    }

    private String sphere(PrimitiveCall node, SphereArgs args) {
        require3D(node);
        double r = args.r() != null ? args.r() : 1;
        return "M.Manifold.sphere(" + Numbers.format(r) + ", " + segments(args.fn()) + ")";
    }

    private String cylinder(PrimitiveCall node, CylinderArgs args) {
        require3D(node);
        double h = args.h() != null ? args.h() : 1;
        double r1;
        double r2;
        if (args.r() != null) {
            r1 = r2 = args.r();
        } else {
            r1 = args.r1() != null ? args.r1() : 1;
            r2 = args.r2() != null ? args.r2() : r1;
        }
        boolean center = Boolean.TRUE.equals(args.center());
        return "M.Manifold.cylinder(" + Numbers.format(h) + ", " + Numbers.format(r1) + ", "
                + Numbers.format(r2) + ", " + segments(args.fn()) + ", " + center + ")";
    }

    private String circle(PrimitiveCall node, CircleArgs args) {
        require2D(node);
        double r = args.r() != null ? args.r() : 1;
        int n = segments(args.fn());

        // StrictMath keeps the emitted coordinates identical on every platform
        StringJoiner points = new StringJoiner(", ", "[", "]");
        for (int i = 0; i < n; i++) {
            double angle = 2 * Math.PI * i / n;
            points.add(Numbers.array(r * StrictMath.cos(angle), r * StrictMath.sin(angle)));
        }
        return points.toString();
    }

    private String square(PrimitiveCall node, SquareArgs args) {
        require2D(node);
        double w;
        double h;
        if (args.size() == null) {
            w = h = 1;
        } else if (args.size() instanceof NumberValue n) {
            w = h = n.value();
        } else {
            List<Double> size = components(node, "square size", args.size(), 2, 2, 0);
            w = size.get(0);
            h = size.get(1);
        }

        if (Boolean.TRUE.equals(args.center())) {
            double hw = w / 2;
            double hh = h / 2;
            return "[" + Numbers.array(-hw, -hh) + ", " + Numbers.array(hw, -hh) + ", "
                    + Numbers.array(hw, hh) + ", " + Numbers.array(-hw, hh) + "]";
        }
        return "[" + Numbers.array(0, 0) + ", " + Numbers.array(w, 0) + ", "
                + Numbers.array(w, h) + ", " + Numbers.array(0, h) + "]";
    }

    private String polygon(PrimitiveCall node, PolygonArgs args) {
        require2D(node);
        if (args.points() == null) {
            throw new TranspileException("polygon requires points", node);
        }
        if (args.paths() != null) {
            logger.debug("Ignoring polygon paths at {}", node.position());
        }
        StringJoiner points = new StringJoiner(", ", "[", "]");
        for (Value p : args.points().elements()) {
            points.add(Numbers.array(components(node, "polygon point", p, 2, 2, 0)));
        }
        return points.toString();
    }

    private int segments(Double local) {
        return options.clamp(local != null ? local : fn);
    }

    private void require3D(PrimitiveCall node) {
        if (extrusion != null) {
            throw new TranspileException(node.primitive().keyword() + " cannot be used inside " + extrusion
                    + "; expected a 2D shape (circle, square, polygon)", node);
        }
    }

    private void require2D(PrimitiveCall node) {
        if (extrusion == null) {
            throw new TranspileException(node.primitive().keyword()
                    + " is a 2D shape and must be placed inside linear_extrude or rotate_extrude", node);
        }
    }

    // ---------- transforms ----------

    private String emitTransform(Transform node) {
        String keyword = node.transform().keyword();
        if (extrusion != null) {
            throw new TranspileException(keyword + " cannot be applied to 2D shapes inside " + extrusion, node);
        }
        String call = transformCall(node);

        List<String> children = emitAll(node.children());
        if (children.isEmpty()) {
            throw new TranspileException("Transform " + keyword + " has no children", node);
        }
        String combined = combine(children, "add");
        if (call == null) return combined;

        String source = stored(combined);
        String result = out.newVar();
        out.assign(result, source + call);
        out.delete(source);
        return result;
    }

    /** Method call appended to the transformed solid, or null when the transform is a no-op. */
    private String transformCall(Transform node) {
        return switch (node.transform()) {
            case TRANSLATE -> {
                var v = ((TranslateArgs) node.args()).v();
                yield ".translate(" + Numbers.array(components(node, "translate vector", required(node, v), 2, 3, 0)) + ")";
            }
            case ROTATE -> {
                var args = (RotateArgs) node.args();
                if (args.a() == null) {
                    yield ".rotate(" + Numbers.array(0, 0, 0) + ")";
                }
                if (args.a() instanceof NumberValue n) {
                    if (args.v() != null && !isZAxis(args.v())) {
                        throw new TranspileException("rotate about a custom axis v is not supported", node);
                    }
                    yield ".rotate(" + Numbers.array(0, 0, n.value()) + ")";
                }
                yield ".rotate(" + Numbers.array(components(node, "rotate angles", args.a(), 2, 3, 0)) + ")";
            }
            case SCALE -> {
                Value v = required(node, ((ScaleArgs) node.args()).v());
                if (v instanceof NumberValue n) {
                    yield ".scale(" + Numbers.array(n.value(), n.value(), n.value()) + ")";
                }
                yield ".scale(" + Numbers.array(components(node, "scale vector", v, 2, 3, 1)) + ")";
            }
            case MIRROR -> {
                var v = ((MirrorArgs) node.args()).v();
                yield ".mirror(" + Numbers.array(components(node, "mirror vector", required(node, v), 2, 3, 0)) + ")";
            }
            case MULTMATRIX -> ".transform(" + columnMajor(node, ((MultmatrixArgs) node.args()).m()) + ")";
            case COLOR -> null;
            case HULL, MINKOWSKI, RESIZE, OFFSET ->
                    throw new TranspileException("Transform " + node.transform().keyword() + " is not supported", node);
        };
    }

    private static boolean isZAxis(ArrayValue v) {
        return v.size() == 3
                && ((NumberValue) v.get(0)).value() == 0
                && ((NumberValue) v.get(1)).value() == 0
                && ((NumberValue) v.get(2)).value() != 0;
    }

    /** Row-major 3x4 or affine 4x4 input, 16 column-major numbers out. */
    private String columnMajor(Transform node, ArrayValue m) {
        if (m == null || (m.size() != 3 && m.size() != 4)) {
            throw new TranspileException("multmatrix requires a 3x4 or 4x4 matrix", node);
        }
        double[][] rows = new double[4][];
        for (int i = 0; i < m.size(); i++) {
            List<Double> row = components(node, "multmatrix row", m.get(i), 4, 4, 0);
            rows[i] = new double[] {row.get(0), row.get(1), row.get(2), row.get(3)};
        }
        if (rows[3] == null) {
            rows[3] = new double[] {0, 0, 0, 1};
        } else if (rows[3][0] != 0 || rows[3][1] != 0 || rows[3][2] != 0 || rows[3][3] != 1) {
            throw new TranspileException("multmatrix last row must be [0, 0, 0, 1]", node);
        }

        double[] flat = new double[16];
        for (int col = 0; col < 4; col++) {
            for (int row = 0; row < 4; row++) {
                flat[col * 4 + row] = rows[row][col];
            }
        }
        return Numbers.array(flat);
    }

    // ---------- boolean operations ----------

    private String emitBoolean(BooleanOp node) {
        if (extrusion != null) {
            throw new TranspileException(node.operation().keyword() + " of 2D shapes inside " + extrusion
                    + " is not supported", node);
        }
        List<String> children = emitAll(node.children());
        if (children.isEmpty()) return null;

        String method = switch (node.operation()) {
            case UNION -> "add";
            case DIFFERENCE -> "subtract";
            case INTERSECTION -> "intersect";
        };
        return combine(children, method);
    }

    /**
     * Folds {@code operands} left to right with {@code method}. The first operand is
     * the base, which keeps difference and intersection in source order.
     */
    private String combine(List<String> operands, String method) {
        if (operands.size() == 1) return operands.get(0);

        String current = stored(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            String operand = stored(operands.get(i));
            String next = out.newVar();
            out.assign(next, current + "." + method + "(" + operand + ")");
            out.delete(current);
            out.delete(operand);
            current = next;
        }
        return current;
    }

    private String stored(String expr) {
        if (Emitter.isVar(expr)) return expr;
        String var = out.newVar();
        out.assign(var, expr);
        return var;
    }

    // ---------- extrusions ----------

    private String emitExtrude(Extrude node) {
        String keyword = node.extrude().keyword();
        if (extrusion != null) {
            throw new TranspileException(keyword + " cannot be nested inside " + extrusion, node);
        }

        extrusion = keyword;
        List<String> children = emitAll(node.children());
        extrusion = null;

        if (children.isEmpty()) {
            throw new TranspileException("Extrusion " + keyword + " has no children", node);
        }
        if (children.size() > 1) {
            throw new TranspileException(keyword + " takes exactly one 2D child, found " + children.size(), node);
        }
        String points = children.get(0);

        return switch (node.extrude()) {
            case LINEAR_EXTRUDE -> linearExtrude(node, (LinearExtrudeArgs) node.args(), points);
            case ROTATE_EXTRUDE -> rotateExtrude((RotateExtrudeArgs) node.args(), points);
        };
    }

    private String linearExtrude(Extrude node, LinearExtrudeArgs args, String points) {
        double height = args.height() != null ? args.height() : 1;
        double slices = args.slices() != null ? args.slices() : 0;
        double twist = args.twist() != null ? args.twist() : 0;
        double scale = 1;
        if (args.scale() instanceof NumberValue n) {
            scale = n.value();
        } else if (args.scale() instanceof ArrayValue v) {
            if (v.size() == 0) throw new TranspileException("linear_extrude scale vector is empty", node);
            scale = ((NumberValue) v.get(0)).value();
        }
        boolean center = Boolean.TRUE.equals(args.center());

        return "M.Manifold.extrude(" + points + ", " + Numbers.format(height) + ", " + Numbers.format(slices)
                + ", " + Numbers.format(twist) + ", " + Numbers.format(scale) + ", " + center + ")";
    }

    private String rotateExtrude(RotateExtrudeArgs args, String points) {
        double angle = args.angle() != null ? args.angle() : 360;
        return "M.Manifold.revolve(" + points + ", " + segments(args.fn()) + ", " + Numbers.format(angle) + ")";
    }

    // ---------- values ----------

    private static <T> T required(Transform node, T value) {
        if (value == null) {
            throw new TranspileException(node.transform().keyword() + " requires a vector argument", node);
        }
        return value;
    }

    /**
     * Numeric components of a vector with {@code min..max} elements, padded to
     * {@code max} with {@code fill}.
     */
    private static List<Double> components(Node node, String what, Value value, int min, int max, double fill) {
        if (!(value instanceof ArrayValue arr) || arr.size() < min || arr.size() > max || !arr.isNumeric()) {
            String count = min == max ? String.valueOf(min) : min + " or " + max;
            throw new TranspileException(what + " must be a vector of " + count + " numbers", node);
        }
        List<Double> result = new ArrayList<>(max);
        for (Value v : arr.elements()) result.add(((NumberValue) v).value());
        while (result.size() < max) result.add(fill);
        return result;
    }
}
