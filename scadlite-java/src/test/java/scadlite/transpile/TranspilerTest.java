package scadlite.transpile;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import scadlite.ast.Node;
import scadlite.ast.Position;
import scadlite.ast.Program;
import scadlite.ast.Transform;
import scadlite.ast.args.CubeArgs;
import scadlite.ast.args.TranslateArgs;
import scadlite.ast.PrimitiveCall;
import scadlite.ast.value.ArrayValue;
import scadlite.ast.value.NumberValue;
import scadlite.error.ErrorKind;
import scadlite.parser.Parser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TranspilerTest {

    private static String js(String src) {
        return new Transpiler().transpile(Parser.parse(src));
    }

    private static String js(String src, TranspileOptions options) {
        return new Transpiler(options).transpile(Parser.parse(src));
    }

    private static TranspileException fails(String src) {
        return assertThrows(TranspileException.class, () -> js(src));
    }

    // ---------- primitives ----------

    @Test
    void emit_cube() {
        assertEquals("return M.Manifold.cube([10, 10, 10], false);", js("cube([10, 10, 10]);"));
        assertEquals("return M.Manifold.cube([5, 5, 5], true);", js("cube(5, center=true);"));
        assertEquals("return M.Manifold.cube([1, 1, 1], false);", js("cube();"));
    }

    @Test
    void emit_cube_rejects_two_component_size() {
        var ex = fails("cube([1, 2]);");
        assertEquals("cube size must be a vector of 3 numbers", ex.getMessage());
        assertEquals(ErrorKind.TRANSPILE, ex.kind());
    }

    @Test
    void emit_sphere_uses_default_segments() {
        assertEquals("return M.Manifold.sphere(5, 32);", js("sphere(5);"));
        assertEquals("return M.Manifold.sphere(10, 32);", js("sphere(d=20);"));
    }

    @Test
    void emit_cylinder_radius_rules() {
        assertEquals("return M.Manifold.cylinder(10, 2, 2, 32, false);", js("cylinder(h=10, r=2);"));
        assertEquals("return M.Manifold.cylinder(10, 3, 3, 32, false);", js("cylinder(h=10, r1=3);"));
        assertEquals("return M.Manifold.cylinder(4, 2, 0, 32, true);", js("cylinder(h=4, r1=2, r2=0, center=true);"));
        assertEquals("return M.Manifold.cylinder(1, 1, 1, 32, false);", js("cylinder();"));
    }

    @ParameterizedTest
    @CsvSource({
            "4, 16",
            "16, 16",
            "48, 48",
            "128, 128",
            "256, 128"
    })
    void emit_clamps_global_fn(int fn, int expected) {
        assertEquals("return M.Manifold.sphere(5, " + expected + ");", js("$fn = " + fn + "; sphere(5);"));
    }

    @Test
    void emit_call_fn_overrides_global() {
        assertEquals("return M.Manifold.sphere(5, 20);", js("$fn = 64; sphere(5, $fn=20);"));
    }

    @Test
    void emit_fn_is_scoped_to_block() {
        String out = js("union() { $fn = 64; sphere(1); } sphere(2);");
        assertTrue(out.contains("M.Manifold.sphere(1, 64)"), out);
        assertTrue(out.contains("M.Manifold.sphere(2, 32)"), out);
    }

    @Test
    void emit_fn_applies_only_to_later_siblings() {
        String out = js("sphere(1); $fn = 100; sphere(2);");
        assertTrue(out.contains("M.Manifold.sphere(1, 32)"), out);
        assertTrue(out.contains("M.Manifold.sphere(2, 100)"), out);
    }

    @Test
    void emit_ignores_other_special_variables() {
        assertEquals("return M.Manifold.sphere(1, 32);", js("$fa = 12; $fs = 2; $vpr = [0, 0, 0]; sphere(1);"));
    }

    @Test
    void emit_unsupported_primitives() {
        assertEquals("Unsupported primitive: polyhedron",
                fails("polyhedron(points=[[0,0,0],[1,0,0],[0,1,0],[0,0,1]], faces=[[0,1,2],[0,1,3]]);").getMessage());
        assertEquals("Unsupported primitive: text", fails("text(\"hi\");").getMessage());
    }

    @Test
    void emit_2d_primitive_outside_extrusion_fails() {
        var ex = fails("circle(5);");
        assertTrue(ex.getMessage().contains("2D"));
        assertEquals(1, ex.line());
        assertEquals(1, ex.column());
    }

    // ---------- transforms ----------

    @Test
    void emit_translate() {
        assertEquals("""
                const _v1 = M.Manifold.cube([1, 1, 1], false);
                const _v2 = _v1.translate([10, 0, 0]);
                _v1.delete();
                return _v2;""", js("translate([10, 0, 0]) cube(1);"));
    }

    @Test
    void emit_transform_vectors() {
        assertTrue(js("translate([1.5, 2.75, 3.125]) cube(1);").contains(".translate([1.5, 2.75, 3.125])"));
        assertTrue(js("translate([-5, -10, -15]) cube(1);").contains(".translate([-5, -10, -15])"));
        assertTrue(js("translate([1, 2]) cube(1);").contains(".translate([1, 2, 0])"));
        assertTrue(js("scale(2) cube(1);").contains(".scale([2, 2, 2])"));
        assertTrue(js("scale([2, 3]) cube(1);").contains(".scale([2, 3, 1])"));
        assertTrue(js("mirror([1, 0, 0]) cube(1);").contains(".mirror([1, 0, 0])"));
    }

    @Test
    void emit_rotate_forms() {
        assertTrue(js("rotate(45) cube(1);").contains(".rotate([0, 0, 45])"));
        assertTrue(js("rotate([90, 0, 30]) cube(1);").contains(".rotate([90, 0, 30])"));
        assertTrue(js("rotate(a=45, v=[0, 0, 1]) cube(1);").contains(".rotate([0, 0, 45])"));
        assertTrue(js("rotate() cube(1);").contains(".rotate([0, 0, 0])"));
    }

    @Test
    void emit_rotate_about_custom_axis_fails() {
        assertThrows(TranspileException.class, () -> js("rotate(a=45, v=[1, 0, 0]) cube(1);"));
    }

    @Test
    void emit_multmatrix_column_major() {
        String out = js("multmatrix([[1, 0, 0, 10], [0, 1, 0, 20], [0, 0, 1, 30]]) cube(1);");
        assertTrue(out.contains(".transform([1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1, 0, 10, 20, 30, 1])"), out);

        String full = js("multmatrix([[2, 0, 0, 1], [0, 2, 0, 2], [0, 0, 2, 3], [0, 0, 0, 1]]) cube(1);");
        assertTrue(full.contains(".transform([2, 0, 0, 0, 0, 2, 0, 0, 0, 0, 2, 0, 1, 2, 3, 1])"), full);
    }

    @Test
    void emit_multmatrix_rejects_projective_row() {
        assertThrows(TranspileException.class,
                () -> js("multmatrix([[1, 0, 0, 0], [0, 1, 0, 0], [0, 0, 1, 0], [0, 0, 1, 0]]) cube(1);"));
    }

    @Test
    void emit_color_is_transparent() {
        assertEquals("return M.Manifold.cube([1, 1, 1], false);", js("color(\"red\") cube(1);"));
    }

    @ParameterizedTest
    @CsvSource({
            "'hull() { cube(1); sphere(1); }', hull",
            "'minkowski() { cube(1); sphere(1); }', minkowski",
            "'resize([2, 2, 2]) cube(1);', resize",
            "'offset(r=1) cube(1);', offset"
    })
    void emit_unsupported_transforms(String src, String name) {
        var ex = fails(src);
        assertEquals("Transform " + name + " is not supported", ex.getMessage());
    }

    @Test
    void emit_transform_without_children_fails() {
        assertEquals("Transform translate has no children", fails("translate([1, 0, 0]);").getMessage());
    }

    @Test
    void emit_transform_unions_several_children() {
        assertEquals("""
                const _v1 = M.Manifold.cube([1, 1, 1], false);
                const _v2 = M.Manifold.sphere(1, 32);
                const _v3 = _v1.add(_v2);
                _v1.delete();
                _v2.delete();
                const _v4 = _v3.translate([0, 0, 5]);
                _v3.delete();
                return _v4;""", js("translate([0, 0, 5]) { cube(1); sphere(1); }"));
    }

    // ---------- boolean operations ----------

    @Test
    void emit_difference_in_source_order() {
        assertEquals("""
                const _v1 = M.Manifold.cube([10, 10, 10], false);
                const _v2 = M.Manifold.sphere(6, 32);
                const _v3 = _v1.subtract(_v2);
                _v1.delete();
                _v2.delete();
                return _v3;""", js("difference() { cube(10); sphere(6); }"));
    }

    @Test
    void emit_intersection_chains_left_to_right() {
        String out = js("intersection() { cube(10); sphere(6); cylinder(h=20, r=3); }");
        assertTrue(out.contains("const _v3 = _v1.intersect(_v2);"), out);
        assertTrue(out.contains("const _v5 = _v3.intersect(_v4);"), out);
        assertTrue(out.endsWith("return _v5;"), out);
        assertTrue(out.indexOf("cube") < out.indexOf("sphere"));
        assertTrue(out.indexOf("sphere") < out.indexOf("cylinder"));
    }

    @Test
    void emit_single_child_boolean_is_child() {
        assertEquals("return M.Manifold.sphere(2, 32);", js("union() { sphere(2); }"));
    }

    @Test
    void emit_empty_program_and_empty_boolean() {
        assertEquals("return undefined;", js(""));
        assertEquals("return undefined;", js("union() {}"));
        assertEquals("return undefined;", js("$fn = 12;"));
    }

    @Test
    void emit_top_level_statements_are_unioned() {
        assertEquals("""
                const _v1 = M.Manifold.cube([1, 1, 1], false);
                const _v2 = M.Manifold.sphere(1, 32);
                const _v3 = _v1.add(_v2);
                _v1.delete();
                _v2.delete();
                return _v3;""", js("cube(1); sphere(1);"));
    }

    // ---------- extrusions ----------

    @Test
    void emit_linear_extrude_square() {
        assertEquals("return M.Manifold.extrude([[0, 0], [2, 0], [2, 2], [0, 2]], 5, 0, 0, 1, false);",
                js("linear_extrude(height=5) square(2);"));
    }

    @Test
    void emit_linear_extrude_all_parameters() {
        assertEquals("return M.Manifold.extrude([[-1, -1], [1, -1], [1, 1], [-1, 1]], 10, 20, 90, 0.5, true);",
                js("linear_extrude(height=10, twist=90, slices=20, scale=0.5, center=true) square(2, center=true);"));
    }

    @Test
    void emit_linear_extrude_vector_scale_uses_first_component() {
        assertTrue(js("linear_extrude(height=2, scale=[0.25, 0.75]) square(1);").endsWith(", 2, 0, 0, 0.25, false);"));
    }

    @Test
    void emit_circle_points() {
        String out = js("linear_extrude(height=1) circle(r=1, $fn=16);");
        assertTrue(out.startsWith("return M.Manifold.extrude([[1, 0], "), out);
        assertTrue(out.contains("[0, 1]"), out);
        assertTrue(out.contains("[-1, 0]"), out);
        assertEquals(16, out.split("\\], \\[").length);
    }

    @Test
    void emit_polygon_points() {
        assertEquals("return M.Manifold.extrude([[0, 0], [4, 0], [0, 3]], 1, 0, 0, 1, false);",
                js("linear_extrude(1) polygon([[0, 0], [4, 0], [0, 3]]);"));
    }

    @Test
    void emit_rotate_extrude() {
        assertEquals("return M.Manifold.revolve([[2, 0], [3, 0], [3, 1], [2, 1]], 32, 360);",
                js("rotate_extrude() polygon(points=[[2, 0], [3, 0], [3, 1], [2, 1]]);"));
        assertTrue(js("rotate_extrude(angle=90, $fn=20) square(1);").endsWith(", 20, 90);"));
    }

    @Test
    void emit_extrusion_child_rules() {
        assertTrue(fails("linear_extrude(height=1) { square(1); circle(1); }").getMessage().contains("exactly one"));
        assertTrue(fails("linear_extrude(height=1) cube(1);").getMessage().contains("cube"));
        assertTrue(fails("linear_extrude(height=1) translate([1, 0]) square(1);").getMessage().contains("translate"));
        assertEquals("Extrusion linear_extrude has no children", fails("linear_extrude(height=1);").getMessage());
    }

    // ---------- options and guards ----------

    @Test
    void emit_with_custom_options() {
        assertEquals("return M.Manifold.sphere(1, 64);", js("sphere(1);", new TranspileOptions().withDefaultFn(64)));
        assertEquals("return M.Manifold.sphere(1, 8);", js("sphere(1);", new TranspileOptions(8, 3, 10)));
        assertEquals("return M.Manifold.sphere(1, 10);", js("sphere(1, $fn=50);", new TranspileOptions(8, 3, 10)));
    }

    @Test
    void options_validate() {
        assertThrows(IllegalArgumentException.class, () -> new TranspileOptions(0, 16, 128));
        assertThrows(IllegalArgumentException.class, () -> new TranspileOptions(32, 2, 128));
        assertThrows(IllegalArgumentException.class, () -> new TranspileOptions(32, 64, 16));
    }

    @Test
    void emit_is_deterministic_and_reusable() {
        String src = "difference() { cube(10, center=true); translate([0, 0, 2]) sphere(6); }";
        var transpiler = new Transpiler();
        var program = Parser.parse(src);
        assertEquals(transpiler.transpile(program), transpiler.transpile(program));
        assertEquals(js(src), transpiler.transpile(program));
    }

    @Test
    void emit_rejects_overly_deep_hand_built_tree() {
        var pos = new Position(1, 1);
        var offset = new TranslateArgs(new ArrayValue(List.of(new NumberValue(1), new NumberValue(0), new NumberValue(0))));
        Node node = new PrimitiveCall(PrimitiveCall.Primitive.CUBE, new CubeArgs(null, null), pos);
        for (int i = 0; i < Parser.MAX_NESTING_DEPTH + 10; i++) {
            node = new Transform(Transform.Kind.TRANSLATE, offset, List.of(node), pos);
        }
        var program = new Program(List.of(node), pos);
        var ex = assertThrows(TranspileException.class, () -> new Transpiler().transpile(program));
        assertTrue(ex.getMessage().startsWith("Maximum nesting depth"));
    }

    @Test
    void emit_rejects_nested_program() {
        var pos = new Position(1, 1);
        var program = new Program(List.of(new Program(List.of(), pos)), pos);
        assertThrows(TranspileException.class, () -> new Transpiler().transpile(program));
    }
}
