package scadlite;

import org.junit.jupiter.api.Test;
import scadlite.ast.PrimitiveCall;
import scadlite.ast.args.SphereArgs;
import scadlite.error.ErrorKind;
import scadlite.error.ScadException;
import scadlite.lexer.TokenType;
import scadlite.transpile.TranspileOptions;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScadCompilerTest {

    private static final String MODEL = """
            // bracket
            $fn = 48;
            difference() {
                cube([20, 10, 5]);
                translate([5, 5, -1]) cylinder(h=7, d=3);
                translate([15, 5, -1]) cylinder(h=7, d=3);
            }
            """;

    @Test
    void compile_is_deterministic() {
        assertEquals(ScadCompiler.compile(MODEL), ScadCompiler.compile(MODEL));
    }

    @Test
    void compile_keeps_difference_order() {
        String out = ScadCompiler.compile(MODEL);
        assertTrue(out.contains("const _v2 = _v1.translate([5, 5, -1]);"), out);
        assertTrue(out.contains("const _v4 = _v3.translate([15, 5, -1]);"), out);
        assertTrue(out.contains("const _v5 = M.Manifold.cube([20, 10, 5], false);"), out);
        assertTrue(out.contains("const _v6 = _v5.subtract(_v2);"), out);
        assertTrue(out.contains("const _v7 = _v6.subtract(_v4);"), out);
        assertTrue(out.endsWith("return _v7;"), out);
        assertTrue(out.contains("M.Manifold.cylinder(7, 1.5, 1.5, 48, false)"), out);
        assertEquals(2, out.split("\\.subtract\\(", -1).length - 1);
    }

    @Test
    void sphere_diameter_reaches_tree_as_radius() {
        var call = (PrimitiveCall) ScadCompiler.parse("sphere(d=20);").body().get(0);
        assertEquals(new SphereArgs(10.0, null, null, null), call.args());
    }

    @Test
    void lex_edge_cases_through_facade() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.DOT, TokenType.EOF),
                ScadCompiler.lex("1.").stream().map(t -> t.type()).toList());
        assertEquals(List.of(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.EOF),
                ScadCompiler.lex("1e").stream().map(t -> t.type()).toList());
    }

    @Test
    void compile_with_options() {
        assertEquals("return M.Manifold.sphere(1, 100);",
                ScadCompiler.compile("sphere(1);", new TranspileOptions().withDefaultFn(100)));
    }

    @Test
    void every_stage_reports_its_kind() {
        assertEquals(ErrorKind.LEX, kindOf("cube(1) # "));
        assertEquals(ErrorKind.PARSE, kindOf("for (i = [0:1]) cube(1);"));
        assertEquals(ErrorKind.TRANSPILE, kindOf("hull() cube(1);"));
    }

    @Test
    void overflowing_literal_fails_at_its_token() {
        var ex = assertThrows(ScadException.class, () -> ScadCompiler.compile("cube(1);\ncube(1e400);"));
        assertEquals(ErrorKind.PARSE, ex.kind());
        assertEquals(2, ex.line());
        assertEquals(6, ex.column());
        assertEquals("1e400", ex.found());
    }

    @Test
    void compile_from_many_threads() throws Exception {
        String expected = ScadCompiler.compile(MODEL);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> jobs = new ArrayList<>();
            for (int i = 0; i < 16; i++) jobs.add(() -> ScadCompiler.compile(MODEL));
            for (Future<String> f : pool.invokeAll(jobs)) {
                assertEquals(expected, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static ErrorKind kindOf(String src) {
        return assertThrows(ScadException.class, () -> ScadCompiler.compile(src)).kind();
    }
}
