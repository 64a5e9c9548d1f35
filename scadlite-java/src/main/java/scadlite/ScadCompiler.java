package scadlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scadlite.ast.Program;
import scadlite.lexer.Lexer;
import scadlite.lexer.Token;
import scadlite.parser.Parser;
import scadlite.transpile.TranspileOptions;
import scadlite.transpile.Transpiler;

import java.util.List;

/**
 * Entry points for the whole pipeline. Each call builds its own lexer, parser
 * and transpiler, so these methods are safe to call from any thread.
 */
public final class ScadCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ScadCompiler.class);

    private ScadCompiler() {}

    public static List<Token> lex(String source) {
        long start = System.nanoTime();
        List<Token> tokens = new Lexer(source).tokenize();
        logger.debug("Lexed {} tokens in {} us", tokens.size(), micros(start));
        return tokens;
    }

    public static Program parse(String source) {
        List<Token> tokens = lex(source);
        long start = System.nanoTime();
        Program program = new Parser(tokens).parseProgram();
        logger.debug("Parsed {} top-level statements in {} us", program.body().size(), micros(start));
        return program;
    }

    public static String transpile(Program program) {
        return transpile(program, new TranspileOptions());
    }

    public static String transpile(Program program, TranspileOptions options) {
        long start = System.nanoTime();
        String code = new Transpiler(options).transpile(program);
        logger.debug("Transpiled to {} lines in {} us", code.lines().count(), micros(start));
        return code;
    }

    public static String compile(String source) {
        return compile(source, new TranspileOptions());
    }

    /** Source text to a JavaScript function body returning a Manifold solid. */
    public static String compile(String source, TranspileOptions options) {
        return transpile(parse(source), options);
    }

    private static long micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000;
    }
}
