package scadlite.cli;

import scadlite.ScadCompiler;
import scadlite.error.ScadException;
import scadlite.parser.ParseException;
import scadlite.parser.Parser;
import scadlite.transpile.TranspileOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {

    private static final String USAGE = "Usage: scadlite [--fn N] [-o output.js] <input.scad>";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs one compilation and returns the process exit status. */
    public static int run(String[] args) {
        TranspileOptions options = new TranspileOptions();
        Path input = null;
        Path output = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--fn" -> {
                    if (i + 1 >= args.length) return usage("--fn requires a value");
                    try {
                        options = options.withDefaultFn(Integer.parseInt(args[++i]));
                    } catch (IllegalArgumentException e) {
                        return usage("Invalid --fn value: " + args[i]);
                    }
                }
                case "-o" -> {
                    if (i + 1 >= args.length) return usage("-o requires a path");
                    output = Path.of(args[++i]);
                }
                default -> {
                    if (arg.startsWith("-") || input != null) return usage("Unexpected argument: " + arg);
                    input = Path.of(arg);
                }
            }
        }
        if (input == null) return usage(null);
        if (output == null) {
            output = Path.of(input.toString().replaceFirst("\\.scad$", "") + ".js");
        }

        try {
            // 1. Reading
            String source = Files.readString(input, StandardCharsets.UTF_8);
            System.out.println("[1/4] Reading: " + input);

            // 2. Lexer
            var tokens = ScadCompiler.lex(source);
            System.out.println("[2/4] Lexer: " + tokens.size() + " tokens");

            // 3. Parser
            var program = new Parser(tokens).parseProgram();
            System.out.println("[3/4] Parser: " + program.body().size() + " statements");

            // 4. Transpiler
            String code = ScadCompiler.transpile(program, options);
            System.out.println("[4/4] Transpiler: " + code.lines().count() + " lines");

            Files.writeString(output, code + "\n", StandardCharsets.UTF_8);
            System.out.println("\nSuccess: " + output);
            return 0;
        } catch (ParseException e) {
            System.err.println(e.toRetryContext());
            return 1;
        } catch (ScadException e) {
            System.err.println(e.kind() + " error at line " + e.line() + ", column " + e.column() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private static int usage(String problem) {
        if (problem != null) System.err.println(problem);
        System.err.println(USAGE);
        return 2;
    }
}
