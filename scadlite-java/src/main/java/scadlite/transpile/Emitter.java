package scadlite.transpile;

import java.util.ArrayList;
import java.util.List;

/** Collects the statement lines of one generated program and hands out temporaries. */
final class Emitter {
    private final List<String> lines = new ArrayList<>();
    private int varCounter = 0;

    String newVar() {
        return "_v" + (++varCounter);
    }

    static boolean isVar(String expr) {
        return expr.startsWith("_v");
    }

    void assign(String var, String expr) {
        lines.add("const " + var + " = " + expr + ";");
    }

    void delete(String var) {
        lines.add(var + ".delete();");
    }

    String render(String result) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.append("return ").append(result).append(';').toString();
    }
}
