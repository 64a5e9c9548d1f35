package scadlite.parser;

import scadlite.ast.value.Value;
import scadlite.lexer.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one call as written, before they are mapped onto the typed
 * record of the construct. Named arguments keep source order; a repeated name
 * keeps its last value.
 */
public record ArgList(
        List<Argument> positional,
        Map<String, Argument> named
) {
    /** A value together with the token it starts at. */
    public record Argument(Value value, Token at) {}

    public ArgList {
        positional = List.copyOf(positional);
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public static ArgList empty() {
        return new ArgList(List.of(), Map.of());
    }

    /** Named value if present, else the positional one at {@code index} (ignored when negative). */
    public Argument find(String name, int index) {
        Argument a = named.get(name);
        if (a != null) return a;
        if (index >= 0 && index < positional.size()) return positional.get(index);
        return null;
    }
}
