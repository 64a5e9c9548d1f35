package scadlite.ast.value;

import java.util.Objects;

public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String describe() { return "string"; }
}
