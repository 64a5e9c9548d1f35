package scadlite.ast.value;

public record BoolValue(boolean value) implements Value {

    @Override
    public String describe() { return "boolean"; }
}
