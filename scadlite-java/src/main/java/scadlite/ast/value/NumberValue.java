package scadlite.ast.value;

public record NumberValue(double value) implements Value {

    @Override
    public String describe() { return "number"; }
}
