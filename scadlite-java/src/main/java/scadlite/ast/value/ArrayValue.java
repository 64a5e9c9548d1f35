package scadlite.ast.value;

import java.util.List;

public record ArrayValue(List<Value> elements) implements Value {

    public ArrayValue {
        elements = List.copyOf(elements);
    }

    public int size() { return elements.size(); }

    public Value get(int index) { return elements.get(index); }

    /** True when every element is a {@link NumberValue}. */
    public boolean isNumeric() {
        for (Value v : elements) {
            if (!(v instanceof NumberValue)) return false;
        }
        return true;
    }

    @Override
    public String describe() { return "array"; }
}
