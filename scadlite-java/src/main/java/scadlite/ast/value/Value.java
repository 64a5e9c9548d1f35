package scadlite.ast.value;

/** The only value forms the DSL subset can express. */
public sealed interface Value
        permits NumberValue, BoolValue, StringValue, ArrayValue {

    /** Short name of the form, as used in diagnostics. */
    String describe();
}
