package scadlite.parser;

import scadlite.ast.*;
import scadlite.ast.args.ExtrudeArgs;
import scadlite.ast.args.PrimitiveArgs;
import scadlite.ast.args.TransformArgs;
import scadlite.ast.value.*;
import scadlite.lexer.Lexer;
import scadlite.lexer.Token;
import scadlite.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-pass recursive descent over an immutable token list. Top-level
 * statements and child blocks share one dispatcher; anything outside the
 * supported subset raises {@link ParseException}.
 */
public final class Parser {

    /** Deepest allowed nesting of child blocks and arrays. */
    public static final int MAX_NESTING_DEPTH = 256;

    private static final int ITERATIONS_PER_TOKEN = 100;

    private static final List<String> STATEMENT_STARTS =
            List.of("cube", "sphere", "translate", "union", "difference", "linear_extrude");
    private static final List<String> BLOCK_STATEMENT_STARTS =
            List.of("cube", "sphere", "translate", "union", "difference", "linear_extrude", "}");
    private static final List<String> VALUE_FORMS =
            List.of("number", "array", "true", "false", "string");

    // keywords that double as argument names, e.g. linear_extrude(scale=0.5)
    private static final Set<TokenType> ARGUMENT_NAMES = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.SPECIAL_VAR,
            TokenType.SCALE, TokenType.COLOR, TokenType.OFFSET, TokenType.TEXT);

    private static final Set<TokenType> OPERATORS = EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.DIVIDE,
            TokenType.MODULO, TokenType.POWER,
            TokenType.EQUAL, TokenType.NOT_EQUAL,
            TokenType.LESS_THAN, TokenType.LESS_EQUAL,
            TokenType.GREATER_THAN, TokenType.GREATER_EQUAL,
            TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.QUESTION);

    private static final Set<String> SPECIAL_VARIABLES =
            Set.of("$fn", "$fa", "$fs", "$t", "$vpr", "$vpt", "$vpd");
    private static final Set<String> VECTOR_SPECIAL_VARIABLES = Set.of("$vpr", "$vpt");

    private final List<Token> tokens;
    private final int maxIterations;
    private int pos = 0;
    private int iterations = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
        this.maxIterations = tokens.size() * ITERATIONS_PER_TOKEN;
    }

    /** Lexes and parses {@code source} in one call. */
    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }

    // ---------- entry ----------
    public Program parseProgram() {
        Position start = positionOf(peek());
        List<Node> body = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            tick();
            if (match(TokenType.SEMICOLON)) continue;
            body.add(parseStatement(false));
        }
        return new Program(body, start);
    }

    // ---------- statements ----------
    private Node parseStatement(boolean inBlock) {
        Token t = peek();
        return switch (t.type()) {
            case FOR, IF, ELSE, MODULE, FUNCTION, LET, EACH -> throw unsupported(t);

            case SPECIAL_VAR -> parseSpecialVarAssign();

            case CUBE, SPHERE, CYLINDER, POLYHEDRON,
                 CIRCLE, SQUARE, POLYGON, TEXT -> parsePrimitive();

            case TRANSLATE, ROTATE, SCALE, RESIZE, MIRROR,
                 MULTMATRIX, COLOR, OFFSET, HULL, MINKOWSKI -> parseTransform();

            case UNION, DIFFERENCE, INTERSECTION -> parseBoolean();

            case LINEAR_EXTRUDE, ROTATE_EXTRUDE -> parseExtrude();

            case IDENTIFIER -> {
                if (checkNext(TokenType.ASSIGN)) {
                    throw new ParseException(
                            "Unsupported feature: variable assignment. Only special variables ($fn, $fa, $fs) are supported.",
                            t.line(), t.column(), t.lexeme(), List.of());
                }
                throw error(t, "Unexpected identifier '" + t.lexeme()
                        + "'. Expected a primitive, transform, boolean operation, or extrusion.", STATEMENT_STARTS);
            }

            case EOF -> throw error(t, "Unexpected end of input, expected a statement",
                    inBlock ? BLOCK_STATEMENT_STARTS : STATEMENT_STARTS);

            default -> throw error(t, "Unexpected token '" + found(t) + "'" + (inBlock ? " in children block" : ""),
                    inBlock ? BLOCK_STATEMENT_STARTS : STATEMENT_STARTS);
        };
    }

    private PrimitiveCall parsePrimitive() {
        Token kw = advance();
        var primitive = PrimitiveCall.Primitive.valueOf(kw.type().name());

        consume(TokenType.LPAREN, "(");
        ArgList raw = parseArgumentList();
        consume(TokenType.RPAREN, ")");
        consume(TokenType.SEMICOLON, ";");

        PrimitiveArgs args = ArgumentMapper.primitive(primitive, raw);
        return new PrimitiveCall(primitive, args, positionOf(kw));
    }

    private Transform parseTransform() {
        Token kw = advance();
        var kind = Transform.Kind.valueOf(kw.type().name());

        consume(TokenType.LPAREN, "(");
        ArgList raw = parseArgumentList();
        consume(TokenType.RPAREN, ")");
        TransformArgs args = ArgumentMapper.transform(kind, raw);

        List<Node> children = parseChildren();
        return new Transform(kind, args, children, positionOf(kw));
    }

    private BooleanOp parseBoolean() {
        Token kw = advance();
        var operation = BooleanOp.Operation.valueOf(kw.type().name());

        // arguments are accepted and dropped
        consume(TokenType.LPAREN, "(");
        ArgList raw = parseArgumentList();
        consume(TokenType.RPAREN, ")");
        ArgumentMapper.booleanOp(operation, raw);

        List<Node> children = parseChildren();
        return new BooleanOp(operation, children, positionOf(kw));
    }

    private Extrude parseExtrude() {
        Token kw = advance();
        var kind = Extrude.Kind.valueOf(kw.type().name());

        consume(TokenType.LPAREN, "(");
        ArgList raw = parseArgumentList();
        consume(TokenType.RPAREN, ")");
        ExtrudeArgs args = ArgumentMapper.extrude(kind, raw);

        List<Node> children = parseChildren();
        return new Extrude(kind, args, children, positionOf(kw));
    }

    private SpecialVarAssign parseSpecialVarAssign() {
        Token name = advance();
        if (!SPECIAL_VARIABLES.contains(name.lexeme())) {
            throw error(name, "Unknown special variable '" + name.lexeme() + "'", List.of("$fn", "$fa", "$fs"));
        }

        consume(TokenType.ASSIGN, "=");
        Token valueStart = peek();
        Value value = parseValue();
        rejectOperator(";");
        consume(TokenType.SEMICOLON, ";");

        boolean vector = VECTOR_SPECIAL_VARIABLES.contains(name.lexeme());
        boolean ok = vector
                ? value instanceof ArrayValue arr && arr.isNumeric()
                : value instanceof NumberValue;
        if (!ok) {
            String shape = vector ? "numeric vector" : "number";
            throw error(valueStart, "Special variable " + name.lexeme() + " must be a " + shape
                    + ", found " + value.describe(), List.of(shape));
        }
        return new SpecialVarAssign(name.lexeme(), value, positionOf(name));
    }

    // ---------- children ----------

    /** {@code { stmt* }} with an optional trailing ';', or exactly one statement. */
    private List<Node> parseChildren() {
        enter(peek());
        List<Node> children = new ArrayList<>();

        if (match(TokenType.LBRACE)) {
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                tick();
                if (match(TokenType.SEMICOLON)) continue;
                children.add(parseStatement(true));
            }
            consume(TokenType.RBRACE, "}");
            match(TokenType.SEMICOLON);
        } else if (!match(TokenType.SEMICOLON)) {
            children.add(parseStatement(false));
        }

        depth--;
        return children;
    }

    // ---------- arguments ----------
    private ArgList parseArgumentList() {
        if (check(TokenType.RPAREN)) return ArgList.empty();

        List<ArgList.Argument> positional = new ArrayList<>();
        Map<String, ArgList.Argument> named = new LinkedHashMap<>();
        do {
            Token t = peek();
            if (ARGUMENT_NAMES.contains(t.type()) && checkNext(TokenType.ASSIGN)) {
                advance();
                advance();
                named.put(t.lexeme(), parseArgumentValue());
            } else {
                positional.add(parseArgumentValue());
            }
        } while (match(TokenType.COMMA));

        return new ArgList(positional, named);
    }

    private ArgList.Argument parseArgumentValue() {
        Token at = peek();
        Value v = parseValue();
        rejectOperator(")");
        return new ArgList.Argument(v, at);
    }

    // ---------- values ----------
    private Value parseValue() {
        Token t = peek();
        switch (t.type()) {
            case LBRACKET -> {
                return parseArray();
            }
            case NUMBER -> {
                advance();
                return new NumberValue(number(t));
            }
            case MINUS -> {
                advance();
                Token n = consume(TokenType.NUMBER, "number");
                return new NumberValue(-number(n));
            }
            case TRUE -> {
                advance();
                return new BoolValue(true);
            }
            case FALSE -> {
                advance();
                return new BoolValue(false);
            }
            case STRING -> {
                advance();
                return new StringValue(t.lexeme());
            }
            case IDENTIFIER -> {
                if (checkNext(TokenType.LPAREN)) {
                    throw error(t, "Unsupported feature: function calls are not supported in values. Replace '"
                            + t.lexeme() + "(...)' with its computed value.", VALUE_FORMS);
                }
                throw error(t, "Unsupported feature: variable references are not supported. Replace '"
                        + t.lexeme() + "' with a literal value.", VALUE_FORMS);
            }
            case UNDEF -> throw error(t, "Unsupported feature: undef is not supported as a value.", VALUE_FORMS);
            default -> throw error(t, "Expected a value, found '" + found(t) + "'", VALUE_FORMS);
        }
    }

    /** Literal value of a NUMBER token; literals that overflow a double, like 1e400, are rejected. */
    private static double number(Token t) {
        double v = Double.parseDouble(t.lexeme());
        if (Double.isInfinite(v)) {
            throw error(t, "Number literal '" + t.lexeme() + "' is out of range", List.of("number"));
        }
        return v;
    }

    private ArrayValue parseArray() {
        enter(consume(TokenType.LBRACKET, "["));
        List<Value> elements = new ArrayList<>();

        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(parseValue());
                rejectOperator("]");
                if (check(TokenType.COLON)) {
                    throw error(peek(), "Unsupported feature: range expressions are not supported. List the values explicitly.",
                            List.of(",", "]"));
                }
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RBRACKET, "]");
        depth--;
        return new ArrayValue(elements);
    }

    /** Values are literals only; an operator after one means the source tried to compute something. */
    private void rejectOperator(String closing) {
        Token t = peek();
        if (OPERATORS.contains(t.type())) {
            throw error(t, "Unsupported feature: arithmetic and logical expressions are not supported. "
                    + "Replace the expression with its computed value.", List.of(",", closing));
        }
    }

    // ---------- guards ----------
    private void tick() {
        if (++iterations > maxIterations) {
            throw error(peek(), "Parser exceeded maximum iterations - possible infinite loop", List.of());
        }
    }

    private void enter(Token at) {
        if (++depth > MAX_NESTING_DEPTH) {
            throw error(at, "Maximum nesting depth of " + MAX_NESTING_DEPTH + " exceeded", List.of());
        }
    }

    // ---------- helpers ----------
    private boolean match(TokenType t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType t, String description) {
        if (check(t)) return advance();
        throw error(peek(), "Expected '" + description + "'", List.of(description));
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        Token t = peek();
        if (t.type() != TokenType.EOF) pos++;
        return t;
    }

    private Token peek() { return tokens.get(pos); }

    private static Position positionOf(Token t) {
        return new Position(t.line(), t.column());
    }

    private static String found(Token t) {
        return t.lexeme().isEmpty() ? t.type().name() : t.lexeme();
    }

    private static ParseException error(Token at, String msg, List<String> expected) {
        return new ParseException(msg, at.line(), at.column(), found(at), expected);
    }

    private static ParseException unsupported(Token t) {
        String message = switch (t.type()) {
            case FOR -> "Unsupported feature: for loops are not supported. Consider unrolling the loop or using a different approach.";
            case IF, ELSE -> "Unsupported feature: if statements are not supported. Consider using separate models for each case.";
            case MODULE -> "Unsupported feature: module definitions are not supported. Inline the module contents directly.";
            case FUNCTION -> "Unsupported feature: function definitions are not supported.";
            case LET -> "Unsupported feature: let blocks are not supported. Substitute the values directly.";
            case EACH -> "Unsupported feature: each is not supported.";
            default -> "Unsupported feature: " + t.lexeme();
        };
        return new ParseException(message, t.line(), t.column(), t.lexeme(), List.of());
    }
}
