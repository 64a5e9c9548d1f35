package scadlite.lexer;

public enum TokenType {

    // primitives
    CUBE, SPHERE, CYLINDER, POLYHEDRON,
    CIRCLE, SQUARE, POLYGON, TEXT,

    // transforms
    TRANSLATE, ROTATE, SCALE, RESIZE, MIRROR,
    MULTMATRIX, COLOR, OFFSET, HULL, MINKOWSKI,

    // boolean operations
    UNION, DIFFERENCE, INTERSECTION,

    // extrusions
    LINEAR_EXTRUDE, ROTATE_EXTRUDE,

    // control flow (recognized only to be rejected)
    MODULE, FUNCTION, IF, ELSE, FOR, LET, EACH,

    // literal keywords
    TRUE, FALSE, UNDEF,

    // literals
    IDENTIFIER,
    NUMBER,
    STRING,
    SPECIAL_VAR,

    // operators
    PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER,
    ASSIGN,
    EQUAL, NOT_EQUAL,
    LESS_THAN, LESS_EQUAL,
    GREATER_THAN, GREATER_EQUAL,
    AND, OR, NOT,
    QUESTION, COLON,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    SEMICOLON, COMMA,
    DOT,

    EOF
}
