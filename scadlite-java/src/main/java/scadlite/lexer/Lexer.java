package scadlite.lexer;

import java.util.*;

/**
 * Turns DSL source into a token list ending with a single {@link TokenType#EOF}.
 * An instance is single-use; any malformed input raises {@link LexException}
 * and no partial list is returned.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("cube", TokenType.CUBE),
            Map.entry("sphere", TokenType.SPHERE),
            Map.entry("cylinder", TokenType.CYLINDER),
            Map.entry("polyhedron", TokenType.POLYHEDRON),
            Map.entry("circle", TokenType.CIRCLE),
            Map.entry("square", TokenType.SQUARE),
            Map.entry("polygon", TokenType.POLYGON),
            Map.entry("text", TokenType.TEXT),
            Map.entry("translate", TokenType.TRANSLATE),
            Map.entry("rotate", TokenType.ROTATE),
            Map.entry("scale", TokenType.SCALE),
            Map.entry("resize", TokenType.RESIZE),
            Map.entry("mirror", TokenType.MIRROR),
            Map.entry("multmatrix", TokenType.MULTMATRIX),
            Map.entry("color", TokenType.COLOR),
            Map.entry("offset", TokenType.OFFSET),
            Map.entry("hull", TokenType.HULL),
            Map.entry("minkowski", TokenType.MINKOWSKI),
            Map.entry("union", TokenType.UNION),
            Map.entry("difference", TokenType.DIFFERENCE),
            Map.entry("intersection", TokenType.INTERSECTION),
            Map.entry("linear_extrude", TokenType.LINEAR_EXTRUDE),
            Map.entry("rotate_extrude", TokenType.ROTATE_EXTRUDE),
            Map.entry("module", TokenType.MODULE),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("let", TokenType.LET),
            Map.entry("each", TokenType.EACH),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("undef", TokenType.UNDEF)
    );

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int startLine = line;
            int startCol = col;
            char c = advance();

            switch (c) {
                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ':' -> add(TokenType.COLON, ":", startLine, startCol);
                case '?' -> add(TokenType.QUESTION, "?", startLine, startCol);
                case '+' -> add(TokenType.PLUS, "+", startLine, startCol);
                case '-' -> add(TokenType.MINUS, "-", startLine, startCol);
                case '*' -> add(TokenType.MULTIPLY, "*", startLine, startCol);
                case '%' -> add(TokenType.MODULO, "%", startLine, startCol);
                case '^' -> add(TokenType.POWER, "^", startLine, startCol);

                case '/' -> {
                    if (match('/')) {
                        skipLineComment();
                    } else if (match('*')) {
                        skipBlockComment(startLine, startCol);
                    } else {
                        add(TokenType.DIVIDE, "/", startLine, startCol);
                    }
                }

                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQUAL : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NOT_EQUAL : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }
                case '<' -> {
                    boolean le = match('=');
                    add(le ? TokenType.LESS_EQUAL : TokenType.LESS_THAN, le ? "<=" : "<", startLine, startCol);
                }
                case '>' -> {
                    boolean ge = match('=');
                    add(ge ? TokenType.GREATER_EQUAL : TokenType.GREATER_THAN, ge ? ">=" : ">", startLine, startCol);
                }

                // no single-character meaning for either
                case '&' -> {
                    if (match('&')) add(TokenType.AND, "&&", startLine, startCol);
                    else throw unexpected(c, startLine, startCol);
                }
                case '|' -> {
                    if (match('|')) add(TokenType.OR, "||", startLine, startCol);
                    else throw unexpected(c, startLine, startCol);
                }

                case '"' -> stringLiteral(startLine, startCol);
                case '$' -> specialVariable(startLine, startCol);

                case '.' -> {
                    if (isDigit(peek())) numberLiteral(c, startLine, startCol);
                    else add(TokenType.DOT, ".", startLine, startCol);
                }

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else throw unexpected(c, startLine, startCol);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return List.copyOf(tokens);
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (isDigit(peek())) {
            sb.append(advance());
        }

        // "1." leaves the dot for a DOT token
        if (first != '.' && peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
        }
        while (isDigit(peek())) {
            sb.append(advance());
        }

        // "1e" and "1e+" leave the marker to be lexed as an identifier
        if (peek() == 'e' || peek() == 'E') {
            int ahead = 1;
            if (peekAhead(ahead) == '+' || peekAhead(ahead) == '-') ahead++;
            if (isDigit(peekAhead(ahead))) {
                sb.append(advance());
                if (peek() == '+' || peek() == '-') sb.append(advance());
                while (isDigit(peek())) {
                    sb.append(advance());
                }
            }
        }

        add(TokenType.NUMBER, sb.toString(), line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    private void specialVariable(int line, int col) {
        StringBuilder sb = new StringBuilder("$");

        while (isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        if (sb.length() == 1) {
            throw new LexException(
                    "Expected a special variable name after '$' at line " + line + ", column " + col,
                    line, col, "$");
        }
        add(TokenType.SPECIAL_VAR, sb.toString(), line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = peek();
            if (c == '\n') throw unterminatedString(line, col);
            sb.append(advance());
            // escapes are kept verbatim, both characters
            if (c == '\\' && !isAtEnd()) {
                if (peek() == '\n') throw unterminatedString(line, col);
                sb.append(advance());
            }
        }

        if (isAtEnd()) throw unterminatedString(line, col);

        advance(); // closing "
        add(TokenType.STRING, sb.toString(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (peek()) {
                case ' ', '\t', '\r', '\n' -> advance();
                default -> { return; }
            }
        }
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipBlockComment(int startLine, int startCol) {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw new LexException(
                "Unterminated multi-line comment starting at line " + startLine + ", column " + startCol,
                startLine, startCol, "/*");
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return peekAhead(1);
    }

    private char peekAhead(int offset) {
        return pos + offset >= source.length() ? '\0' : source.charAt(pos + offset);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private LexException unexpected(char c, int line, int col) {
        return new LexException(
                "Unexpected character '" + c + "' at line " + line + ", column " + col,
                line, col, String.valueOf(c));
    }

    private LexException unterminatedString(int line, int col) {
        return new LexException(
                "Unterminated string starting at line " + line + ", column " + col,
                line, col, "\"");
    }
}
