package slate.lexer;

import slate.diag.Diagnostic;
import slate.diag.DiagnosticCode;
import slate.diag.Diagnostics;
import slate.diag.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits program text into tokens. Tokens are produced on demand by {@link #nextToken()};
 * {@link #tokenize()} restarts from the beginning and collects the whole sequence.
 * <p>
 * An unexpected character is reported as S0001 and the remainder of its statement is folded into
 * a single {@link TokenType#INVALID} token, so lexing resumes at the next separator.
 */
public final class Lexer {

    private final String source;
    private final Diagnostics diagnostics;

    private int pos = 0;
    private int line = 1;
    private int col = 1;
    private boolean done = false;

    public Lexer(String source) {
        this(source, new Diagnostics());
    }

    public Lexer(String source, Diagnostics diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    public List<Token> tokenize() {
        reset();
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = nextToken();
            tokens.add(t);
        } while (t.type() != TokenType.EOF);
        return tokens;
    }

    public void reset() {
        pos = 0;
        line = 1;
        col = 1;
        done = false;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public Token nextToken() {
        skipWhitespace();
        int start = pos;
        int startLine = line;
        int startCol = col;

        if (isAtEnd()) {
            done = true;
            return make(TokenType.EOF, "", start, startLine, startCol);
        }

        char c = advance();

        return switch (c) {
            case '+' -> make(TokenType.PLUS, "+", start, startLine, startCol);
            case '-' -> make(TokenType.MINUS, "-", start, startLine, startCol);
            case '*' -> make(TokenType.STAR, "*", start, startLine, startCol);
            case '/' -> make(TokenType.SLASH, "/", start, startLine, startCol);
            case '^' -> make(TokenType.CARET, "^", start, startLine, startCol);
            case '(' -> make(TokenType.LPAREN, "(", start, startLine, startCol);
            case ')' -> make(TokenType.RPAREN, ")", start, startLine, startCol);
            case ';' -> make(TokenType.SEMICOLON, ";", start, startLine, startCol);
            case '=' -> make(TokenType.ASSIGN, "=", start, startLine, startCol);
            case '\n' -> {
                Token nl = make(TokenType.NEWLINE, "\n", start, startLine, startCol);
                line++;
                col = 1;
                yield nl;
            }
            case ':' -> {
                if (match('=')) yield make(TokenType.DEFINE, ":=", start, startLine, startCol);
                yield invalid(start, startLine, startCol, "did you mean \":=\"?");
            }
            case '$' -> pattern(TokenType.VAR_PATTERN, start, startLine, startCol);
            case '#' -> pattern(TokenType.CONST_PATTERN, start, startLine, startCol);
            case '_' -> pattern(TokenType.ANY_PATTERN, start, startLine, startCol);
            default -> {
                if (isDigit(c)) yield number(start, startLine, startCol);
                if (isAlpha(c)) yield identifier(start, startLine, startCol);
                yield invalid(start, startLine, startCol, null);
            }
        };
    }

    public boolean isDone() {
        return done;
    }

    // ================= helpers =================

    private Token number(int start, int line, int col) {
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        return make(TokenType.NUMBER, source.substring(start, pos), start, line, col);
    }

    private Token identifier(int start, int line, int col) {
        while (isAlphaNumeric(peek())) advance();
        return make(TokenType.IDENTIFIER, source.substring(start, pos), start, line, col);
    }

    private Token pattern(TokenType type, int start, int line, int col) {
        if (!isAlphaNumeric(peek())) {
            return invalid(start, line, col, null);
        }
        while (isAlphaNumeric(peek())) advance();
        return make(type, source.substring(start, pos), start, line, col);
    }

    private Token invalid(int start, int line, int col, String hint) {
        Span at = new Span(start, pos, line, col);
        Diagnostic d = Diagnostic.of(DiagnosticCode.S0001, at,
                "Invalid token", "\"" + source.substring(start, pos) + "\" is not a valid token");
        if (hint != null) d = d.withNote(hint);
        diagnostics.report(d);

        // Swallow the rest of the statement; the parser drops it as a unit.
        while (!isAtEnd() && peek() != ';' && peek() != '\n') advance();
        return make(TokenType.INVALID, source.substring(start, pos), start, line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') advance();
            else return;
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }

    private Token make(TokenType type, String lexeme, int start, int line, int col) {
        return new Token(type, lexeme, new Span(start, pos, line, col));
    }
}
