package slate.lexer;

public enum TokenType {

    // literals
    NUMBER,
    IDENTIFIER,

    // patterns (rule templates only)
    VAR_PATTERN,    // $a
    CONST_PATTERN,  // #a
    ANY_PATTERN,    // _a

    // operators
    PLUS, MINUS, STAR, SLASH, CARET,
    DEFINE,         // :=
    ASSIGN,         // =

    // symbols
    LPAREN, RPAREN,

    // separators
    SEMICOLON,
    NEWLINE,

    INVALID,
    EOF;

    public boolean isSeparator() {
        return this == SEMICOLON || this == NEWLINE || this == EOF;
    }

    public boolean isPattern() {
        return this == VAR_PATTERN || this == CONST_PATTERN || this == ANY_PATTERN;
    }
}
