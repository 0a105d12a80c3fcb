package slate.lexer;

import slate.diag.Span;

public record Token(TokenType type, String lexeme, Span span) {

    public int line() { return span.line(); }
    public int column() { return span.column(); }

    @Override
    public String toString() {
        return type + "('" + lexeme.replace("\n", "\\n") + "')@" + span.line() + ":" + span.column();
    }
}
