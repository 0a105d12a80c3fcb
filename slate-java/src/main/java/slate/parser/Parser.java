package slate.parser;

import slate.ast.Program;
import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.PatternVar;
import slate.ast.expr.UnaryExpr;
import slate.ast.expr.Var;
import slate.ast.stmt.Definition;
import slate.ast.stmt.ExprStmt;
import slate.ast.stmt.Stmt;
import slate.diag.Diagnostic;
import slate.diag.DiagnosticCode;
import slate.diag.Diagnostics;
import slate.lexer.Lexer;
import slate.lexer.Token;
import slate.lexer.TokenType;
import slate.math.Rational;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Precedence-climbing parser for programs and rule templates.
 * <p>
 * Errors go to the {@link Diagnostics} accumulator. Parse methods return {@code null} once an
 * error has been reported for the current statement; the statement loop then skips to the next
 * separator and carries on, so every malformed statement of a program is reported in one pass.
 */
public final class Parser {

    public enum Mode { PROGRAM, PATTERN }

    private final List<Token> tokens;
    private final Diagnostics diagnostics;
    private final Mode mode;

    private int pos = 0;
    private int groupDepth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, new Diagnostics(), Mode.PROGRAM);
    }

    public Parser(List<Token> tokens, Diagnostics diagnostics) {
        this(tokens, diagnostics, Mode.PROGRAM);
    }

    public Parser(List<Token> tokens, Diagnostics diagnostics, Mode mode) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.mode = mode;
    }

    /** Lexes and parses {@code source} as a program, reporting into {@code diagnostics}. */
    public static Program parse(String source, Diagnostics diagnostics) {
        var tokens = new Lexer(source, diagnostics).tokenize();
        return new Parser(tokens, diagnostics).parseProgram();
    }

    /** Lexes and parses {@code source} as a single rule template. */
    public static Optional<Expr> parsePattern(String source, Diagnostics diagnostics) {
        var tokens = new Lexer(source, diagnostics).tokenize();
        return new Parser(tokens, diagnostics, Mode.PATTERN).parseSingleExpression();
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<Stmt> statements = new ArrayList<>();

        skipSeparators();
        while (!check(TokenType.EOF)) {
            Stmt s = statementHasInvalidToken() ? null : parseStatement();
            if (s != null && expectStatementEnd()) {
                statements.add(s);
            }
            synchronize();
            skipSeparators();
        }
        return new Program(statements);
    }

    public Optional<Expr> parseSingleExpression() {
        skipSeparators();
        if (statementHasInvalidToken()) return Optional.empty();
        Expr e = parseExpr();
        if (e == null || !expectStatementEnd()) return Optional.empty();
        skipSeparators();
        if (!check(TokenType.EOF)) {
            Token extra = peek();
            diagnostics.report(Diagnostic.of(DiagnosticCode.P0001, extra.span(),
                    "Unexpected extra tokens", "a rule template is a single expression"));
            return Optional.empty();
        }
        return Optional.of(e);
    }

    // ---------- statements ----------
    private Stmt parseStatement() {
        Token first = peek();

        // definition: IDENTIFIER (':=' | '=') expr
        if (check(TokenType.IDENTIFIER) && (checkNext(TokenType.DEFINE) || checkNext(TokenType.ASSIGN))) {
            Token name = advance();
            Token marker = advance();
            Expr value = parseExpr();
            if (value == null) return null;
            Definition.Marker m = marker.type() == TokenType.DEFINE
                    ? Definition.Marker.DEFINE
                    : Definition.Marker.ASSIGN;
            return new Definition(name.lexeme(), value, m, first.span().to(previous().span()), name.span());
        }

        Expr e = parseExpr();
        if (e == null) return null;
        return new ExprStmt(e, first.span().to(previous().span()));
    }

    private boolean expectStatementEnd() {
        if (peek().type().isSeparator()) return true;

        Token at = peek();
        if (at.type() == TokenType.RPAREN) {
            diagnostics.report(Diagnostic.of(DiagnosticCode.P0006, at.span(),
                    "Unmatched closing delimiter", "has no matching \"(\""));
        } else {
            Token last = at;
            for (int i = pos; i < tokens.size() && !tokens.get(i).type().isSeparator(); i++) {
                last = tokens.get(i);
            }
            diagnostics.report(Diagnostic.of(DiagnosticCode.P0001, at.span().to(last.span()),
                    "Unexpected extra tokens", "not connected to the statement"));
        }
        return false;
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseAdd(); }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (e != null && match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            if (r == null) return null;
            e = new BinaryExpr(e, op.type() == TokenType.PLUS ? BinaryExpr.Operator.ADD : BinaryExpr.Operator.SUB, r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parsePow();
        while (e != null) {
            if (match(TokenType.STAR, TokenType.SLASH)) {
                Token op = previous();
                Expr r = parsePow();
                if (r == null) return null;
                e = new BinaryExpr(e, op.type() == TokenType.STAR ? BinaryExpr.Operator.MUL : BinaryExpr.Operator.DIV, r);
                continue;
            }
            // implicit multiplication: 2x, x(x + 1), (a)(b), (a + 1)x
            if (startsImplicitOperand()) {
                Expr r = parsePow();
                if (r == null) return null;
                e = new BinaryExpr(e, BinaryExpr.Operator.MUL, r);
                continue;
            }
            break;
        }
        return e;
    }

    private Expr parsePow() {
        Expr base = parseUnary();
        if (base == null) return null;
        if (match(TokenType.CARET)) {
            Expr exp = parsePow(); // right-assoc
            if (exp == null) return null;
            return new BinaryExpr(base, BinaryExpr.Operator.POW, exp);
        }
        return base;
    }

    private Expr parseUnary() {
        if (match(TokenType.MINUS)) {
            Expr operand = parseUnary();
            return operand == null ? null : new UnaryExpr(UnaryExpr.Operator.NEG, operand);
        }
        if (match(TokenType.PLUS)) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        if (match(TokenType.NUMBER)) return new Num(Rational.parse(previous().lexeme()));
        if (match(TokenType.IDENTIFIER)) {
            Token t = previous();
            if (mode == Mode.PATTERN) {
                diagnostics.report(Diagnostic.of(DiagnosticCode.P0005, t.span(),
                        "Variable in pattern", "use $" + t.lexeme() + ", #" + t.lexeme() + " or _" + t.lexeme()));
                return null;
            }
            return new Var(t.lexeme());
        }
        if (peek().type().isPattern()) {
            Token t = advance();
            if (mode == Mode.PROGRAM) {
                diagnostics.report(Diagnostic.of(DiagnosticCode.P0004, t.span(),
                        "Pattern in program", "patterns are only allowed in rewrite rules"));
                return null;
            }
            return new PatternVar(PatternVar.Kind.ofSigil(t.lexeme().charAt(0)), t.lexeme().substring(1));
        }
        if (match(TokenType.LPAREN)) {
            Token open = previous();
            groupDepth++;
            Expr inner = parseExpr();
            if (inner == null) {
                groupDepth--;
                return null;
            }
            if (!check(TokenType.RPAREN)) {
                groupDepth--;
                diagnostics.report(Diagnostic.of(DiagnosticCode.P0003, open.span(),
                        "Unclosed delimiter", "this \"(\" is never closed")
                        .withLabel(peek().span(), "expected \")\" here"));
                return null;
            }
            groupDepth--;
            advance();
            return new Paren(inner);
        }
        if (check(TokenType.INVALID)) {
            // already reported by the lexer
            return null;
        }
        diagnostics.report(expectedExpression(peek()));
        return null;
    }

    private Diagnostic expectedExpression(Token at) {
        String found = switch (at.type()) {
            case EOF -> "found end of input";
            case NEWLINE, SEMICOLON -> "found end of statement";
            default -> "found \"" + at.lexeme() + "\"";
        };
        if (pos > 0 && isBinaryOperator(previous().type()) && at.type().isSeparator()) {
            found = "missing right operand of \"" + previous().lexeme() + "\"";
        }
        return Diagnostic.of(DiagnosticCode.P0002, at.span(), "Expected an expression", found);
    }

    /** {@code (} always continues a product; a name only after a number or {@code )}. */
    private boolean startsImplicitOperand() {
        TokenType t = peek().type();
        if (t == TokenType.LPAREN) return true;
        if (t != TokenType.IDENTIFIER && !t.isPattern()) return false;
        TokenType before = previous().type();
        return before == TokenType.NUMBER || before == TokenType.RPAREN;
    }

    private static boolean isBinaryOperator(TokenType t) {
        return t == TokenType.PLUS || t == TokenType.MINUS || t == TokenType.STAR
                || t == TokenType.SLASH || t == TokenType.CARET
                || t == TokenType.DEFINE || t == TokenType.ASSIGN;
    }

    // ---------- recovery ----------
    private boolean statementHasInvalidToken() {
        for (int i = pos; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).type();
            if (t == TokenType.INVALID) return true;
            if (t.isSeparator()) return false;
        }
        return false;
    }

    /** Skips to the next statement separator, dropping whatever is left of the current statement. */
    private void synchronize() {
        groupDepth = 0;
        while (!tokens.get(pos).type().isSeparator()) pos++;
    }

    private void skipSeparators() {
        while (check(TokenType.SEMICOLON) || check(TokenType.NEWLINE)) advance();
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() {
        // newlines do not end a statement inside an open group
        while (groupDepth > 0 && tokens.get(pos).type() == TokenType.NEWLINE) pos++;
        return tokens.get(pos);
    }

    private Token previous() { return tokens.get(pos - 1); }
}
