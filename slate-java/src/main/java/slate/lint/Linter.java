package slate.lint;

import slate.ast.Program;
import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Paren;
import slate.ast.expr.UnaryExpr;
import slate.ast.stmt.Definition;
import slate.ast.stmt.Stmt;
import slate.diag.Diagnostic;
import slate.diag.DiagnosticCode;
import slate.lexer.Token;
import slate.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Style warnings on the program as written, before any simplification.
 */
public final class Linter {

    public List<Diagnostic> lint(List<Token> tokens, Program program) {
        List<Diagnostic> out = new ArrayList<>();
        unarySeries(tokens, out);
        for (Stmt s : program.statements()) {
            redundantNesting(s, s.expr(), out);
        }
        mixedMarkers(program, out);
        return out;
    }

    // ---------- L0002 ----------
    private void unarySeries(List<Token> tokens, List<Diagnostic> out) {
        int i = 0;
        while (i < tokens.size()) {
            if (!isSign(tokens.get(i).type())) {
                i++;
                continue;
            }
            int start = i;
            // a sign after an operand is binary; the series starts after it
            if (i > 0 && isOperandEnd(tokens.get(i - 1).type())) start = i + 1;
            int end = i;
            int minuses = 0;
            while (end < tokens.size() && isSign(tokens.get(end).type())) {
                if (end >= start && tokens.get(end).type() == TokenType.MINUS) minuses++;
                end++;
            }
            if (end - start >= 2) {
                Token first = tokens.get(start);
                Token last = tokens.get(end - 1);
                String sign = minuses % 2 == 0 ? "no sign" : "a single \"-\"";
                out.add(Diagnostic.of(DiagnosticCode.L0002, first.span().to(last.span()),
                        DiagnosticCode.L0002.title(), "reduces to " + sign));
            }
            i = end;
        }
    }

    private static boolean isSign(TokenType t) {
        return t == TokenType.PLUS || t == TokenType.MINUS;
    }

    private static boolean isOperandEnd(TokenType t) {
        return t == TokenType.NUMBER || t == TokenType.IDENTIFIER || t == TokenType.RPAREN || t.isPattern();
    }

    // ---------- L0001 ----------
    private void redundantNesting(Stmt stmt, Expr e, List<Diagnostic> out) {
        if (e instanceof Paren p) {
            int extra = 0;
            Expr inner = p.inner();
            while (inner instanceof Paren q) {
                extra++;
                inner = q.inner();
            }
            if (extra > 0) {
                out.add(Diagnostic.of(DiagnosticCode.L0001, stmt.span(), DiagnosticCode.L0001.title(),
                        extra == 1 ? "one pair of parentheses is redundant"
                                : extra + " pairs of parentheses are redundant"));
            }
            redundantNesting(stmt, inner, out);
        } else if (e instanceof BinaryExpr b) {
            redundantNesting(stmt, b.left(), out);
            redundantNesting(stmt, b.right(), out);
        } else if (e instanceof UnaryExpr u) {
            redundantNesting(stmt, u.operand(), out);
        }
    }

    // ---------- L0004 ----------
    private void mixedMarkers(Program program, List<Diagnostic> out) {
        List<Definition> defs = program.definitions();
        if (defs.isEmpty()) return;
        Definition first = defs.get(0);
        for (Definition d : defs) {
            if (d.marker() != first.marker()) {
                out.add(Diagnostic.of(DiagnosticCode.L0004, d.span(), DiagnosticCode.L0004.title(),
                                "defined with \"" + d.marker().symbol() + "\"")
                        .withLabel(first.span(), "but defined with \"" + first.marker().symbol() + "\" here"));
                return;
            }
        }
    }
}
