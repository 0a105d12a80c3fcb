package slate.rewrite;

import slate.ast.expr.Expr;

/**
 * A problem met while simplifying, tied to the subexpression it concerns. Turned into a
 * diagnostic by the caller, which knows the statement span.
 */
public record RewriteIssue(Kind kind, Expr at) {

    public enum Kind {
        DIVISION_BY_ZERO,
        NOT_CONVERGED
    }

    public static RewriteIssue divisionByZero(Expr at) {
        return new RewriteIssue(Kind.DIVISION_BY_ZERO, at);
    }
}
