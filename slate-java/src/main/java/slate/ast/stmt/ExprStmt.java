package slate.ast.stmt;

import slate.ast.expr.Expr;
import slate.diag.Span;

public record ExprStmt(
        Expr expr,
        Span span
) implements Stmt {

    @Override
    public ExprStmt withExpr(Expr expr) {
        return new ExprStmt(expr, span);
    }
}
