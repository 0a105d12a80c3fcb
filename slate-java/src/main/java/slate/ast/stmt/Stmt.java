package slate.ast.stmt;

import slate.ast.expr.Expr;
import slate.diag.Span;

public sealed interface Stmt permits ExprStmt, Definition {

    Span span();

    /** The expression this statement carries: the statement itself or a definition's value. */
    Expr expr();

    Stmt withExpr(Expr expr);
}
