package slate.ast.stmt;

import slate.ast.expr.Expr;
import slate.diag.Span;

/** {@code variable := value} (or {@code variable = value}). */
public record Definition(
        String variable,
        Expr value,
        Marker marker,
        Span span,
        Span nameSpan
) implements Stmt {

    public enum Marker {
        DEFINE(":="),
        ASSIGN("=");

        private final String symbol;

        Marker(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() { return symbol; }
    }

    @Override
    public Expr expr() {
        return value;
    }

    @Override
    public Definition withExpr(Expr expr) {
        return new Definition(variable, expr, marker, span, nameSpan);
    }
}
