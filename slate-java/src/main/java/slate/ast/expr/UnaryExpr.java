package slate.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr operand
) implements Expr {

    public enum Operator {
        NEG("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() { return symbol; }
    }
}
