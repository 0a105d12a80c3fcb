package slate.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD("+", 1, true),
        SUB("-", 1, false),
        MUL("*", 2, true),
        DIV("/", 2, false),
        POW("^", 3, false);

        private final String symbol;
        private final int precedence;
        private final boolean associative;

        Operator(String symbol, int precedence, boolean associative) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.associative = associative;
        }

        public String symbol() { return symbol; }
        public int precedence() { return precedence; }
        public boolean isAssociative() { return associative; }
        public boolean isRightAssociative() { return this == POW; }
    }
}
