package slate.rewrite;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.PatternVar;
import slate.ast.expr.UnaryExpr;
import slate.ast.expr.Var;

import java.util.Comparator;

/**
 * The total order used to sort operands of commutative operators: variables by name, then
 * composite terms by kind and structure, numeric constants last. Consistent with
 * {@code equals}: two expressions compare equal only when they are structurally identical.
 */
public final class ExprOrder implements Comparator<Expr> {

    public static final ExprOrder INSTANCE = new ExprOrder();

    private ExprOrder() {}

    @Override
    public int compare(Expr a, Expr b) {
        int byRank = Integer.compare(rank(a), rank(b));
        if (byRank != 0) return byRank;

        if (a instanceof Var x && b instanceof Var y) return x.name().compareTo(y.name());
        if (a instanceof PatternVar x && b instanceof PatternVar y) return x.text().compareTo(y.text());
        if (a instanceof Num x && b instanceof Num y) return x.value().compareTo(y.value());
        if (a instanceof UnaryExpr x && b instanceof UnaryExpr y) return compare(x.operand(), y.operand());
        if (a instanceof Paren x && b instanceof Paren y) return compare(x.inner(), y.inner());
        if (a instanceof BinaryExpr x && b instanceof BinaryExpr y) {
            int l = compare(x.left(), y.left());
            return l != 0 ? l : compare(x.right(), y.right());
        }
        throw new IllegalStateException("Unordered expressions: " + a + ", " + b);
    }

    private static int rank(Expr e) {
        if (e instanceof Var) return 0;
        if (e instanceof PatternVar) return 1;
        if (e instanceof BinaryExpr b) {
            return switch (b.op()) {
                case POW -> 2;
                case MUL -> 3;
                case DIV -> 4;
                case ADD -> 5;
                case SUB -> 6;
            };
        }
        if (e instanceof UnaryExpr) return 7;
        if (e instanceof Paren) return 8;
        return 9; // Num
    }
}
