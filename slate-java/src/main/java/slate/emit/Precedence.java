package slate.emit;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.UnaryExpr;

/**
 * Minimal-parenthesis decisions shared by the infix emitters. Levels follow the parser:
 * sums, products, powers, unary signs, atoms.
 */
final class Precedence {
    static final int SUM = 1;
    static final int PRODUCT = 2;
    static final int POWER = 3;
    static final int UNARY = 4;
    static final int ATOM = 5;

    private Precedence() {}

    static int of(Expr e) {
        if (e instanceof BinaryExpr b) return b.op().precedence();
        if (e instanceof UnaryExpr) return UNARY;
        if (e instanceof Num n) {
            if (!n.value().isInteger()) return PRODUCT; // printed as p / q
            if (n.value().signum() < 0) return UNARY;
        }
        return ATOM;
    }

    static boolean wrapLeft(BinaryExpr parent, Expr child) {
        int c = of(child);
        int p = parent.op().precedence();
        return c < p || (c == p && parent.op().isRightAssociative());
    }

    static boolean wrapRight(BinaryExpr parent, Expr child) {
        int c = of(child);
        int p = parent.op().precedence();
        return c < p || (c == p && !parent.op().isAssociative() && !parent.op().isRightAssociative());
    }

    /** A sign applies to atoms only; anything else is grouped, {@code -(-x)} included. */
    static boolean wrapOperand(Expr operand) {
        return of(operand) != ATOM;
    }
}
