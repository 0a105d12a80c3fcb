package slate.rewrite;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.UnaryExpr;
import slate.math.Rational;

import java.util.Collection;
import java.util.Optional;

/**
 * Exact folding of an operator applied to numeric literals. Looks at one node only.
 */
public final class ConstantFolder {
    private final EngineLimits limits;

    public ConstantFolder(EngineLimits limits) {
        this.limits = limits;
    }

    /**
     * Folds {@code node} if its operands are literals. Division by zero, and zero raised to a
     * negative power, are reported into {@code issues} and the node is returned unchanged.
     */
    public Expr fold(Expr node, Collection<RewriteIssue> issues) {
        if (node instanceof UnaryExpr u && u.operand() instanceof Num n) {
            return new Num(n.value().negate());
        }
        if (!(node instanceof BinaryExpr b) || !(b.left() instanceof Num l) || !(b.right() instanceof Num r)) {
            return node;
        }
        Rational x = l.value();
        Rational y = r.value();
        return switch (b.op()) {
            case ADD -> new Num(x.add(y));
            case SUB -> new Num(x.subtract(y));
            case MUL -> new Num(x.multiply(y));
            case DIV -> {
                if (y.isZero()) {
                    issues.add(RewriteIssue.divisionByZero(node));
                    yield node;
                }
                yield new Num(x.divide(y));
            }
            case POW -> {
                if (x.isZero() && y.signum() < 0 && y.isInteger()) {
                    issues.add(RewriteIssue.divisionByZero(node));
                    yield node;
                }
                Optional<Rational> p = x.pow(y, limits.maxExponent(), limits.maxResultBits());
                yield p.<Expr>map(Num::new).orElse(node);
            }
        };
    }
}
