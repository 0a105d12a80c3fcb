package slate.rewrite;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.PatternVar;
import slate.ast.expr.UnaryExpr;
import slate.ast.expr.Var;

import java.util.Optional;

/**
 * Structural matching of rule templates against expression trees, and instantiation of
 * replacement templates from the resulting bindings.
 */
public final class PatternMatcher {

    private PatternMatcher() {}

    public static Optional<Bindings> match(Expr pattern, Expr node) {
        if (pattern instanceof PatternVar p) {
            boolean accepted = switch (p.kind()) {
                case VARIABLE -> node instanceof Var;
                case CONSTANT -> node instanceof Num;
                case ANY -> true;
            };
            return accepted ? Optional.of(Bindings.of(p.text(), node)) : Optional.empty();
        }
        if (pattern instanceof Paren p) return match(p.inner(), node);
        if (node instanceof Paren n) return match(pattern, n.inner());

        if (pattern instanceof UnaryExpr pu) {
            if (!(node instanceof UnaryExpr nu) || nu.op() != pu.op()) return Optional.empty();
            return match(pu.operand(), nu.operand());
        }
        if (pattern instanceof BinaryExpr pb) {
            if (!(node instanceof BinaryExpr nb) || nb.op() != pb.op()) return Optional.empty();
            Optional<Bindings> direct = both(pb.left(), nb.left(), pb.right(), nb.right());
            if (direct.isPresent() || !pb.op().isAssociative()) return direct;
            // + and * commute
            return both(pb.left(), nb.right(), pb.right(), nb.left());
        }
        return pattern.equals(node) ? Optional.of(Bindings.EMPTY) : Optional.empty();
    }

    private static Optional<Bindings> both(Expr p1, Expr n1, Expr p2, Expr n2) {
        Optional<Bindings> first = match(p1, n1);
        if (first.isEmpty()) return first;
        Optional<Bindings> second = match(p2, n2);
        if (second.isEmpty()) return second;
        return first.get().merge(second.get());
    }

    /** Replaces every pattern variable of {@code template} by its binding. */
    public static Expr instantiate(Expr template, Bindings bindings) {
        if (template instanceof PatternVar p) return bindings.get(p.text());
        return Exprs.mapChildren(template, child -> instantiate(child, bindings));
    }
}
