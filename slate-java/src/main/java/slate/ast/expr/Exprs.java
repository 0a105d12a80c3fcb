package slate.ast.expr;

import slate.math.Rational;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Construction and traversal helpers over {@link Expr} trees.
 */
public final class Exprs {

    private Exprs() {}

    // ---------- construction ----------

    public static Num num(Rational value) { return new Num(value); }
    public static Num num(long value) { return Num.of(value); }
    public static Var var(String name) { return new Var(name); }

    public static BinaryExpr add(Expr l, Expr r) { return new BinaryExpr(l, BinaryExpr.Operator.ADD, r); }
    public static BinaryExpr sub(Expr l, Expr r) { return new BinaryExpr(l, BinaryExpr.Operator.SUB, r); }
    public static BinaryExpr mul(Expr l, Expr r) { return new BinaryExpr(l, BinaryExpr.Operator.MUL, r); }
    public static BinaryExpr div(Expr l, Expr r) { return new BinaryExpr(l, BinaryExpr.Operator.DIV, r); }
    public static BinaryExpr pow(Expr l, Expr r) { return new BinaryExpr(l, BinaryExpr.Operator.POW, r); }
    public static UnaryExpr neg(Expr e) { return new UnaryExpr(UnaryExpr.Operator.NEG, e); }

    // ---------- queries ----------

    public static boolean isNum(Expr e) {
        return e instanceof Num;
    }

    public static boolean isZero(Expr e) {
        return e instanceof Num n && n.value().isZero();
    }

    public static int nodeCount(Expr e) {
        if (e instanceof BinaryExpr b) return 1 + nodeCount(b.left()) + nodeCount(b.right());
        if (e instanceof UnaryExpr u) return 1 + nodeCount(u.operand());
        if (e instanceof Paren p) return 1 + nodeCount(p.inner());
        return 1;
    }

    /** Names of all program variables in {@code e}, sorted. */
    public static Set<String> variables(Expr e) {
        Set<String> out = new TreeSet<>();
        collectVariables(e, out);
        return out;
    }

    private static void collectVariables(Expr e, Set<String> out) {
        if (e instanceof Var v) out.add(v.name());
        else if (e instanceof BinaryExpr b) {
            collectVariables(b.left(), out);
            collectVariables(b.right(), out);
        } else if (e instanceof UnaryExpr u) collectVariables(u.operand(), out);
        else if (e instanceof Paren p) collectVariables(p.inner(), out);
    }

    /** Texts of all pattern variables in {@code e}, e.g. {@code _a}, sorted. */
    public static Set<String> patternVariables(Expr e) {
        Set<String> out = new TreeSet<>();
        collectPatterns(e, out);
        return out;
    }

    private static void collectPatterns(Expr e, Set<String> out) {
        if (e instanceof PatternVar p) out.add(p.text());
        else if (e instanceof BinaryExpr b) {
            collectPatterns(b.left(), out);
            collectPatterns(b.right(), out);
        } else if (e instanceof UnaryExpr u) collectPatterns(u.operand(), out);
        else if (e instanceof Paren p) collectPatterns(p.inner(), out);
    }

    // ---------- transformation ----------

    /** Rebuilds {@code e} with {@code f} applied to each direct child. Leaves are returned as is. */
    public static Expr mapChildren(Expr e, UnaryOperator<Expr> f) {
        if (e instanceof BinaryExpr b) {
            Expr l = f.apply(b.left());
            Expr r = f.apply(b.right());
            return l == b.left() && r == b.right() ? b : new BinaryExpr(l, b.op(), r);
        }
        if (e instanceof UnaryExpr u) {
            Expr o = f.apply(u.operand());
            return o == u.operand() ? u : new UnaryExpr(u.op(), o);
        }
        if (e instanceof Paren p) {
            Expr i = f.apply(p.inner());
            return i == p.inner() ? p : new Paren(i);
        }
        return e;
    }

    /** Replaces every variable bound in {@code values} by its value. */
    public static Expr substitute(Expr e, Map<String, ? extends Expr> values) {
        if (values.isEmpty()) return e;
        if (e instanceof Var v) {
            Expr value = values.get(v.name());
            return value != null ? value : v;
        }
        return mapChildren(e, child -> substitute(child, values));
    }

    /** Removes every explicit grouping. */
    public static Expr stripParens(Expr e) {
        if (e instanceof Paren p) return stripParens(p.inner());
        return mapChildren(e, Exprs::stripParens);
    }
}
