package slate.rewrite;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.UnaryExpr;
import slate.math.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Brings a node into canonical shape, assuming its children already are.
 * <p>
 * A chain of {@code + -} (and unary minus) is read as a table of term to rational coefficient
 * plus a constant. A chain of {@code * /} (and powers with a numeric exponent) is read as a
 * table of base to exponent plus a rational coefficient. Like terms and like bases combine,
 * entries are sorted by {@link ExprOrder} and the node is rebuilt left-associatively:
 * <pre>
 *   x + 1 + 2          ->  x + 3
 *   b * a * a          ->  a ^ 2 * b
 *   x (x + 6) / (x + 6) ->  x
 *   -2 x / 4           ->  -(x / 2)
 * </pre>
 * Identical factors cancel structurally. A division by the literal zero is reported and the
 * division is kept whole as an opaque factor.
 */
public final class Canonicalizer {

    private final EngineLimits limits;

    public Canonicalizer(EngineLimits limits) {
        this.limits = limits;
    }

    public Expr canonicalize(Expr node, Collection<RewriteIssue> issues) {
        if (node instanceof Paren p) return p.inner();
        if (node instanceof UnaryExpr) return sum(node, issues);
        if (node instanceof BinaryExpr b) {
            return switch (b.op()) {
                case ADD, SUB -> sum(node, issues);
                case MUL, DIV -> product(node, issues);
                case POW -> b.right() instanceof Num ? product(node, issues) : node;
            };
        }
        return node;
    }

    // ---------- sums ----------

    private static final class Sum {
        final Map<Expr, Rational> terms = new TreeMap<>(ExprOrder.INSTANCE);
        Rational constant = Rational.ZERO;
    }

    private record Part(boolean negative, Expr magnitude) {}

    private Expr sum(Expr node, Collection<RewriteIssue> issues) {
        Sum acc = new Sum();
        collectSum(node, Rational.ONE, acc, issues);

        List<Part> parts = new ArrayList<>();
        for (Map.Entry<Expr, Rational> t : acc.terms.entrySet()) {
            Rational c = t.getValue();
            if (c.isZero()) continue;
            parts.add(new Part(c.signum() < 0, scale(t.getKey(), c.abs(), issues)));
        }
        if (parts.isEmpty()) return new Num(acc.constant);
        if (!acc.constant.isZero()) {
            parts.add(new Part(acc.constant.signum() < 0, new Num(acc.constant.abs())));
        }

        Part first = parts.get(0);
        Expr out = first.negative() ? Exprs.neg(first.magnitude()) : first.magnitude();
        for (int i = 1; i < parts.size(); i++) {
            Part p = parts.get(i);
            out = p.negative() ? Exprs.sub(out, p.magnitude()) : Exprs.add(out, p.magnitude());
        }
        return out;
    }

    private void collectSum(Expr e, Rational sign, Sum acc, Collection<RewriteIssue> issues) {
        if (e instanceof Paren p) {
            collectSum(p.inner(), sign, acc, issues);
        } else if (e instanceof UnaryExpr u) {
            collectSum(u.operand(), sign.negate(), acc, issues);
        } else if (e instanceof Num n) {
            acc.constant = acc.constant.add(sign.multiply(n.value()));
        } else if (e instanceof BinaryExpr b && b.op() == BinaryExpr.Operator.ADD) {
            collectSum(b.left(), sign, acc, issues);
            collectSum(b.right(), sign, acc, issues);
        } else if (e instanceof BinaryExpr b && b.op() == BinaryExpr.Operator.SUB) {
            collectSum(b.left(), sign, acc, issues);
            collectSum(b.right(), sign.negate(), acc, issues);
        } else if (isProduct(e)) {
            Product p = flatten(e, issues);
            Rational c = sign.multiply(p.coefficient());
            if (p.factors().isEmpty()) {
                acc.constant = acc.constant.add(c);
            } else {
                acc.terms.merge(rebuildProduct(Rational.ONE, p.factors()), c, Rational::add);
            }
        } else {
            acc.terms.merge(e, sign, Rational::add);
        }
    }

    /** {@code key} multiplied by a positive coefficient, in product form. */
    private Expr scale(Expr key, Rational coefficient, Collection<RewriteIssue> issues) {
        if (coefficient.isOne()) return key;
        Product p = flatten(key, issues);
        return rebuildProduct(p.coefficient().multiply(coefficient), p.factors());
    }

    // ---------- products ----------

    private static final class Factors {
        final Map<Expr, List<Expr>> exponents = new TreeMap<>(ExprOrder.INSTANCE);
        Rational coefficient = Rational.ONE;

        void add(Expr base, Expr exponent) {
            exponents.computeIfAbsent(base, k -> new ArrayList<>()).add(exponent);
        }
    }

    /** A flattened product: coefficient times base ^ exponent for each entry. */
    private record Product(Rational coefficient, Map<Expr, Expr> factors) {}

    private Expr product(Expr node, Collection<RewriteIssue> issues) {
        Product p = flatten(node, issues);
        return rebuildProduct(p.coefficient(), p.factors());
    }

    private static boolean isProduct(Expr e) {
        if (!(e instanceof BinaryExpr b)) return false;
        return b.op() == BinaryExpr.Operator.MUL || b.op() == BinaryExpr.Operator.DIV
                || (b.op() == BinaryExpr.Operator.POW && b.right() instanceof Num);
    }

    private Product flatten(Expr e, Collection<RewriteIssue> issues) {
        Factors acc = new Factors();
        collectProduct(e, false, acc, issues);

        Rational coefficient = acc.coefficient;
        Map<Expr, Expr> factors = new TreeMap<>(ExprOrder.INSTANCE);
        for (Map.Entry<Expr, List<Expr>> f : acc.exponents.entrySet()) {
            Expr base = f.getKey();
            Expr exponent = combineExponents(f.getValue(), issues);
            if (exponent instanceof Num n) {
                if (n.value().isZero()) continue;
                if (base instanceof Num b) {
                    Optional<Rational> folded = b.value().pow(n.value(), limits.maxExponent(), limits.maxResultBits());
                    if (folded.isPresent()) {
                        coefficient = coefficient.multiply(folded.get());
                        continue;
                    }
                    if (b.value().isZero() && n.value().signum() < 0) {
                        issues.add(RewriteIssue.divisionByZero(Exprs.pow(base, exponent)));
                    }
                }
            }
            factors.put(base, exponent);
        }
        return new Product(coefficient, factors);
    }

    private void collectProduct(Expr e, boolean inverse, Factors acc, Collection<RewriteIssue> issues) {
        if (e instanceof Paren p) {
            collectProduct(p.inner(), inverse, acc, issues);
            return;
        }
        if (e instanceof UnaryExpr u) {
            acc.coefficient = acc.coefficient.negate();
            collectProduct(u.operand(), inverse, acc, issues);
            return;
        }
        if (e instanceof Num n) {
            if (!inverse) {
                acc.coefficient = acc.coefficient.multiply(n.value());
            } else if (n.value().isZero()) {
                issues.add(RewriteIssue.divisionByZero(e));
                acc.add(e, unit(true));
            } else {
                acc.coefficient = acc.coefficient.divide(n.value());
            }
            return;
        }
        if (e instanceof BinaryExpr b) {
            switch (b.op()) {
                case MUL -> {
                    collectProduct(b.left(), inverse, acc, issues);
                    collectProduct(b.right(), inverse, acc, issues);
                    return;
                }
                case DIV -> {
                    if (Exprs.isZero(Exprs.stripParens(b.right()))) {
                        issues.add(RewriteIssue.divisionByZero(e));
                        acc.add(e, unit(inverse));
                    } else {
                        collectProduct(b.left(), inverse, acc, issues);
                        collectProduct(b.right(), !inverse, acc, issues);
                    }
                    return;
                }
                case POW -> {
                    Expr base = Exprs.stripParens(b.left());
                    if (b.right() instanceof Num n) {
                        if (Exprs.isZero(base) && n.value().signum() < 0) {
                            issues.add(RewriteIssue.divisionByZero(e));
                            acc.add(e, unit(inverse));
                        } else {
                            acc.add(base, new Num(inverse ? n.value().negate() : n.value()));
                        }
                    } else {
                        acc.add(base, inverse ? Exprs.neg(b.right()) : b.right());
                    }
                    return;
                }
                default -> {
                    // sums are opaque factors
                }
            }
        }
        acc.add(e, unit(inverse));
    }

    private Expr combineExponents(List<Expr> exponents, Collection<RewriteIssue> issues) {
        Expr chain = exponents.get(0);
        for (int i = 1; i < exponents.size(); i++) {
            chain = Exprs.add(chain, exponents.get(i));
        }
        return sum(chain, issues);
    }

    private static Num unit(boolean inverse) {
        return new Num(inverse ? Rational.MINUS_ONE : Rational.ONE);
    }

    private static Expr rebuildProduct(Rational coefficient, Map<Expr, Expr> factors) {
        if (coefficient.isZero()) return Num.ZERO;
        if (factors.isEmpty()) return new Num(coefficient);

        List<Expr> numerator = new ArrayList<>();
        List<Expr> denominator = new ArrayList<>();
        for (Map.Entry<Expr, Expr> f : factors.entrySet()) {
            Expr base = f.getKey();
            Expr exponent = f.getValue();
            if (exponent instanceof Num n && n.value().signum() < 0) {
                Rational m = n.value().negate();
                denominator.add(m.isOne() ? base : Exprs.pow(base, new Num(m)));
            } else if (exponent instanceof Num n && n.value().isOne()) {
                numerator.add(base);
            } else {
                numerator.add(Exprs.pow(base, exponent));
            }
        }

        Rational magnitude = coefficient.abs();
        if (!magnitude.numerator().equals(BigInteger.ONE)) {
            numerator.add(new Num(Rational.of(magnitude.numerator(), BigInteger.ONE)));
        }
        if (!magnitude.denominator().equals(BigInteger.ONE)) {
            denominator.add(new Num(Rational.of(magnitude.denominator(), BigInteger.ONE)));
        }

        Expr top = numerator.isEmpty() ? Num.ONE : chain(numerator);
        Expr result = denominator.isEmpty() ? top : Exprs.div(top, chain(denominator));
        return coefficient.signum() < 0 ? Exprs.neg(result) : result;
    }

    private static Expr chain(List<Expr> factors) {
        Expr out = factors.get(0);
        for (int i = 1; i < factors.size(); i++) {
            out = Exprs.mul(out, factors.get(i));
        }
        return out;
    }
}
