package slate.rewrite;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;
import slate.ast.expr.Num;
import slate.ast.expr.UnaryExpr;
import slate.math.Rational;

import java.util.Map;
import java.util.Optional;

/**
 * Rules every registry starts with, matched by hand rather than through {@link PatternMatcher}.
 * The template shown by {@link #template()} is what each one would read as a pattern rule.
 * <p>
 * {@link #FOLD_CONSTANTS} names the engine's folding step so it can be denied like any other
 * built-in; it is never placed in a registry and never matches a node itself.
 */
public enum BuiltinRule implements RewriteRule {

    FOLD_CONSTANTS("#a op #b -> value"),
    EXPONENT_IDENTITY("_a ^ 1 -> _a"),
    ZERO_EXPONENT("_a ^ 0 -> 1"),
    ONE_BASE("1 ^ _a -> 1"),
    NESTED_INTEGER_EXPONENT("(_a ^ #b) ^ #c -> _a ^ (#b * #c) when integer #c"),
    POWER_OF_PRODUCT("(_a * _b) ^ #c -> _a ^ #c * _b ^ #c when integer #c"),
    EVEN_POWER_OF_NEGATION("(-_a) ^ #b -> _a ^ #b when even #b"),
    ODD_POWER_OF_NEGATION("(-_a) ^ #b -> -(_a ^ #b) when odd #b");

    private final String template;

    BuiltinRule(String template) {
        this.template = template;
    }

    public String template() {
        return template;
    }

    @Override
    public Optional<Bindings> matches(Expr node) {
        if (!(node instanceof BinaryExpr pow) || pow.op() != BinaryExpr.Operator.POW) {
            return Optional.empty();
        }
        Expr base = pow.left();
        Expr exponent = pow.right();

        return switch (this) {
            case EXPONENT_IDENTITY -> isLiteral(exponent, Rational.ONE)
                    ? Optional.of(Bindings.of("_a", base)) : Optional.empty();
            case ZERO_EXPONENT -> isLiteral(exponent, Rational.ZERO)
                    ? Optional.of(Bindings.of("_a", base)) : Optional.empty();
            case ONE_BASE -> isLiteral(base, Rational.ONE)
                    ? Optional.of(Bindings.of("_a", exponent)) : Optional.empty();
            case NESTED_INTEGER_EXPONENT -> {
                if (base instanceof BinaryExpr inner && inner.op() == BinaryExpr.Operator.POW
                        && inner.right() instanceof Num b && isInteger(exponent)) {
                    yield Optional.of(Bindings.of(Map.of("_a", inner.left(), "#b", b, "#c", exponent)));
                }
                yield Optional.empty();
            }
            case POWER_OF_PRODUCT -> {
                if (base instanceof BinaryExpr inner && inner.op() == BinaryExpr.Operator.MUL && isInteger(exponent)) {
                    yield Optional.of(Bindings.of(Map.of("_a", inner.left(), "_b", inner.right(), "#c", exponent)));
                }
                yield Optional.empty();
            }
            case EVEN_POWER_OF_NEGATION, ODD_POWER_OF_NEGATION -> {
                boolean odd = this == ODD_POWER_OF_NEGATION;
                if (base instanceof UnaryExpr neg && exponent instanceof Num n
                        && n.value().isInteger() && n.value().numerator().testBit(0) == odd) {
                    yield Optional.of(Bindings.of(Map.of("_a", neg.operand(), "#b", n)));
                }
                yield Optional.empty();
            }
            case FOLD_CONSTANTS -> Optional.empty();
        };
    }

    @Override
    public Expr apply(Bindings b) {
        return switch (this) {
            case FOLD_CONSTANTS -> throw new IllegalStateException(name() + " is applied by the engine, not as a rule");
            case EXPONENT_IDENTITY -> b.get("_a");
            case ZERO_EXPONENT, ONE_BASE -> Num.ONE;
            case NESTED_INTEGER_EXPONENT -> Exprs.pow(b.get("_a"), Exprs.mul(b.get("#b"), b.get("#c")));
            case POWER_OF_PRODUCT -> Exprs.mul(Exprs.pow(b.get("_a"), b.get("#c")), Exprs.pow(b.get("_b"), b.get("#c")));
            case EVEN_POWER_OF_NEGATION -> Exprs.pow(b.get("_a"), b.get("#b"));
            case ODD_POWER_OF_NEGATION -> Exprs.neg(Exprs.pow(b.get("_a"), b.get("#b")));
        };
    }

    // ================= helpers =================

    private static boolean isLiteral(Expr e, Rational value) {
        return e instanceof Num n && n.value().equals(value);
    }

    private static boolean isInteger(Expr e) {
        return e instanceof Num n && n.value().isInteger();
    }
}
