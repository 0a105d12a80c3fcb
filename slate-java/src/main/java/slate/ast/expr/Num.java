package slate.ast.expr;

import slate.math.Rational;

public record Num(Rational value) implements Expr {

    public static final Num ZERO = new Num(Rational.ZERO);
    public static final Num ONE = new Num(Rational.ONE);

    public static Num of(long value) {
        return new Num(Rational.of(value));
    }
}
