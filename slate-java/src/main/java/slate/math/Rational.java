package slate.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * An exact rational number {@code numerator / denominator}.
 * <p>
 * Instances are always normalized: the denominator is positive and shares no factor with the
 * numerator, so {@link #equals(Object)} is value equality.
 */
public final class Rational implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(long value) {
        return of(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator: " + numerator + "/0");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        if (numerator.signum() == 0) denominator = BigInteger.ONE;
        return new Rational(numerator, denominator);
    }

    /** Parses an integer or decimal literal such as {@code 12} or {@code 0.125} exactly. */
    public static Rational parse(String literal) {
        BigDecimal d = new BigDecimal(literal);
        if (d.scale() <= 0) {
            return of(d.toBigIntegerExact(), BigInteger.ONE);
        }
        return of(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
    }

    public BigInteger numerator() { return numerator; }
    public BigInteger denominator() { return denominator; }

    public boolean isZero() { return numerator.signum() == 0; }
    public boolean isOne() { return numerator.equals(BigInteger.ONE) && isInteger(); }
    public boolean isInteger() { return denominator.equals(BigInteger.ONE); }
    public int signum() { return numerator.signum(); }

    // ---------- arithmetic ----------

    public Rational add(Rational o) {
        if (isInteger() && o.isInteger()) return of(numerator.add(o.numerator), BigInteger.ONE);
        return of(numerator.multiply(o.denominator).add(o.numerator.multiply(denominator)),
                denominator.multiply(o.denominator));
    }

    public Rational subtract(Rational o) {
        return add(o.negate());
    }

    public Rational multiply(Rational o) {
        return of(numerator.multiply(o.numerator), denominator.multiply(o.denominator));
    }

    public Rational divide(Rational o) {
        if (o.isZero()) throw new ArithmeticException("Division by zero");
        return of(numerator.multiply(o.denominator), denominator.multiply(o.numerator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    public Rational abs() {
        return signum() < 0 ? negate() : this;
    }

    public Rational reciprocal() {
        return of(denominator, numerator);
    }

    /**
     * Raises this number to an integer power. Returns empty when the exponent is not an integer,
     * exceeds {@code maxExponent} in magnitude, would divide by zero, or when the numerator or
     * denominator of the result could need more than {@code maxBits} bits.
     */
    public Optional<Rational> pow(Rational exponent, int maxExponent, int maxBits) {
        if (!exponent.isInteger()) return Optional.empty();
        if (exponent.numerator.abs().compareTo(BigInteger.valueOf(maxExponent)) > 0) {
            return Optional.empty();
        }
        int e = exponent.numerator.intValueExact();
        if (e < 0 && isZero()) return Optional.empty();
        Rational base = e < 0 ? reciprocal() : this;
        int n = Math.abs(e);
        if (!abs().equals(ONE) && resultBits(n) > maxBits) return Optional.empty();
        return Optional.of(of(base.numerator.pow(n), base.denominator.pow(n)));
    }

    /** Upper bound on the bit length of the numerator and denominator of {@code this ^ n}. */
    private long resultBits(int n) {
        return (long) Math.max(numerator.abs().bitLength(), denominator.bitLength()) * n;
    }

    @Override
    public int compareTo(Rational o) {
        return numerator.multiply(o.denominator).compareTo(o.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rational r)) return false;
        return numerator.equals(r.numerator) && denominator.equals(r.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
