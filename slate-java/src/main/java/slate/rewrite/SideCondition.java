package slate.rewrite;

import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.math.Rational;

import java.util.Locale;

/**
 * A guard on a rule match, written {@code <kind> <pattern>}, e.g. {@code nonzero _b}.
 * Every kind only holds when the pattern is bound to a numeric literal: nothing is assumed about
 * the value of a variable or a compound expression.
 */
public record SideCondition(Kind kind, String pattern) {

    public enum Kind {
        NONZERO, POSITIVE, INTEGER, EVEN, ODD;

        boolean test(Rational v) {
            return switch (this) {
                case NONZERO -> !v.isZero();
                case POSITIVE -> v.signum() > 0;
                case INTEGER -> v.isInteger();
                case EVEN -> v.isInteger() && !v.numerator().testBit(0);
                case ODD -> v.isInteger() && v.numerator().testBit(0);
            };
        }
    }

    public static SideCondition parse(String text) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 2) {
            throw new RuleConfigurationException("Condition \"" + text + "\" must be \"<kind> <pattern>\"");
        }
        Kind kind;
        try {
            kind = Kind.valueOf(parts[0].toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Unknown condition \"" + parts[0] + "\" in \"" + text + "\"");
        }
        return new SideCondition(kind, parts[1]);
    }

    public boolean test(Bindings bindings) {
        if (!bindings.has(pattern)) return false;
        Expr bound = bindings.get(pattern);
        return bound instanceof Num n && kind.test(n.value());
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + " " + pattern;
    }
}
