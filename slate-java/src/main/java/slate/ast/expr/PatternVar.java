package slate.ast.expr;

/**
 * A hole in a rewrite rule template. Never appears in a parsed program.
 */
public record PatternVar(Kind kind, String name) implements Expr {

    public enum Kind {
        /** {@code $a}: matches a variable. */
        VARIABLE('$'),
        /** {@code #a}: matches a numeric constant. */
        CONSTANT('#'),
        /** {@code _a}: matches any expression. */
        ANY('_');

        private final char sigil;

        Kind(char sigil) {
            this.sigil = sigil;
        }

        public char sigil() { return sigil; }

        public static Kind ofSigil(char c) {
            for (Kind k : values()) {
                if (k.sigil == c) return k;
            }
            throw new IllegalArgumentException("Not a pattern sigil: " + c);
        }
    }

    /** The pattern as written, e.g. {@code #b}. */
    public String text() {
        return kind.sigil + name;
    }
}
