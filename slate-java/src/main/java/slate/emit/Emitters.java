package slate.emit;

/**
 * Emitter lookup by format.
 */
public final class Emitters {

    private Emitters() {}

    /**
     * @throws IllegalStateException when {@code format} is {@link EmitFormat#LATEX} and typeset
     *                               output is disabled by {@code config}
     */
    public static Emitter forFormat(EmitFormat format, EmitConfig config) {
        return switch (format) {
            case PRETTY -> new PrettyEmitter();
            case S_EXPRESSION -> new SExpressionEmitter();
            case LATEX -> {
                if (!config.typesetEnabled()) {
                    throw new IllegalStateException("Typeset output is disabled by configuration (typeset.enabled=false)");
                }
                yield new LatexEmitter(config.frac());
            }
        };
    }
}
