package slate.emit;

/**
 * @param frac            typeset divisions as {@code \frac{}{}}
 * @param typesetEnabled  whether the LaTeX emitter may be used at all
 */
public record EmitConfig(boolean frac, boolean typesetEnabled) {

    public static final EmitConfig DEFAULT = new EmitConfig(false, true);

    public EmitConfig withFrac(boolean frac) {
        return new EmitConfig(frac, typesetEnabled);
    }
}
