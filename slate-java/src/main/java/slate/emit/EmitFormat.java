package slate.emit;

import java.util.Locale;
import java.util.Optional;

public enum EmitFormat {
    PRETTY("pretty"),
    S_EXPRESSION("s-expression"),
    LATEX("latex");

    private final String flag;

    EmitFormat(String flag) {
        this.flag = flag;
    }

    /** The name used on the command line and in configuration. */
    public String flag() {
        return flag;
    }

    public static Optional<EmitFormat> fromFlag(String s) {
        String wanted = s.trim().toLowerCase(Locale.ROOT);
        for (EmitFormat f : values()) {
            if (f.flag.equals(wanted)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
