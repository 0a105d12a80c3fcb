package slate.diag;

import java.util.List;

/**
 * Renders diagnostics as text with the offending source line underlined:
 *
 * <pre>
 * error[P0002]: Expected an expression
 *  --> 1:4
 *   |
 * 1 | 4 -
 *   |    ^ missing right operand
 * </pre>
 */
public final class DiagnosticRenderer {
    private final String source;
    private final String origin;

    public DiagnosticRenderer(String source, String origin) {
        this.source = source;
        this.origin = origin;
    }

    public String render(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < diagnostics.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(render(diagnostics.get(i)));
        }
        return sb.toString();
    }

    public String render(Diagnostic d) {
        StringBuilder sb = new StringBuilder();
        sb.append(d.severity().label()).append('[').append(d.code().code()).append("]: ")
                .append(d.title()).append('\n');
        sb.append(" --> ");
        if (origin != null) sb.append(origin).append(':');
        sb.append(d.span()).append('\n');

        snippet(sb, d.span(), d.message());
        for (Label l : d.labels()) {
            snippet(sb, l.span(), l.message());
        }
        for (String note : d.notes()) {
            sb.append("  = note: ").append(note).append('\n');
        }
        return sb.toString();
    }

    // ================= helpers =================

    private void snippet(StringBuilder sb, Span span, String message) {
        String line = lineAt(span.line());
        String gutter = String.valueOf(span.line());
        String pad = " ".repeat(gutter.length());

        sb.append(pad).append(" |\n");
        sb.append(gutter).append(" | ").append(line).append('\n');
        sb.append(pad).append(" | ")
                .append(" ".repeat(Math.max(0, span.column() - 1)))
                .append("^".repeat(Math.max(1, Math.min(span.length(), line.length() - span.column() + 1))));
        if (message != null && !message.isEmpty()) sb.append(' ').append(message);
        sb.append('\n');
    }

    private String lineAt(int line) {
        String[] lines = source.split("\n", -1);
        if (line < 1 || line > lines.length) return "";
        return lines[line - 1].replace("\r", "");
    }
}
