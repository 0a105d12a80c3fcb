package slate.diag;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A single finding about a program: its code, primary span, a title and an optional message,
 * plus secondary labels and free-standing notes.
 */
public record Diagnostic(
        DiagnosticCode code,
        Severity severity,
        Span span,
        String title,
        String message,
        List<Label> labels,
        List<String> notes
) {

    public Diagnostic {
        labels = ImmutableList.copyOf(labels);
        notes = ImmutableList.copyOf(notes);
    }

    public static Diagnostic of(DiagnosticCode code, Span span, String title, String message) {
        return new Diagnostic(code, code.severity(), span, title, message, List.of(), List.of());
    }

    public Diagnostic withLabel(Span at, String msg) {
        return new Diagnostic(code, severity, span, title, message,
                ImmutableList.<Label>builder().addAll(labels).add(new Label(severity, at, msg)).build(),
                notes);
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(code, severity, span, title, message, labels,
                ImmutableList.<String>builder().addAll(notes).add(note).build());
    }

    /** The same diagnostic with every span moved into a host document. */
    public Diagnostic translate(String hostText, int base) {
        ImmutableList.Builder<Label> moved = ImmutableList.builder();
        for (Label l : labels) {
            moved.add(new Label(l.severity(), l.span().translate(hostText, base), l.message()));
        }
        return new Diagnostic(code, severity, span.translate(hostText, base), title, message,
                moved.build(), notes);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity.label() + "[" + code.code() + "] " + span + ": " + title;
    }
}
