package slate.diag;

/** A secondary message attached to a diagnostic, optionally at another span. */
public record Label(Severity severity, Span span, String message) {
}
