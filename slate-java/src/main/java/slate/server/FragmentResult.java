package slate.server;

import slate.Analysis;
import slate.diag.Diagnostic;

import java.util.List;

/**
 * Analysis of one fragment. {@code diagnostics} are positioned in the host document; the spans
 * inside {@code analysis} stay fragment-local.
 */
public record FragmentResult(Fragment fragment, Analysis analysis, List<Diagnostic> diagnostics) {

    public FragmentResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
