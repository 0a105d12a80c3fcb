package slate;

import slate.ast.Program;
import slate.ast.stmt.Definition;
import slate.ast.stmt.Stmt;
import slate.check.DefinitionChecker;
import slate.diag.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything {@link Slate#analyze} found for one program. {@code simplified} holds one statement
 * per statement of {@code program}, in the same order.
 */
public record Analysis(
        String source,
        Program program,
        Program simplified,
        DefinitionChecker.Result definitions,
        List<Diagnostic> diagnostics
) {

    public Analysis {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /** Simplified values of every definition of {@code name}, in program order. */
    public List<Stmt> simplifiedDefinitionsOf(String name) {
        List<Stmt> out = new ArrayList<>();
        List<Stmt> original = program.statements();
        for (int i = 0; i < original.size(); i++) {
            if (original.get(i) instanceof Definition d && d.variable().equals(name)) {
                out.add(simplified.statements().get(i));
            }
        }
        return out;
    }
}
