package slate.rewrite;

import com.google.common.collect.ImmutableList;
import slate.ast.expr.Expr;

import java.util.List;

/**
 * Result of {@link RewriteEngine#simplify}: the last form reached, the issues met on the way and
 * whether a fixpoint was reached before the pass limit.
 */
public record Simplification(Expr expr, List<RewriteIssue> issues, int passes, boolean converged) {

    public Simplification {
        issues = ImmutableList.copyOf(issues);
    }

    public boolean hasIssue(RewriteIssue.Kind kind) {
        return issues.stream().anyMatch(i -> i.kind() == kind);
    }
}
