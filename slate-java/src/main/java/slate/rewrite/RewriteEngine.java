package slate.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Simplifies expressions to a fixpoint.
 * <p>
 * A pass walks the tree bottom-up. At each node it canonicalizes, folds literal operands and then
 * applies the first registry rule that matches. Passes repeat until one changes nothing, a form
 * seen before comes back, or the pass limit derived from the input size is hit; in the latter two
 * cases the last form is returned with a {@link RewriteIssue.Kind#NOT_CONVERGED} issue.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class RewriteEngine {
    private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);

    private final RuleRegistry registry;
    private final EngineLimits limits;
    private final Canonicalizer canonicalizer;
    private final ConstantFolder folder;

    public RewriteEngine(RuleRegistry registry) {
        this(registry, EngineLimits.DEFAULT);
    }

    public RewriteEngine(RuleRegistry registry, EngineLimits limits) {
        this.registry = registry;
        this.limits = limits;
        this.canonicalizer = new Canonicalizer(limits);
        this.folder = new ConstantFolder(limits);
    }

    public RuleRegistry registry() {
        return registry;
    }

    public EngineLimits limits() {
        return limits;
    }

    public Simplification simplify(Expr expr) {
        Set<RewriteIssue> issues = new LinkedHashSet<>();
        int limit = limits.passLimit(Exprs.nodeCount(expr));
        Set<Expr> seen = new HashSet<>();
        seen.add(expr);

        Expr current = expr;
        int passes = 0;
        while (passes < limit) {
            Expr next = pass(current, issues);
            passes++;
            if (next.equals(current)) {
                log.debug("Simplified in {} passes: {}", passes, next);
                return new Simplification(next, new ArrayList<>(issues), passes, true);
            }
            if (!seen.add(next)) {
                log.debug("Rewrite cycle detected after {} passes at {}", passes, next);
                current = next;
                break;
            }
            current = next;
        }

        log.debug("No fixpoint after {} passes (limit {}, {} nodes), keeping the last form", passes, limit, Exprs.nodeCount(expr));
        issues.add(new RewriteIssue(RewriteIssue.Kind.NOT_CONVERGED, current));
        return new Simplification(current, new ArrayList<>(issues), passes, false);
    }

    private Expr pass(Expr e, Collection<RewriteIssue> issues) {
        Expr node = Exprs.mapChildren(e, child -> pass(child, issues));
        node = canonicalizer.canonicalize(node, issues);
        if (registry.foldsConstants()) {
            node = folder.fold(node, issues);
        }
        return registry.applyFirst(node).orElse(node);
    }
}
