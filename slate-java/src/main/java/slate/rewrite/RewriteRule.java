package slate.rewrite;

import slate.ast.expr.Expr;

import java.util.Optional;

/**
 * A rewrite applied by the engine at a single node. {@link #matches} inspects the node only; the
 * engine takes care of walking the tree.
 */
public interface RewriteRule {

    String name();

    /** Bindings for the node if this rule applies to it, side conditions included. */
    Optional<Bindings> matches(Expr node);

    /** Builds the replacement from a successful match. */
    Expr apply(Bindings bindings);

    default Optional<Expr> rewrite(Expr node) {
        return matches(node).map(this::apply);
    }
}
