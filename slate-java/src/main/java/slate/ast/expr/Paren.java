package slate.ast.expr;

/** An explicit grouping from the source text. The rewrite engine strips it. */
public record Paren(Expr inner) implements Expr {}
