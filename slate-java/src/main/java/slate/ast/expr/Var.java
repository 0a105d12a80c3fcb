package slate.ast.expr;

public record Var(String name) implements Expr {}
