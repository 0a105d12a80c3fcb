package slate.ast.expr;

public sealed interface Expr
        permits Num, Var, BinaryExpr, UnaryExpr, Paren, PatternVar {}
