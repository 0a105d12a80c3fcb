package slate.emit;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.PatternVar;
import slate.ast.expr.UnaryExpr;
import slate.ast.expr.Var;
import slate.ast.stmt.Definition;
import slate.ast.stmt.Stmt;

/**
 * Prefix form: {@code (+ x 3)}, {@code (- x)}, {@code (:= a 1)}. Grouping is implicit in the
 * nesting, so explicit parentheses of the source are dropped.
 */
public final class SExpressionEmitter implements Emitter {

    @Override
    public String emit(Expr expr) {
        StringBuilder sb = new StringBuilder();
        write(sb, expr);
        return sb.toString();
    }

    @Override
    public String emit(Stmt stmt) {
        if (stmt instanceof Definition d) {
            return "(" + d.marker().symbol() + " " + d.variable() + " " + emit(d.value()) + ")";
        }
        return emit(stmt.expr());
    }

    private void write(StringBuilder sb, Expr e) {
        if (e instanceof Num n) {
            if (n.value().isInteger()) {
                sb.append(n.value().numerator());
            } else {
                sb.append("(/ ").append(n.value().numerator()).append(' ').append(n.value().denominator()).append(')');
            }
        } else if (e instanceof Var v) {
            sb.append(v.name());
        } else if (e instanceof PatternVar p) {
            sb.append(p.text());
        } else if (e instanceof Paren p) {
            write(sb, p.inner());
        } else if (e instanceof UnaryExpr u) {
            sb.append('(').append(u.op().symbol()).append(' ');
            write(sb, u.operand());
            sb.append(')');
        } else if (e instanceof BinaryExpr b) {
            sb.append('(').append(b.op().symbol()).append(' ');
            write(sb, b.left());
            sb.append(' ');
            write(sb, b.right());
            sb.append(')');
        }
    }
}
