package slate.emit;

import slate.ast.expr.BinaryExpr;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.ast.expr.Paren;
import slate.ast.expr.PatternVar;
import slate.ast.expr.UnaryExpr;
import slate.ast.expr.Var;
import slate.math.Rational;

/**
 * Infix text with the fewest parentheses that parse back to the same tree: {@code x + 3},
 * {@code (a + b) * c}, {@code x ^ 2 / 3}.
 */
public final class PrettyEmitter implements Emitter {

    @Override
    public String emit(Expr expr) {
        StringBuilder sb = new StringBuilder();
        write(sb, expr);
        return sb.toString();
    }

    private void write(StringBuilder sb, Expr e) {
        if (e instanceof Num n) {
            writeNumber(sb, n.value());
        } else if (e instanceof Var v) {
            sb.append(v.name());
        } else if (e instanceof PatternVar p) {
            sb.append(p.text());
        } else if (e instanceof Paren p) {
            sb.append('(');
            write(sb, p.inner());
            sb.append(')');
        } else if (e instanceof UnaryExpr u) {
            sb.append(u.op().symbol());
            group(sb, u.operand(), Precedence.wrapOperand(u.operand()));
        } else if (e instanceof BinaryExpr b) {
            group(sb, b.left(), Precedence.wrapLeft(b, b.left()));
            sb.append(' ').append(b.op().symbol()).append(' ');
            group(sb, b.right(), Precedence.wrapRight(b, b.right()));
        }
    }

    private void group(StringBuilder sb, Expr e, boolean wrap) {
        if (wrap) sb.append('(');
        write(sb, e);
        if (wrap) sb.append(')');
    }

    private static void writeNumber(StringBuilder sb, Rational r) {
        if (r.isInteger()) {
            sb.append(r.numerator());
        } else {
            sb.append(r.numerator()).append(" / ").append(r.denominator());
        }
    }
}
