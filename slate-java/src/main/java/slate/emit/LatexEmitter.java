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
 * Typeset output. Groups with {@code \left(...\right)}; with {@code frac} set, divisions and
 * non-integer numbers become {@code \frac{}{}}.
 */
public final class LatexEmitter implements Emitter {
    private final boolean frac;

    public LatexEmitter(boolean frac) {
        this.frac = frac;
    }

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
            sb.append(v.name().length() == 1 ? v.name() : "\\mathrm{" + v.name().replace("_", "\\_") + "}");
        } else if (e instanceof PatternVar p) {
            sb.append(switch (p.kind()) {
                case VARIABLE -> "\\$";
                case CONSTANT -> "\\#";
                case ANY -> "\\_";
            }).append(p.name());
        } else if (e instanceof Paren p) {
            group(sb, p.inner(), true);
        } else if (e instanceof UnaryExpr u) {
            sb.append(u.op().symbol());
            group(sb, u.operand(), Precedence.wrapOperand(u.operand()));
        } else if (e instanceof BinaryExpr b) {
            writeBinary(sb, b);
        }
    }

    private void writeBinary(StringBuilder sb, BinaryExpr b) {
        switch (b.op()) {
            case DIV -> {
                if (frac) {
                    sb.append("\\frac{");
                    write(sb, b.left());
                    sb.append("}{");
                    write(sb, b.right());
                    sb.append('}');
                    return;
                }
                infix(sb, b, " / ");
            }
            case POW -> {
                sb.append('{');
                group(sb, b.left(), Precedence.wrapLeft(b, b.left()) || isFraction(b.left()));
                sb.append("}^{");
                write(sb, b.right());
                sb.append('}');
            }
            case MUL -> infix(sb, b, " \\cdot ");
            case ADD, SUB -> infix(sb, b, " " + b.op().symbol() + " ");
        }
    }

    private void infix(StringBuilder sb, BinaryExpr b, String op) {
        group(sb, b.left(), Precedence.wrapLeft(b, b.left()));
        sb.append(op);
        group(sb, b.right(), Precedence.wrapRight(b, b.right()));
    }

    private void group(StringBuilder sb, Expr e, boolean wrap) {
        if (wrap) sb.append("\\left(");
        write(sb, e);
        if (wrap) sb.append("\\right)");
    }

    private boolean isFraction(Expr e) {
        return frac && e instanceof BinaryExpr b && b.op() == BinaryExpr.Operator.DIV;
    }

    private void writeNumber(StringBuilder sb, Rational r) {
        if (r.isInteger()) {
            sb.append(r.numerator());
        } else if (frac) {
            if (r.signum() < 0) sb.append('-');
            sb.append("\\frac{").append(r.numerator().abs()).append("}{").append(r.denominator()).append('}');
        } else {
            sb.append(r.numerator()).append(" / ").append(r.denominator());
        }
    }
}
