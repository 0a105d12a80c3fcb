package slate.emit;

import slate.ast.Program;
import slate.ast.expr.Expr;
import slate.ast.stmt.Definition;
import slate.ast.stmt.Stmt;

import java.util.StringJoiner;

/**
 * Renders trees as text. Implementations are pure functions of the tree.
 */
public interface Emitter {

    String emit(Expr expr);

    default String emit(Stmt stmt) {
        if (stmt instanceof Definition d) {
            return d.variable() + " " + d.marker().symbol() + " " + emit(d.value());
        }
        return emit(stmt.expr());
    }

    /** One statement per line. */
    default String emit(Program program) {
        StringJoiner out = new StringJoiner("\n");
        for (Stmt s : program.statements()) out.add(emit(s));
        return out.toString();
    }
}
