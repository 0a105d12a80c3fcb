package slate.ast;

import com.google.common.collect.ImmutableList;
import slate.ast.stmt.Definition;
import slate.ast.stmt.Stmt;

import java.util.List;
import java.util.function.UnaryOperator;

public record Program(
        List<Stmt> statements
) {

    public Program {
        statements = ImmutableList.copyOf(statements);
    }

    public List<Definition> definitions() {
        ImmutableList.Builder<Definition> out = ImmutableList.builder();
        for (Stmt s : statements) {
            if (s instanceof Definition d) out.add(d);
        }
        return out.build();
    }

    public Program mapStatements(UnaryOperator<Stmt> f) {
        ImmutableList.Builder<Stmt> out = ImmutableList.builder();
        for (Stmt s : statements) out.add(f.apply(s));
        return new Program(out.build());
    }
}
