package slate.rewrite;

import com.google.common.collect.ImmutableMap;
import slate.ast.expr.Expr;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pattern variable (by its text, e.g. {@code _a}) to the subexpression it matched.
 */
public final class Bindings {

    public static final Bindings EMPTY = new Bindings(ImmutableMap.of());

    private final ImmutableMap<String, Expr> map;

    private Bindings(ImmutableMap<String, Expr> map) {
        this.map = map;
    }

    public static Bindings of(String pattern, Expr value) {
        return new Bindings(ImmutableMap.of(pattern, value));
    }

    public static Bindings of(Map<String, ? extends Expr> values) {
        return new Bindings(ImmutableMap.copyOf(values));
    }

    public Expr get(String pattern) {
        Expr e = map.get(pattern);
        if (e == null) throw new IllegalArgumentException("Unbound pattern " + pattern);
        return e;
    }

    public boolean has(String pattern) {
        return map.containsKey(pattern);
    }

    /** Combines two match results; fails when a pattern is bound to two different expressions. */
    public Optional<Bindings> merge(Bindings other) {
        if (other.map.isEmpty()) return Optional.of(this);
        if (map.isEmpty()) return Optional.of(other);
        Map<String, Expr> merged = new LinkedHashMap<>(map);
        for (Map.Entry<String, Expr> e : other.map.entrySet()) {
            Expr prev = merged.putIfAbsent(e.getKey(), e.getValue());
            if (prev != null && !prev.equals(e.getValue())) return Optional.empty();
        }
        return Optional.of(new Bindings(ImmutableMap.copyOf(merged)));
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
