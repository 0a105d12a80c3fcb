package slate.check;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slate.ast.Program;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;
import slate.ast.expr.Num;
import slate.ast.stmt.Definition;
import slate.diag.Diagnostic;
import slate.diag.DiagnosticCode;
import slate.math.Rational;
import slate.rewrite.RewriteEngine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds variables defined more than once with values that cannot both hold.
 * <p>
 * Definitions are resolved to a fixpoint: every known value is substituted into each unresolved
 * right-hand side, which is then simplified; a definition whose value reduces to a number is
 * resolved, and the earliest resolved definition of a variable gives its known value. A value that
 * becomes known late therefore still reaches definitions written before it:
 * <pre>
 *   a := c
 *   a := 2c
 *   c := 1     // a is 1 and 2
 * </pre>
 * Definitions that never reduce to a number are never reported.
 */
public final class DefinitionChecker {
    private static final Logger log = LoggerFactory.getLogger(DefinitionChecker.class);

    /** Upper bound on the incompatible pairs reported for one program. */
    public static final int MAX_DEFINITION_PAIRS = 100;

    public record Result(
            SlotTable slots,
            Map<Definition, Rational> resolved,
            List<Diagnostic> diagnostics
    ) {
        /** The known value of {@code name}: its earliest resolved definition. */
        public Optional<Rational> valueOf(String name) {
            for (Definition d : slots.definitions(name)) {
                Rational v = resolved.get(d);
                if (v != null) return Optional.of(v);
            }
            return Optional.empty();
        }
    }

    private final RewriteEngine engine;

    public DefinitionChecker(RewriteEngine engine) {
        this.engine = engine;
    }

    public Result check(Program program) {
        SlotTable slots = new SlotTable();
        List<Definition> definitions = program.definitions();
        for (Definition d : definitions) slots.define(d);

        Map<Definition, Rational> resolved = new LinkedHashMap<>();
        boolean changed = true;
        int rounds = 0;
        while (changed) {
            changed = false;
            rounds++;
            Map<String, Num> known = knownValues(slots, resolved);
            for (Definition d : definitions) {
                if (resolved.containsKey(d)) continue;
                Expr value = Exprs.substitute(d.value(), known);
                Expr simplified = engine.simplify(value).expr();
                if (simplified instanceof Num n) {
                    resolved.put(d, n.value());
                    changed = true;
                }
            }
        }
        log.debug("Resolved {} of {} definitions in {} rounds", resolved.size(), definitions.size(), rounds);

        List<Diagnostic> out = new ArrayList<>();
        for (int slot = 0; slot < slots.size(); slot++) {
            Definition first = null;
            for (Definition d : slots.definitions(slot)) {
                Rational v = resolved.get(d);
                if (v == null) continue;
                if (first == null) {
                    first = d;
                    continue;
                }
                Rational expected = resolved.get(first);
                if (v.equals(expected)) continue;
                if (out.size() == MAX_DEFINITION_PAIRS) {
                    log.debug("More than {} incompatible definition pairs, dropping the rest", MAX_DEFINITION_PAIRS);
                    return new Result(slots, ImmutableMap.copyOf(resolved), out);
                }
                out.add(incompatible(d, v, first, expected));
            }
        }
        return new Result(slots, ImmutableMap.copyOf(resolved), out);
    }

    private static Map<String, Num> knownValues(SlotTable slots, Map<Definition, Rational> resolved) {
        Map<String, Num> known = new HashMap<>();
        for (int slot = 0; slot < slots.size(); slot++) {
            for (Definition d : slots.definitions(slot)) {
                Rational v = resolved.get(d);
                if (v != null) {
                    known.put(d.variable(), new Num(v));
                    break;
                }
            }
        }
        return known;
    }

    private static Diagnostic incompatible(Definition later, Rational value, Definition earlier, Rational expected) {
        String name = later.variable();
        return Diagnostic.of(DiagnosticCode.V0001, later.span(), DiagnosticCode.V0001.title(),
                        "\"" + name + "\" is " + value + " here")
                .withLabel(earlier.span(), "but " + expected + " here")
                .withNote("\"" + name + "\" cannot be both " + expected + " and " + value);
    }
}
