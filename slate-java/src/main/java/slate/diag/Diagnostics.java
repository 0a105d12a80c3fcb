package slate.diag;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulator passed through the pipeline stages. Stages report into it instead of throwing, so
 * one bad statement never hides the findings for the rest of a program.
 */
public final class Diagnostics {
    private final List<Diagnostic> items = new ArrayList<>();

    public void report(Diagnostic d) {
        items.add(d);
    }

    public void reportAll(Iterable<Diagnostic> ds) {
        for (Diagnostic d : ds) items.add(d);
    }

    public boolean hasErrors() {
        for (Diagnostic d : items) {
            if (d.isError()) return true;
        }
        return false;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<Diagnostic> all() {
        return ImmutableList.copyOf(items);
    }
}
