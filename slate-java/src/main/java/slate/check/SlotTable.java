package slate.check;

import slate.ast.stmt.Definition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable name to slot index, with every definition of the variable in program order.
 */
public final class SlotTable {
    private final Map<String, Integer> slots = new LinkedHashMap<>();
    private final List<String> names = new ArrayList<>();
    private final List<List<Definition>> definitions = new ArrayList<>();

    public int define(Definition d) {
        int slot = slots.computeIfAbsent(d.variable(), n -> {
            names.add(n);
            definitions.add(new ArrayList<>());
            return names.size() - 1;
        });
        definitions.get(slot).add(d);
        return slot;
    }

    public Optional<Integer> lookup(String name) {
        return Optional.ofNullable(slots.get(name));
    }

    public String name(int slot) { return names.get(slot); }

    public List<Definition> definitions(int slot) {
        return List.copyOf(definitions.get(slot));
    }

    public List<Definition> definitions(String name) {
        return lookup(name).map(this::definitions).orElse(List.of());
    }

    public int size() { return names.size(); }
}
