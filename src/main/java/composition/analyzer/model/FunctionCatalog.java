package composition.analyzer.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Unique function reference names seen across every pipeline of a run, kept in alphabetical order.
 * Owned by the run coordinator; extractors only hand names in.
 */
public final class FunctionCatalog {

    private final TreeSet<String> names = new TreeSet<>();

    public void add(String name) {
        names.add(Objects.requireNonNull(name, "name"));
    }

    public void addAll(Collection<String> functionNames) {
        Objects.requireNonNull(functionNames, "functionNames");
        for (String name : functionNames) {
            add(name);
        }
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return names.size();
    }

    public List<String> sortedNames() {
        return List.copyOf(names);
    }
}
