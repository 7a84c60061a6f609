package work.lcod.summation.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores the custom offline transforms a CUSTOM step can select by name.
 */
public final class Registry {
    private final Map<String, Entry> functions = new ConcurrentHashMap<>();

    public Registry register(String id, CustomStep fn) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Custom step id must not be blank");
        }
        functions.put(id, new Entry(id, fn));
        return this;
    }

    public Entry get(String id) {
        return id == null ? null : functions.get(id);
    }

    public void unregister(String id) {
        if (id != null) {
            functions.remove(id);
        }
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(functions);
    }

    public record Entry(String id, CustomStep function) {}
}
