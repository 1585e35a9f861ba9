package io.conduit.core.state;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Shared key/value state carried across every node of a pipeline run.
///
/// A single instance is shared by reference for the whole run, including by
/// sibling branches of a parallel fan-out. Each public operation holds one
/// internal lock, so reads and writes are individually atomic. There is no
/// multi-key transaction: two writers merging overlapping keys race, and the
/// last one to acquire the lock wins. Nodes that need deterministic results
/// should namespace their keys as `{nodeId}.`.
///
/// Alongside the values the context keeps an append-only log of free-text
/// entries that is persisted with each checkpoint.
///
/// @implNote Thread-safe. Values are stored as given; callers must not mutate
/// a value object after handing it to the context.
public final class RunContext {

    private final Object lock = new Object();
    private final Map<String, Object> values;
    private final List<String> log;

    /// Creates an empty context.
    public RunContext() {
        this(Map.of());
    }

    /// Creates a context seeded with initial values.
    ///
    /// @param initial initial values, not null
    public RunContext(Map<String, ?> initial) {
        this.values = new HashMap<>(initial);
        this.log = new ArrayList<>();
    }

    private RunContext(Map<String, Object> values, List<String> log) {
        this.values = values;
        this.log = log;
    }

    /// Rebuilds a context from persisted values and log entries.
    ///
    /// @param values saved values, not null
    /// @param logs saved log entries in append order, not null
    /// @return restored context, never null
    public static RunContext restore(Map<String, ?> values, List<String> logs) {
        return new RunContext(new HashMap<>(values), new ArrayList<>(logs));
    }

    /// Sets a single value, replacing any existing one.
    public void set(String key, Object value) {
        synchronized (lock) {
            values.put(key, value);
        }
    }

    /// Returns the value for a key, or null if absent.
    public Object get(String key) {
        synchronized (lock) {
            return values.get(key);
        }
    }

    /// Returns the value for a key, or the default if absent.
    public Object get(String key, Object defaultValue) {
        synchronized (lock) {
            Object value = values.get(key);
            return value != null ? value : defaultValue;
        }
    }

    /// Returns the value for a key as a string, or the default if absent.
    public String getString(String key, String defaultValue) {
        Object value = get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /// Returns the value for a key as a string, or an empty string if absent.
    public String getString(String key) {
        return getString(key, "");
    }

    /// Returns true when the key is present with a non-null value.
    public boolean contains(String key) {
        synchronized (lock) {
            return values.get(key) != null;
        }
    }

    /// Returns true when the key holds a truthy value.
    ///
    /// Booleans are taken as is, numbers are truthy when non-zero, strings when
    /// non-blank and not `false` or `0`, collections and maps when non-empty.
    /// Absent keys are falsy.
    public boolean isTruthy(String key) {
        Object value = get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            return !s.isEmpty() && !s.equalsIgnoreCase("false") && !s.equals("0");
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /// Returns a shallow copy of all values, suitable as read-only handler input.
    ///
    /// @return independent map, never null
    public Map<String, Object> snapshot() {
        synchronized (lock) {
            return new HashMap<>(values);
        }
    }

    /// Merges the given updates into the context in one atomic step.
    ///
    /// @param updates key/value pairs to merge, not null
    public void applyUpdates(Map<String, ?> updates) {
        synchronized (lock) {
            values.putAll(updates);
        }
    }

    /// Returns a deep copy for branch isolation.
    ///
    /// Nested maps, collections and arrays are copied recursively; other values
    /// are treated as immutable and shared. The log is copied as well.
    ///
    /// @return independent context, never null
    public RunContext copy() {
        synchronized (lock) {
            Map<String, Object> copied = new HashMap<>();
            values.forEach((key, value) -> copied.put(key, deepCopy(value)));
            return new RunContext(copied, new ArrayList<>(log));
        }
    }

    /// Appends a free-text entry to the run log.
    public void appendLog(String entry) {
        synchronized (lock) {
            log.add(entry);
        }
    }

    /// Returns a copy of all log entries in append order.
    public List<String> logs() {
        synchronized (lock) {
            return new ArrayList<>(log);
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "RunContext{keys=" + values.keySet() + ", logEntries=" + log.size() + "}";
        }
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            for (int i = 0; i < length; i++) {
                Array.set(copy, i, deepCopy(Array.get(value, i)));
            }
            return copy;
        }
        return value;
    }
}
