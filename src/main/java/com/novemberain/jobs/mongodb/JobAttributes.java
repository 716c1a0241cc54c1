package com.novemberain.jobs.mongodb;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Attribute bag of a {@link Job} that remembers which keys were written
 * since the last save, so that the store can update only those fields.
 *
 * <p>Reads never mark a key as changed. Every {@link #set(String, Object)} and
 * {@link #unset(String)} does, even when the value stays the same, so the change
 * set is a list of candidates to write rather than a diff.</p>
 */
public class JobAttributes {

    private final Map<String, Object> values;
    private final Set<String> changed = new LinkedHashSet<>();

    private JobAttributes(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Attributes of a new job: every given key counts as changed.
     */
    public static JobAttributes tracking(Map<String, ?> initial) {
        JobAttributes attributes = new JobAttributes(new LinkedHashMap<String, Object>());
        for (Map.Entry<String, ?> entry : initial.entrySet()) {
            attributes.set(entry.getKey(), entry.getValue());
        }
        return attributes;
    }

    /**
     * Attributes read back from the store, with nothing to write.
     */
    public static JobAttributes restored(Map<String, ?> stored) {
        return new JobAttributes(new LinkedHashMap<String, Object>(stored));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public <T> T get(String key, Class<T> type) {
        return type.cast(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void set(String key, Object value) {
        changed.add(key);
        values.put(key, value);
    }

    public void unset(String key) {
        changed.add(key);
        values.remove(key);
    }

    /**
     * Writes a value assigned by the store itself, without marking it changed.
     */
    public void restore(String key, Object value) {
        values.put(key, value);
    }

    public Set<String> changedKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(changed));
    }

    public boolean hasChanges() {
        return !changed.isEmpty();
    }

    public void clearChanges() {
        changed.clear();
    }

    /**
     * Returns the keys changed since the last call and starts a new change set.
     */
    public Set<String> takeChanges() {
        Set<String> taken = changedKeys();
        changed.clear();
        return taken;
    }

    public void markChanged(Collection<String> keys) {
        changed.addAll(keys);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
