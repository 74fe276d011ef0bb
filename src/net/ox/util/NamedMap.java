package net.ox.util;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.ox.api.NamedValue;

/* A map whose keys are the names of its values. */
public class NamedMap<V extends NamedValue> extends AbstractMap<String, V> {

    private final Map<String, V> data;

    public NamedMap(Map<String, V> data) {
        this.data = data;
        for (Map.Entry<String, V> ent : data.entrySet()) {
            // Intentionally permitting NPE-s.
            if (! ent.getKey().equals(ent.getValue().getName()))
                throw new IllegalArgumentException(
                    "Invalid pair in NamedMap backing data");
        }
    }
    public NamedMap() {
        this(new LinkedHashMap<String, V>());
    }

    public Set<Map.Entry<String, V>> entrySet() {
        return Collections.unmodifiableMap(data).entrySet();
    }

    public boolean containsKey(Object key) {
        return data.containsKey(key);
    }

    public V get(Object key) {
        return data.get(key);
    }

    public V put(String key, V value) {
        if (! key.equals(value.getName()))
            throw new IllegalArgumentException("Cannot insert pair " + key +
                ":" + value + " into NamedMap");
        return data.put(key, value);
    }

    public V add(V value) {
        return put(value.getName(), value);
    }

    public V remove(Object key) {
        return data.remove(key);
    }

    public void clear() {
        data.clear();
    }

}
