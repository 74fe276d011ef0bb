package net.ox.util;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import net.ox.api.NamedValue;

/* A set of same-named values that is itself named after them. */
public class NamedSet<E extends NamedValue> extends AbstractSet<E>
        implements NamedValue {

    private final String name;
    private final Set<E> data;

    public NamedSet(String name, Set<E> data) {
        if (name == null)
            throw new NullPointerException("NamedSet name may not be null");
        if (data == null)
            throw new NullPointerException(
                "NamedSet backing data may not be null");
        this.name = name;
        this.data = data;
        for (E item : data) {
            if (! item.getName().equals(name))
                throw new IllegalArgumentException(
                    "NamedSet backing data contain invalid elements");
        }
    }
    public NamedSet(String name) {
        this(name, new LinkedHashSet<E>());
    }

    public String getName() {
        return name;
    }

    public int size() {
        return data.size();
    }

    public Iterator<E> iterator() {
        return data.iterator();
    }

    public boolean contains(Object elem) {
        return data.contains(elem);
    }

    public boolean add(E elem) {
        if (! getName().equals(elem.getName()))
            throw new IllegalArgumentException(
                "Adding mismatching value " + elem.getName() +
                " to NamedSet " + getName());
        return data.add(elem);
    }

    public boolean remove(Object obj) {
        return data.remove(obj);
    }

    public void clear() {
        data.clear();
    }

}
