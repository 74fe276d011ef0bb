package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/* The value of a rule whose values are spliced into the enclosing
 * production. Never escapes the parser. */
final class Splice {

    private final List<Object> items;

    Splice(List<Object> items) {
        this.items = Collections.unmodifiableList(
            new ArrayList<Object>(items));
    }

    public String toString() {
        return "Splice" + items;
    }

    public List<Object> getItems() {
        return items;
    }

}
