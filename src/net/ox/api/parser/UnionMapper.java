package net.ox.api.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Mapper choosing between other mappers by the name of the parse tree.
 * Children are registered under the rule (or token) names they handle;
 * map() fails for trees whose name has no registered child.
 */
public class UnionMapper<T> implements Mapper<T> {

    private final Map<String, Mapper<? extends T>> children;

    public UnionMapper() {
        this.children = new LinkedHashMap<String, Mapper<? extends T>>();
    }

    /**
     * The (mutable) name-to-Mapper table of this UnionMapper.
     */
    public Map<String, Mapper<? extends T>> getChildren() {
        return children;
    }

    /**
     * Register child as the handler of trees named name.
     */
    public void add(String name, Mapper<? extends T> child) {
        getChildren().put(name, child);
    }

    /**
     * Whether a child is registered for the name of the given tree.
     */
    public boolean canMap(Parser.ParseTree tree) {
        return getChildren().containsKey(tree.getName());
    }

    public T map(Parser.ParseTree tree) throws MappingException {
        Mapper<? extends T> child = getChildren().get(tree.getName());
        if (child == null)
            throw new MappingException("Cannot map parse tree node type " +
                tree.getName());
        return child.map(tree);
    }

}
