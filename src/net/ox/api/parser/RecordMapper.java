package net.ox.api.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A Mapper that walks the children of a parse tree one by one.
 * Subclasses implement mapInner(), pulling children from the Provider in
 * order; running out of children, or leaving some unconsumed, is reported as
 * a MappingException. Leaf trees are handled as records without children.
 */
public abstract class RecordMapper<T> implements Mapper<T> {

    /**
     * Marker exception thrown by Provider.next().
     */
    private static class NoSuchTreeException extends NoSuchElementException {

        public NoSuchTreeException(String message) {
            super(message);
        }

    }

    /**
     * Cursor over the children of the parse tree being mapped.
     * It can be used as an Iterator, via mapNext(), and in for-each loops
     * (which consume the remaining children).
     */
    public static class Provider implements Iterable<Parser.ParseTree>,
                                            Iterator<Parser.ParseTree> {

        private final Parser.ParseTree tree;
        private final Iterator<? extends Parser.ParseTree> iterator;

        public Provider(Parser.ParseTree tree) {
            this.tree = tree;
            this.iterator = tree.getChildren().iterator();
        }

        /** The parse tree whose children are provided. */
        public Parser.ParseTree getParseTree() {
            return tree;
        }

        public Iterator<Parser.ParseTree> iterator() {
            return this;
        }

        public boolean hasNext() {
            return iterator.hasNext();
        }

        public Parser.ParseTree next() {
            if (! iterator.hasNext())
                throw new NoSuchTreeException("Parse tree " +
                    tree.getName() + " has too few children");
            return iterator.next();
        }

        public void remove() {
            throw new UnsupportedOperationException(
                "May not remove from ParseTree provider");
        }

        /** Equivalent to mapper.map(next()). */
        public <U> U mapNext(Mapper<U> mapper) throws MappingException {
            return mapper.map(next());
        }

    }

    public T map(Parser.ParseTree tree) throws MappingException {
        Provider p = new Provider(tree);
        T ret;
        try {
            ret = mapInner(p);
        } catch (NoSuchTreeException exc) {
            throw new MappingException(exc.getMessage(), exc);
        }
        if (p.hasNext())
            throw new MappingException("Parse tree " + tree.getName() +
                                       " has too many children");
        return ret;
    }

    /**
     * Map the tree whose children p provides.
     */
    protected abstract T mapInner(Provider p) throws MappingException;

}
