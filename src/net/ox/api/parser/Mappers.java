package net.ox.api.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Building blocks for the mappers that turn grammar-text parse trees into
 * rule and token definitions.
 */
public final class Mappers {

    private static final RecordMapper<String> CONTENT =
        new RecordMapper<String>() {
            protected String mapInner(Provider p) throws MappingException {
                TokenSource.Token tok = p.getParseTree().getToken();
                if (tok == null)
                    throw new MappingException("Expected a token instead " +
                        "of " + p.getParseTree().getName());
                return tok.getContent();
            }
        };

    private Mappers() {}

    /**
     * The raw text of a token leaf.
     */
    public static Mapper<String> content() {
        return CONTENT;
    }

    public static <T> Mapper<T> constant(final T value) {
        return new Mapper<T>() {
            public T map(Parser.ParseTree tree) {
                return value;
            }
        };
    }

    /**
     * Map every child with element, collecting the results in order.
     * The list returned is modifiable.
     */
    public static <T> Mapper<List<T>> aggregate(final Mapper<T> element) {
        return new RecordMapper<List<T>>() {
            protected List<T> mapInner(Provider p) throws MappingException {
                List<T> ret = new ArrayList<T>(
                    p.getParseTree().getChildren().size());
                while (p.hasNext()) ret.add(p.mapNext(element));
                return ret;
            }
        };
    }

    /**
     * Map the single child of a tree with inner.
     */
    public static <T> Mapper<T> unwrap(final Mapper<T> inner) {
        return new RecordMapper<T>() {
            protected T mapInner(Provider p) throws MappingException {
                return p.mapNext(inner);
            }
        };
    }

}
