package net.ox.api.parser;

/**
 * A Mapper that post-processes the result of another Mapper.
 * Subclasses implement transform(); alternatively, the static of() method
 * wraps a Transformer.
 */
public abstract class TransformMapper<F, T> implements Mapper<T> {

    /**
     * A single-object conversion.
     * Unlike a Mapper, a Transformer does not operate on parse trees but on
     * whatever another Mapper produced.
     */
    public static interface Transformer<F, T> {

        /**
         * Convert the given object or throw a MappingException.
         */
        T transform(F value) throws MappingException;

    }

    private final Mapper<F> nested;

    /**
     * Create a new TransformMapper post-processing the results of nested.
     */
    public TransformMapper(Mapper<F> nested) {
        this.nested = nested;
    }

    /**
     * The Mapper whose results are transformed.
     */
    protected Mapper<F> getNestedMapper() {
        return nested;
    }

    /**
     * Equivalent to transform(getNestedMapper().map(tree)).
     */
    public T map(Parser.ParseTree tree) throws MappingException {
        return transform(getNestedMapper().map(tree));
    }

    /**
     * Convert the result of the nested Mapper.
     */
    protected abstract T transform(F value) throws MappingException;

    /**
     * Create a TransformMapper delegating its transform() to the given
     * Transformer.
     */
    public static <F, T> TransformMapper<F, T> of(
            final Mapper<F> nested, final Transformer<F, T> transformer) {
        return new TransformMapper<F, T>(nested) {
            protected T transform(F value) throws MappingException {
                return transformer.transform(value);
            }
        };
    }

}
