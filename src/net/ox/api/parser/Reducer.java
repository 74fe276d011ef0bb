package net.ox.api.parser;

/**
 * A callback building the value of a production from the values of its
 * symbols.
 * Reducers are bound to production aliases when a Parser is created.
 * Tokens are passed as TokenSource.Token instances (whose values have
 * already been transformed by their token definitions); anonymous literal
 * tokens are usually filtered out.
 */
public interface Reducer {

    /**
     * Build the value for a matched production.
     * Runtime exceptions thrown from here are reported as ParsingException-s
     * located at the reduction point.
     */
    Object reduce(Object... children) throws MappingException;

}
