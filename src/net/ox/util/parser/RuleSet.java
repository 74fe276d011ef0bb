package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.NamedValue;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.Reducer;

/**
 * An ordered table of parser rules for ParserCompiler.
 * Each rule maps alternative patterns (in grammar notation, possibly
 * several separated by "|") to reducers; a null reducer leaves the value
 * to the default tree building.
 */
public class RuleSet {

    public static class Alternative {

        private final String pattern;
        private final Reducer reducer;

        public Alternative(String pattern, Reducer reducer) {
            this.pattern = pattern;
            this.reducer = reducer;
        }

        public String toString() {
            return String.format("%s@%h[pattern=%s,reducer=%s]",
                getClass().getName(), this, pattern, reducer);
        }

        public String getPattern() {
            return pattern;
        }

        public Reducer getReducer() {
            return reducer;
        }

    }

    /**
     * A reducer with a name, which is used for the generated grammar
     * alias.
     */
    public static abstract class NamedReducer implements Reducer, NamedValue {

        private final String name;

        public NamedReducer(String name) {
            this.name = name;
        }

        public String toString() {
            return String.format("%s@%h[name=%s]", getClass().getName(),
                                 this, name);
        }

        public String getName() {
            return name;
        }

    }

    private final Map<String, List<Alternative>> rules;

    public RuleSet() {
        rules = new LinkedHashMap<String, List<Alternative>>();
    }

    public String toString() {
        return String.format("%s@%h[rules=%s]", getClass().getName(), this,
                             rules.keySet());
    }

    public Set<String> getRuleNames() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public List<Alternative> getAlternatives(String name) {
        List<Alternative> ret = rules.get(name);
        if (ret == null) return Collections.emptyList();
        return Collections.unmodifiableList(ret);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public RuleSet rule(String name, String pattern, Reducer reducer)
            throws InvalidGrammarException {
        if (! GrammarImpl.RULE_NAME_PATTERN.matcher(name).matches())
            throw new InvalidGrammarException("Invalid rule name " + name);
        List<Alternative> alts = rules.get(name);
        if (alts == null) {
            alts = new ArrayList<Alternative>();
            rules.put(name, alts);
        }
        alts.add(new Alternative(pattern, reducer));
        return this;
    }
    public RuleSet rule(String name, String pattern)
            throws InvalidGrammarException {
        return rule(name, pattern, null);
    }

    public static RuleSet of(Map<String, ? extends Map<String, Reducer>> table)
            throws InvalidGrammarException {
        RuleSet ret = new RuleSet();
        for (Map.Entry<String, ? extends Map<String, Reducer>> ent :
                 table.entrySet()) {
            for (Map.Entry<String, Reducer> alt :
                     ent.getValue().entrySet()) {
                ret.rule(ent.getKey(), alt.getKey(), alt.getValue());
            }
        }
        return ret;
    }

    /**
     * Wrap reducer so that it carries the given name.
     */
    public static NamedReducer named(String name, final Reducer reducer) {
        return new NamedReducer(name) {
            public Object reduce(Object... children) throws MappingException {
                return reducer.reduce(children);
            }
        };
    }

}
