package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.TokenSource;

/**
 * The immutable LALR(1) automaton of a compiled grammar.
 * Every state maps terminal names to actions and nonterminal names to
 * successor states, and carries the token selection the lexer is
 * restricted to while the parser is in that state.
 */
public final class ParseTable {

    /** The pseudo-terminal denoting the end of the input. */
    public static final String END = "$END";

    public enum ActionType { SHIFT, REDUCE, ACCEPT }

    public static final class Action {

        private final ActionType type;
        private final int target;

        public Action(ActionType type, int target) {
            this.type = type;
            this.target = target;
        }

        public String toString() {
            switch (type) {
                case SHIFT: return "shift " + target;
                case REDUCE: return "reduce " + target;
                default: return "accept";
            }
        }

        public boolean equals(Object other) {
            if (! (other instanceof Action)) return false;
            Action a = (Action) other;
            return type == a.type && target == a.target;
        }

        public int hashCode() {
            return type.hashCode() ^ target;
        }

        public ActionType getType() {
            return type;
        }

        /**
         * The successor state of a SHIFT, or the rule index of a REDUCE.
         */
        public int getTarget() {
            return target;
        }

    }

    /**
     * A production as the parser driver sees it.
     */
    public static final class Rule {

        private final String name;
        private final String alias;
        private final int[] symbolFlags;
        private final int ruleFlags;
        private final Grammar.Production source;

        public Rule(String name, String alias, int[] symbolFlags,
                    int ruleFlags, Grammar.Production source) {
            this.name = name;
            this.alias = alias;
            this.symbolFlags = symbolFlags.clone();
            this.ruleFlags = ruleFlags;
            this.source = source;
        }

        public String toString() {
            return String.format("%s@%h[name=%s,alias=%s,length=%s]",
                getClass().getName(), this, name, alias,
                symbolFlags.length);
        }

        public String getName() {
            return name;
        }

        public String getAlias() {
            return alias;
        }

        public int getLength() {
            return symbolFlags.length;
        }

        public int getSymbolFlags(int index) {
            return symbolFlags[index];
        }

        public int getRuleFlags() {
            return ruleFlags;
        }

        public Grammar.Production getSource() {
            return source;
        }

    }

    public static final class State {

        private final int index;
        private final Map<String, Action> actions;
        private final Map<String, Integer> gotos;
        private final TokenSource.Selection selection;
        private final List<String> expected;

        public State(int index, Map<String, Action> actions,
                     Map<String, Integer> gotos,
                     TokenSource.Selection selection) {
            this.index = index;
            this.actions = Collections.unmodifiableMap(actions);
            this.gotos = Collections.unmodifiableMap(gotos);
            this.selection = selection;
            this.expected = Collections.unmodifiableList(
                new ArrayList<String>(new TreeSet<String>(actions.keySet())));
        }

        public String toString() {
            return String.format("%s@%h[index=%s,actions=%s,gotos=%s]",
                getClass().getName(), this, index, actions, gotos);
        }

        public int getIndex() {
            return index;
        }

        /**
         * The action for the given terminal, or null if it is unexpected.
         */
        public Action getAction(String terminal) {
            return actions.get(terminal);
        }

        public Map<String, Action> getActions() {
            return actions;
        }

        public int getGoto(String nonterminal) {
            Integer ret = gotos.get(nonterminal);
            if (ret == null)
                throw new IllegalStateException("No transition from state " +
                    index + " on " + nonterminal);
            return ret;
        }

        public TokenSource.Selection getSelection() {
            return selection;
        }

        /**
         * The names of the terminals acceptable in this state, sorted.
         */
        public List<String> getExpected() {
            return expected;
        }

    }

    private final List<State> states;
    private final List<Rule> rules;
    private final Map<String, Integer> startStates;

    public ParseTable(List<State> states, List<Rule> rules,
                      Map<String, Integer> startStates) {
        this.states = Collections.unmodifiableList(
            new ArrayList<State>(states));
        this.rules = Collections.unmodifiableList(new ArrayList<Rule>(rules));
        this.startStates = Collections.unmodifiableMap(startStates);
    }

    public String toString() {
        return String.format("%s@%h[states=%s,rules=%s,starts=%s]",
            getClass().getName(), this, states.size(), rules.size(),
            startStates.keySet());
    }

    public List<State> getStates() {
        return states;
    }

    public State getState(int index) {
        return states.get(index);
    }

    public Rule getRule(int index) {
        return rules.get(index);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * The initial state for the named start symbol, or null.
     */
    public State getStartState(String start) {
        Integer ret = startStates.get(start);
        return (ret == null) ? null : states.get(ret);
    }

    public Map<String, Integer> getStartStates() {
        return startStates;
    }

}
