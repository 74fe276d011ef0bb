package net.ox.util.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.logging.Level;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.ParsingException;
import net.ox.ast.Ast;
import net.ox.util.LogCapture;
import net.ox.util.config.Configuration;
import net.ox.util.config.DynamicConfiguration;
import org.junit.Test;

public class LALRCompilerTest {

    private static final String AMBIGUOUS =
        "?start : e\n" +
        "?e : e \"+\" e -> add\n" +
        "   | NUMBER\n" +
        "NUMBER : /[0-9]+/\n";

    @Test
    public void testShiftReduceConflictShifts()
            throws InvalidGrammarException, ParsingException {
        LogCapture log = new LogCapture("LALRCompiler");
        CompiledGrammarImpl grammar;
        try {
            grammar = Grammars.compile(Configuration.NULL, AMBIGUOUS);
        } finally {
            log.close();
        }
        assertTrue(log.contains(Level.WARNING, "Shift/reduce conflict"));
        Ast res = (Ast) grammar.createParser().parse("1+2+3");
        assertEquals("(add 1 (add 2 3))", res.getSource());
    }

    @Test
    public void testShiftReduceConflictStrict() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(LALRCompiler.SHIFT_REDUCE_KEY, "error");
        try {
            Grammars.compile(config, AMBIGUOUS);
            fail("Expected the conflict to be an error");
        } catch (InvalidGrammarException exc) {
            assertTrue(exc.getMessage().startsWith("Shift/reduce conflict"));
        }
    }

    @Test
    public void testReduceReduceConflict() {
        try {
            Grammars.compile(Configuration.NULL,
                "start : a | b\n" +
                "a : X\n" +
                "b : X\n" +
                "X : \"x\"\n");
            fail("Expected a reduce/reduce conflict");
        } catch (InvalidGrammarException exc) {
            assertTrue(exc.getMessage().startsWith("Reduce/reduce conflict"));
        }
    }

    @Test
    public void testUnambiguousGrammarIsQuiet()
            throws InvalidGrammarException, ParsingException {
        LogCapture log = new LogCapture("LALRCompiler");
        CompiledGrammarImpl grammar;
        try {
            grammar = Grammars.compile(Configuration.NULL,
                "?start : e\n" +
                "?e : e \"+\" NUMBER -> add\n" +
                "   | NUMBER\n" +
                "NUMBER : /[0-9]+/\n");
        } finally {
            log.close();
        }
        assertFalse(log.contains(Level.WARNING, "conflict"));
        Ast res = (Ast) grammar.createParser().parse("1+2+3");
        assertEquals("(add (add 1 2) 3)", res.getSource());
    }

    @Test
    public void testOptionalsAndRepeats()
            throws InvalidGrammarException, ParsingException {
        CompiledGrammarImpl grammar = Grammars.compile(
            "start : \"[\" [NUMBER (\",\" NUMBER)*] \"]\"\n" +
            "NUMBER : /[0-9]+/\n" +
            "WS : /\\s+/\n" +
            "%ignore WS\n");
        assertEquals("(start)",
                     ((Ast) grammar.createParser().parse("[]")).getSource());
        assertEquals("(start 1 2 3)",
            ((Ast) grammar.createParser().parse("[1, 2, 3]")).getSource());
    }

    @Test
    public void testContextualLexing()
            throws InvalidGrammarException, ParsingException {
        /* "if" is both a keyword and a NAME; which one is expected
         * decides. */
        CompiledGrammarImpl grammar = Grammars.compile(
            "start : \"if\" NAME\n" +
            "NAME : /[a-z]+/\n" +
            "WS : /\\s+/\n" +
            "%ignore WS\n");
        assertEquals("(start if)", ((Ast) grammar.createParser()
                                        .parse("if if")).getSource());
    }

}
