package net.ox.util.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MatchingException;
import net.ox.api.parser.TextLocation;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.ValueTransform;
import org.junit.Test;

public class LexerCompilerTest {

    private static final ValueTransform TO_INT = new ValueTransform() {
        public Object transform(String raw) {
            return Integer.valueOf(raw);
        }
    };

    private static void assertInvalid(LexerCompiler lc, String name,
                                      Object spec) {
        try {
            lc.add(name, spec);
            fail("Expected declaration " + name + " to be rejected");
        } catch (InvalidGrammarException exc) {
            // expected
        }
    }

    @Test
    public void testDeclarationNames() throws InvalidGrammarException {
        LexerCompiler lc = new LexerCompiler()
            .add("NUMBER_2_", "[0-9]+")
            .add("_WS", "\\s+")
            .add("NAME", "[a-z]+");
        assertEquals(Integer.valueOf(2),
                     lc.getRules().get("NUMBER").getPriority());
        assertNull(lc.getRules().get("NAME").getPriority());
        assertTrue(lc.getIgnored().contains("WS"));
        assertEquals(Arrays.asList("NUMBER", "WS", "NAME"),
                     Arrays.asList(lc.getRules().keySet().toArray()));
    }

    @Test
    public void testInvalidDeclarations() throws InvalidGrammarException {
        LexerCompiler lc = new LexerCompiler().add("NAME", "[a-z]+");
        assertInvalid(lc, "lower", "x");
        assertInvalid(lc, "EMPTY", "a*");
        assertInvalid(lc, "BROKEN", "(");
        assertInvalid(lc, "PAIR", new Object[] {"x"});
        assertInvalid(lc, "NAME", "[A-Z]+");
    }

    @Test
    public void testGenerateSource() throws InvalidGrammarException {
        String src = new LexerCompiler()
            .add("NAME", "[a-z]+")
            .add("NUMBER_2_", "[0-9]+")
            .add("_WS", "\\s+")
            .generateSource();
        String[] lines = src.split("\n");
        assertTrue(lines[0].startsWith("NUMBER.2 : "));
        assertTrue(lines[1].startsWith("NAME : "));
        assertEquals("%ignore WS", lines[lines.length - 1]);
    }

    @Test
    public void testLex() throws InvalidGrammarException, MatchingException {
        CompiledLexer lexer = new LexerCompiler()
            .add("NUMBER", new Object[] {"[0-9]+", TO_INT})
            .add("NAME", "[a-z]+")
            .add("_WS", "\\s+")
            .compile();
        List<TokenSource.Token> tokens = lexer.lex("x 12  y");
        assertEquals(3, tokens.size());
        assertEquals("NAME", tokens.get(0).getName());
        assertEquals("x", tokens.get(0).getValue());
        assertEquals("NUMBER", tokens.get(1).getName());
        assertEquals(12, tokens.get(1).getValue());
        assertEquals("12", tokens.get(1).getContent());
        assertEquals("y", tokens.get(2).getContent());
        assertEquals(TO_INT, lexer.getTransform("NUMBER"));
        assertNull(lexer.getTransform("NAME"));
    }

    @Test
    public void testLocations() throws InvalidGrammarException,
                                       MatchingException {
        CompiledLexer lexer = new LexerCompiler()
            .add("NAME", "[a-z]+")
            .add("_WS", "\\s+")
            .compile();
        List<TokenSource.Token> tokens = lexer.lex("a\n  bb\tc");
        assertLocation(1, 1, 0, tokens.get(0).getLocation());
        assertLocation(2, 3, 4, tokens.get(1).getLocation());
        assertLocation(2, 5, 6, tokens.get(1).getEndLocation());
        assertLocation(2, 9, 7, tokens.get(2).getLocation());
    }

    private static void assertLocation(long line, long column, long index,
                                       TextLocation loc) {
        assertEquals(line, loc.getLine());
        assertEquals(column, loc.getColumn());
        assertEquals(index, loc.getCharacterIndex());
    }

    @Test
    public void testTableCompile() throws InvalidGrammarException,
                                          MatchingException {
        Map<String, Object> specs = new LinkedHashMap<String, Object>();
        specs.put("NUMBER", Collections.singletonMap("[0-9]+", TO_INT));
        specs.put("PLUS", "\\+");
        specs.put("SPACE", "\\s+");
        CompiledLexer lexer = LexerCompiler.compile(specs, "SPACE");
        List<TokenSource.Token> tokens = lexer.lex("1 + 2");
        assertEquals(3, tokens.size());
        assertEquals(1, tokens.get(0).getValue());
        assertEquals("PLUS", tokens.get(1).getName());
        assertEquals(2, tokens.get(2).getValue());
        assertEquals(Collections.singleton("SPACE"),
                     lexer.getIgnoredTokens());
    }

    @Test
    public void testLongestMatchWins() throws InvalidGrammarException,
                                              MatchingException {
        CompiledLexer lexer = new LexerCompiler()
            .add("LT", "<")
            .add("LE", "<=")
            .compile();
        List<TokenSource.Token> tokens = lexer.lex("<=<");
        assertEquals(2, tokens.size());
        assertEquals("LE", tokens.get(0).getName());
        assertEquals("LT", tokens.get(1).getName());
    }

    @Test
    public void testPriorityBeatsLength() throws InvalidGrammarException,
                                                 MatchingException {
        CompiledLexer lexer = new LexerCompiler()
            .add("WORD", "[a-z]+")
            .add("IF_1_", "if")
            .compile();
        List<TokenSource.Token> tokens = lexer.lex("iffy");
        assertEquals("IF", tokens.get(0).getName());
        assertEquals("WORD", tokens.get(1).getName());
        assertEquals("fy", tokens.get(1).getContent());
    }

    @Test(expected = MatchingException.class)
    public void testUnexpectedCharacter() throws InvalidGrammarException,
                                                 MatchingException {
        new LexerCompiler().add("NAME", "[a-z]+").compile().lex("abc$");
    }

    @Test(expected = InvalidGrammarException.class)
    public void testIgnoreUndeclared() throws InvalidGrammarException {
        new LexerCompiler().add("NAME", "[a-z]+").ignore("WS").compile();
    }

}
