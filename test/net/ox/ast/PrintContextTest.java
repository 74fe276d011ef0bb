package net.ox.ast;

import static org.junit.Assert.assertEquals;
import net.ox.util.config.DynamicConfiguration;
import org.junit.Test;

public class PrintContextTest {

    @Test
    public void testIndentation() {
        PrintContext ctx = new PrintContext(2);
        assertEquals("", ctx.startLine());
        ctx.indent();
        ctx.indent();
        assertEquals(2, ctx.getLevel());
        assertEquals("    ", ctx.startLine());
        ctx.dedent();
        assertEquals("  ", ctx.startLine());
        ctx.indent(3);
        ctx.dedent(4);
        assertEquals(0, ctx.getLevel());
    }

    @Test(expected = IllegalStateException.class)
    public void testDedentBelowZero() {
        PrintContext ctx = new PrintContext(4);
        ctx.indent();
        ctx.dedent(2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeWidth() {
        new PrintContext(-1);
    }

    @Test
    public void testConfiguredWidth() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(PrintContext.INDENT_KEY, "3");
        assertEquals(3, new PrintContext(config).getIndentWidth());
        assertEquals(PrintContext.DEFAULT_INDENT_WIDTH,
                     new PrintContext().getIndentWidth());
    }

}
