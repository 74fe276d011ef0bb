package net.ox.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class TemplateTest {

    @Test
    public void testParts() {
        Template t = Template.parse("{lhs} {op} {rhs}");
        List<Template.Part> parts = t.getParts();
        assertEquals(5, parts.size());
        assertTrue(parts.get(0).isPlaceholder());
        assertEquals("lhs", parts.get(0).getText());
        assertFalse(parts.get(1).isPlaceholder());
        assertEquals(" ", parts.get(1).getText());
        assertEquals(Arrays.asList("lhs", "op", "rhs"),
                     new ArrayList<String>(t.getFieldNames()));
    }

    @Test
    public void testEscapes() {
        Template t = Template.parse("{{{ name }}}");
        assertEquals(3, t.getParts().size());
        assertEquals("{", t.getParts().get(0).getText());
        assertEquals("name", t.getParts().get(1).getText());
        assertEquals("}", t.getParts().get(2).getText());
    }

    @Test
    public void testRepeatedField() {
        Template t = Template.parse("{x}, {x}");
        assertEquals(1, t.getFieldNames().size());
        assertEquals(3, t.getParts().size());
    }

    @Test(expected = DeclarationException.class)
    public void testUnterminated() {
        Template.parse("{lhs");
    }

    @Test(expected = DeclarationException.class)
    public void testUnbalancedClose() {
        Template.parse("lhs}");
    }

    @Test(expected = DeclarationException.class)
    public void testEmptyPlaceholder() {
        Template.parse("a {} b");
    }

}
