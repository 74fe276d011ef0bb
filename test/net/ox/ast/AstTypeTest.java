package net.ox.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import org.junit.Test;

public class AstTypeTest {

    private static final AstType ROOT =
        AstType.root("Sample", Ast.class).build();

    private static final AstType.Factory NO_FACTORY = new AstType.Factory() {
        public Ast create(Object[] args) {
            throw new UnsupportedOperationException();
        }
    };

    @Test
    public void testFieldRoles() {
        AstType t = AstType.node("Op", Tree.class, ROOT)
            .field("op", String.class)
            .field("lhs", Ast.class)
            .field("rhs", Ast.class)
            .field("line", Integer.class)
            .template("{lhs} {op} {rhs}")
            .factory(NO_FACTORY)
            .build();
        assertEquals(AstType.FieldRole.TAG, t.getField("op").getRole());
        assertSame(t.getField("op"), t.getTagField());
        assertEquals(2, t.getChildFields().size());
        assertEquals(AstType.FieldRole.ATTRIBUTE,
                     t.getField("line").getRole());
        assertEquals(3, t.getMinArity());
        assertSame(ROOT, t.getRoot());
        assertEquals("{lhs} {op} {rhs}", t.getTemplate().getSource());
    }

    @Test
    public void testNoTag() {
        AstType t = AstType.node("Pair", Tree.class, ROOT)
            .field("first", Ast.class)
            .field("second", Ast.class)
            .factory(NO_FACTORY)
            .build();
        assertNull(t.getTagField());
        assertNull(t.getTemplate());
    }

    @Test(expected = DeclarationException.class)
    public void testMissingFactory() {
        AstType.node("Broken", Tree.class, ROOT)
            .field("x", Ast.class)
            .build();
    }

    @Test(expected = DeclarationException.class)
    public void testUnknownTemplateField() {
        AstType.node("Broken", Tree.class, ROOT)
            .field("lhs", Ast.class)
            .template("{lhs} + {rhs}")
            .factory(NO_FACTORY)
            .build();
    }

    @Test(expected = DeclarationException.class)
    public void testSplitChildren() {
        AstType.node("Broken", Tree.class, ROOT)
            .field("a", Ast.class)
            .field("b", String.class)
            .field("c", Ast.class)
            .factory(NO_FACTORY)
            .build();
    }

    @Test(expected = DeclarationException.class)
    public void testDuplicateField() {
        AstType.node("Broken", Tree.class, ROOT)
            .field("a", Ast.class)
            .field("a", Ast.class);
    }

    @Test(expected = DeclarationException.class)
    public void testLeafFields() {
        AstType.leaf("Broken", Token.class, ROOT, String.class)
            .field("a", Ast.class)
            .factory(NO_FACTORY)
            .build();
    }

    @Test(expected = DeclarationException.class)
    public void testOrphanType() {
        AstType.node("Broken", Tree.class, null)
            .factory(NO_FACTORY)
            .build();
    }

}
