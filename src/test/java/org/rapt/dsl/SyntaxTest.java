package org.rapt.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTest {

    @Test
    @DisplayName("Defaults use the standard literals")
    void testDefaults() {
        Syntax syntax = Syntax.defaults();

        assertEquals("\\project", syntax.literal(SyntaxToken.PROJECT));
        assertEquals("_{", syntax.literal(SyntaxToken.PARAMS_START));
        assertEquals("inc⊆", syntax.literal(SyntaxToken.INCLUSION_SUBSUMPTION));
        assertEquals(SyntaxToken.values().length, syntax.literals().size());
    }

    @Test
    @DisplayName("Overrides replace single tokens and leave the rest")
    void testOverride() {
        Syntax syntax = Syntax.builder()
                .override(SyntaxToken.PROJECT, "\\pi")
                .override(SyntaxToken.SELECT, "\\sigma")
                .build();

        assertEquals("\\pi", syntax.literal(SyntaxToken.PROJECT));
        assertEquals("\\sigma", syntax.literal(SyntaxToken.SELECT));
        assertEquals("\\rename", syntax.literal(SyntaxToken.RENAME));
        assertNotEquals(Syntax.defaults(), syntax);
        assertEquals(syntax, syntax.toBuilder().build());
    }

    @Test
    @DisplayName("Properties override tokens by key")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("natural_join", "\\njoin");
        properties.setProperty("terminator", "!");

        Syntax syntax = Syntax.fromProperties(properties);

        assertEquals("\\njoin", syntax.literal(SyntaxToken.NATURAL_JOIN));
        assertEquals("!", syntax.literal(SyntaxToken.TERMINATOR));

        List<Statement> statements = RaParser.parse("alpha \\njoin beta!", syntax, Dialect.EXTENDED);
        assertEquals("(alpha NATURAL_JOIN beta)", statements.get(0).toString());
    }

    @Test
    @DisplayName("Unknown property keys are rejected")
    void testUnknownKey() {
        Properties properties = new Properties();
        properties.setProperty("teleport", "\\beam");

        assertThrows(IllegalArgumentException.class, () -> Syntax.fromProperties(properties));
    }

    @Test
    @DisplayName("Two tokens cannot share a literal")
    void testDuplicateLiteral() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Syntax.builder().override(SyntaxToken.UNION, "\\join").build());
        assertTrue(e.getMessage().contains("share the literal"));
    }

    @Test
    @DisplayName("Literals cannot be empty or contain whitespace")
    void testInvalidLiterals() {
        assertThrows(IllegalArgumentException.class,
                () -> Syntax.builder().override(SyntaxToken.UNION, "").build());
        assertThrows(IllegalArgumentException.class,
                () -> Syntax.builder().override(SyntaxToken.UNION, "\\u nion").build());
    }

    @Test
    @DisplayName("Dialects extend their parent's tokens")
    void testDialects() {
        assertTrue(Dialect.EXTENDED.tokens().containsAll(Dialect.CORE.tokens()));
        assertTrue(Dialect.DEPENDENCY.tokens().containsAll(Dialect.EXTENDED.tokens()));
        assertTrue(Dialect.THREE_VALUED.tokens().containsAll(Dialect.CORE.tokens()));

        assertFalse(Dialect.CORE.supports(SyntaxToken.NATURAL_JOIN));
        assertFalse(Dialect.CORE.supports(SyntaxToken.DEFINED));
        assertTrue(Dialect.THREE_VALUED.supports(SyntaxToken.DEFINED));
        assertFalse(Dialect.THREE_VALUED.supports(SyntaxToken.INTERSECT));
        assertFalse(Dialect.EXTENDED.supports(SyntaxToken.PRIMARY_KEY));
        assertEquals(Dialect.EXTENDED, Dialect.DEPENDENCY.parent());
    }
}
