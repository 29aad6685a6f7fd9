package com.codeaudit.semantic;

import com.codeaudit.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import static com.codeaudit.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class SemanticIndexTest {

    private final SemanticIndex index = new SemanticIndex();

    @Test
    void shouldPointConstructedTypesBackToDefinition() {
        TypeDescriptor list = index.define("System.Collections.Generic.List`1");
        TypeDescriptor int32 = index.define("System.Int32");

        TypeDescriptor first = list.construct(int32);
        TypeDescriptor second = list.construct(int32);

        assertNotSame(first, second);
        assertSame(list, first.originalDefinition());
        assertTrue(index.sameType(first.originalDefinition(), second.originalDefinition()));
        assertFalse(index.sameType(first, second));
        assertEquals("System.Collections.Generic.List<System.Int32>", first.toString());
        assertThrows(IllegalStateException.class, () -> first.construct(int32));
    }

    @Test
    void shouldLookUpDeclaredTypesOnly() {
        TypeDescriptor type = index.define("Libronix.Utility.DictionaryUtility");

        assertSame(type, index.lookupType("Libronix.Utility.DictionaryUtility").orElseThrow());
        assertTrue(index.lookupType("Libronix.Utility.Missing").isEmpty());
        assertFalse(index.sameType(null, type));
    }

    @Test
    void shouldRejectConflictingDefinition() {
        index.define("System.String");

        assertThrows(IllegalArgumentException.class, () -> index.define("System.String"));
    }

    @Test
    void shouldCollectInterfacesTransitively() {
        TypeDescriptor base = index.define("IBase");
        TypeDescriptor middle = index.define("IMiddle", base);
        TypeDescriptor concrete = index.define("Concrete", middle);

        assertTrue(concrete.allInterfaces().contains(base));
        assertTrue(concrete.allInterfaces().contains(middle));
        assertEquals(1, concrete.interfaces().size());
    }

    @Test
    void shouldFallBackToSymbolTypeForValues() {
        TypeDescriptor owner = index.define("Owner");
        TypeDescriptor int32 = index.define("System.Int32");
        SyntaxNode property = member(identifier("o"), "Count");
        SyntaxNode method = member(identifier("o"), "Get");

        index.bindSymbol(property, Symbol.property(owner, "Count", int32))
                .bindSymbol(method, Symbol.method(owner, "Get", int32));

        assertSame(int32, index.typeOf(property).orElseThrow());
        assertTrue(index.typeOf(method).isEmpty());
        assertTrue(index.resolveSymbol(identifier("o")).isEmpty());
    }

    @Test
    void shouldPreferExplicitTypeBinding() {
        TypeDescriptor owner = index.define("Owner");
        TypeDescriptor int32 = index.define("System.Int32");
        SyntaxNode local = identifier("x");

        index.bindSymbol(local, Symbol.local("x", owner)).bindType(local, int32);

        assertSame(int32, index.typeOf(local).orElseThrow());
        assertTrue(Symbol.method(owner, "Get", null).isDeclaredOn(owner, index));
        assertFalse(Symbol.local("x", owner).isDeclaredOn(owner, index));
    }
}
