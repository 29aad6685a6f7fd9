package com.codeaudit.fix;

import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeaudit.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class SimplifierTest {

    @Test
    void shouldUnwrapNestedParenthesesAroundPrimaryElements() {
        SyntaxNode collection = collectionExpression(List.of(
                expressionElement(parenthesized(parenthesized(identifier("a")))),
                expressionElement(parenthesized(nullLiteral())),
                spreadElement(parenthesized(call(identifier("b"), "ToList")))));

        assertEquals("[a, null, ..b.ToList()]", Simplifier.simplify(collection).toString());
    }

    @Test
    void shouldKeepParenthesesAroundBinaryExpressions() {
        SyntaxNode collection = collectionExpression(List.of(
                expressionElement(parenthesized(binary(identifier("a"), "+", numeric(1))))));

        assertSame(collection, Simplifier.simplify(collection));
    }

    @Test
    void shouldOnlyTouchGivenRegions() {
        SyntaxNode fixed = collectionExpression(List.of(expressionElement(parenthesized(identifier("a")))));
        SyntaxNode untouched = collectionExpression(List.of(expressionElement(parenthesized(identifier("b")))));
        SyntaxTree tree = SyntaxTree.of(block(local("x", fixed), local("y", untouched)));

        SyntaxTree simplified = Simplifier.simplify(tree, List.of(fixed, identifier("stale")));

        assertEquals("{ var x = [a]; var y = [(b)]; }", simplified.text());
        assertTrue(simplified.contains(untouched));
    }
}
