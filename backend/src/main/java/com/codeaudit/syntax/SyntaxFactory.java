package com.codeaudit.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 构造语法节点的静态工厂，供前端适配层、修复器和测试使用
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
    }

    // ---------- 声明与语句 ----------

    public static SyntaxNode compilationUnit(SyntaxNode... members) {
        return node(NodeKind.COMPILATION_UNIT, null, members);
    }

    public static SyntaxNode usingDirective(String namespace) {
        return new SyntaxNode(NodeKind.USING_DIRECTIVE, namespace, List.of());
    }

    public static SyntaxNode classDeclaration(String name, SyntaxNode... members) {
        return node(NodeKind.CLASS_DECLARATION, name, members);
    }

    public static SyntaxNode method(SyntaxNode returnType, String name, SyntaxNode parameterList, SyntaxNode body) {
        return node(NodeKind.METHOD_DECLARATION, name, returnType, parameterList, body);
    }

    public static SyntaxNode parameterList(SyntaxNode... parameters) {
        return node(NodeKind.PARAMETER_LIST, null, parameters);
    }

    public static SyntaxNode parameter(SyntaxNode type, String name) {
        return node(NodeKind.PARAMETER, name, type);
    }

    public static SyntaxNode type(String displayName) {
        return new SyntaxNode(NodeKind.TYPE, displayName, List.of());
    }

    public static SyntaxNode block(SyntaxNode... statements) {
        return node(NodeKind.BLOCK, null, statements);
    }

    public static SyntaxNode local(String name, SyntaxNode initializer) {
        return node(NodeKind.LOCAL_DECLARATION, name, initializer);
    }

    public static SyntaxNode expressionStatement(SyntaxNode expression) {
        return node(NodeKind.EXPRESSION_STATEMENT, null, expression);
    }

    public static SyntaxNode returnStatement(SyntaxNode expression) {
        return expression == null
                ? node(NodeKind.RETURN_STATEMENT, null)
                : node(NodeKind.RETURN_STATEMENT, null, expression);
    }

    // ---------- 表达式 ----------

    public static SyntaxNode identifier(String name) {
        return new SyntaxNode(NodeKind.IDENTIFIER, name, List.of());
    }

    public static SyntaxNode numeric(String literal) {
        return new SyntaxNode(NodeKind.NUMERIC_LITERAL, literal, List.of());
    }

    public static SyntaxNode numeric(int value) {
        return numeric(Integer.toString(value));
    }

    public static SyntaxNode string(String value) {
        return new SyntaxNode(NodeKind.STRING_LITERAL, value, List.of());
    }

    public static SyntaxNode bool(boolean value) {
        return new SyntaxNode(value ? NodeKind.TRUE_LITERAL : NodeKind.FALSE_LITERAL, null, List.of());
    }

    public static SyntaxNode nullLiteral() {
        return new SyntaxNode(NodeKind.NULL_LITERAL, null, List.of());
    }

    public static SyntaxNode member(SyntaxNode receiver, String name) {
        return node(NodeKind.MEMBER_ACCESS, name, receiver);
    }

    public static SyntaxNode conditionalMember(SyntaxNode receiver, String name) {
        return node(NodeKind.CONDITIONAL_ACCESS, name, receiver);
    }

    public static SyntaxNode argumentList(SyntaxNode... arguments) {
        return node(NodeKind.ARGUMENT_LIST, null, arguments);
    }

    public static SyntaxNode invocation(SyntaxNode callee, SyntaxNode... arguments) {
        return node(NodeKind.INVOCATION, null, callee, argumentList(arguments));
    }

    /**
     * {@code receiver.name(arguments)}
     */
    public static SyntaxNode call(SyntaxNode receiver, String name, SyntaxNode... arguments) {
        return invocation(member(receiver, name), arguments);
    }

    public static SyntaxNode initializer(SyntaxNode... elements) {
        return node(NodeKind.INITIALIZER, null, elements);
    }

    /**
     * {@code new T(arguments)}
     */
    public static SyntaxNode newObject(String typeName, SyntaxNode... arguments) {
        return node(NodeKind.OBJECT_CREATION, null, type(typeName), argumentList(arguments));
    }

    /**
     * {@code new T { elements }}，不带参数列表
     */
    public static SyntaxNode newObjectWithInitializer(String typeName, SyntaxNode... elements) {
        return node(NodeKind.OBJECT_CREATION, null, type(typeName), initializer(elements));
    }

    /**
     * 通用形式：参数列表与初始化器均可为 null
     */
    public static SyntaxNode objectCreation(SyntaxNode type, SyntaxNode argumentList, SyntaxNode initializer) {
        List<SyntaxNode> parts = new ArrayList<>();
        parts.add(type);
        if (argumentList != null) {
            parts.add(argumentList);
        }
        if (initializer != null) {
            parts.add(initializer);
        }
        return new SyntaxNode(NodeKind.OBJECT_CREATION, null, parts);
    }

    public static SyntaxNode binary(SyntaxNode left, String operator, SyntaxNode right) {
        return node(NodeKind.BINARY, operator, left, right);
    }

    public static SyntaxNode lambda(String parameter, SyntaxNode body) {
        return node(NodeKind.LAMBDA, parameter, body);
    }

    public static SyntaxNode parenthesized(SyntaxNode expression) {
        return node(NodeKind.PARENTHESIZED, null, expression);
    }

    public static SyntaxNode interpolatedString(SyntaxNode... parts) {
        return node(NodeKind.INTERPOLATED_STRING, null, parts);
    }

    public static SyntaxNode interpolatedText(String text) {
        return new SyntaxNode(NodeKind.INTERPOLATED_TEXT, text, List.of());
    }

    public static SyntaxNode interpolation(SyntaxNode expression) {
        return node(NodeKind.INTERPOLATION, null, expression);
    }

    public static SyntaxNode collectionExpression(List<SyntaxNode> elements) {
        return new SyntaxNode(NodeKind.COLLECTION_EXPRESSION, null, elements);
    }

    public static SyntaxNode expressionElement(SyntaxNode expression) {
        return node(NodeKind.EXPRESSION_ELEMENT, null, expression);
    }

    public static SyntaxNode spreadElement(SyntaxNode expression) {
        return node(NodeKind.SPREAD_ELEMENT, null, expression);
    }

    private static SyntaxNode node(NodeKind kind, String text, SyntaxNode... children) {
        return new SyntaxNode(kind, text, Arrays.asList(children));
    }
}
