package com.codeaudit.syntax;

/**
 * 语法节点类型标签
 * <p>
 * 规则按类型订阅节点，引擎据此把每个节点分发给感兴趣的规则。
 */
public enum NodeKind {

    COMPILATION_UNIT,
    USING_DIRECTIVE,
    CLASS_DECLARATION,
    METHOD_DECLARATION,
    PARAMETER_LIST,
    PARAMETER,
    TYPE,
    BLOCK,
    LOCAL_DECLARATION,
    EXPRESSION_STATEMENT,
    RETURN_STATEMENT,

    OBJECT_CREATION,
    ARGUMENT_LIST,
    INITIALIZER,
    INVOCATION,
    MEMBER_ACCESS,
    CONDITIONAL_ACCESS,
    IDENTIFIER,
    NUMERIC_LITERAL,
    STRING_LITERAL,
    TRUE_LITERAL,
    FALSE_LITERAL,
    NULL_LITERAL,
    BINARY,
    LAMBDA,
    PARENTHESIZED,

    INTERPOLATED_STRING,
    INTERPOLATED_TEXT,
    INTERPOLATION,

    COLLECTION_EXPRESSION,
    EXPRESSION_ELEMENT,
    SPREAD_ELEMENT
}
