package com.codeaudit.semantic;

import com.codeaudit.syntax.SyntaxNode;

import java.util.Optional;

/**
 * 符号/类型解析能力，由宿主的编译器前端提供
 * <p>
 * 解析不到时返回空，规则把空结果视为"规则不适用"，而不是错误。
 */
public interface SymbolResolver {

    Optional<Symbol> resolveSymbol(SyntaxNode node);

    /**
     * 表达式或类型节点的静态类型
     */
    Optional<TypeDescriptor> typeOf(SyntaxNode expression);

    /**
     * 按规范名称在已编译程序的类型全集中查找类型，如 {@code System.Collections.Generic.List`1}
     */
    Optional<TypeDescriptor> lookupType(String canonicalName);

    /**
     * 类型同一性比较（按引用，不做结构比较）
     */
    default boolean sameType(TypeDescriptor left, TypeDescriptor right) {
        return left != null && left == right;
    }
}
