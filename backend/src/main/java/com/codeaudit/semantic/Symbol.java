package com.codeaudit.semantic;

import java.util.Objects;

/**
 * 解析后的符号
 *
 * @param name           符号名（构造函数为 ".ctor"）
 * @param kind           符号种类
 * @param containingType 声明该符号的类型，顶层符号为 null
 * @param type           符号的类型（属性/字段/局部变量的类型，方法的返回类型），可为 null
 */
public record Symbol(String name, SymbolKind kind, TypeDescriptor containingType, TypeDescriptor type) {

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static Symbol constructor(TypeDescriptor containingType) {
        return new Symbol(".ctor", SymbolKind.CONSTRUCTOR, containingType, containingType);
    }

    public static Symbol method(TypeDescriptor containingType, String name, TypeDescriptor returnType) {
        return new Symbol(name, SymbolKind.METHOD, containingType, returnType);
    }

    public static Symbol property(TypeDescriptor containingType, String name, TypeDescriptor type) {
        return new Symbol(name, SymbolKind.PROPERTY, containingType, type);
    }

    public static Symbol local(String name, TypeDescriptor type) {
        return new Symbol(name, SymbolKind.LOCAL, null, type);
    }

    /**
     * 声明类型的泛型定义与 {@code candidate} 的定义是否为同一类型，按解析器的类型相等判断
     */
    public boolean isDeclaredOn(TypeDescriptor candidate, SymbolResolver resolver) {
        return containingType != null && candidate != null
                && resolver.sameType(containingType.originalDefinition(), candidate.originalDefinition());
    }
}
