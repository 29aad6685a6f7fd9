package com.codeaudit.semantic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 类型描述符
 * <p>
 * 按引用比较：同一个类型在类型全集中只有一个定义实例；构造出的泛型实例
 * （如 {@code List<int>}）通过 {@link #originalDefinition()} 指回定义（{@code List`1}）。
 */
public final class TypeDescriptor {

    private final String canonicalName;
    private final TypeDescriptor definition;
    private final List<TypeDescriptor> typeArguments;
    private final List<TypeDescriptor> interfaces;

    private TypeDescriptor(String canonicalName, TypeDescriptor definition,
                           List<TypeDescriptor> typeArguments, List<TypeDescriptor> interfaces) {
        this.canonicalName = Objects.requireNonNull(canonicalName, "canonicalName");
        this.definition = definition;
        this.typeArguments = List.copyOf(typeArguments);
        this.interfaces = List.copyOf(interfaces);
    }

    /**
     * 声明一个类型定义
     *
     * @param canonicalName 规范名称，泛型定义带元数 {@code `N} 后缀
     * @param interfaces    直接实现的接口
     */
    public static TypeDescriptor definition(String canonicalName, TypeDescriptor... interfaces) {
        return new TypeDescriptor(canonicalName, null, List.of(), List.of(interfaces));
    }

    /**
     * 以给定类型实参构造泛型实例；每次调用产生新的实例
     */
    public TypeDescriptor construct(TypeDescriptor... arguments) {
        if (definition != null) {
            throw new IllegalStateException("只能从泛型定义构造实例: " + this);
        }
        return new TypeDescriptor(canonicalName, this, List.of(arguments), interfaces);
    }

    public String canonicalName() {
        return canonicalName;
    }

    public TypeDescriptor originalDefinition() {
        return definition == null ? this : definition;
    }

    public List<TypeDescriptor> typeArguments() {
        return typeArguments;
    }

    public List<TypeDescriptor> interfaces() {
        return interfaces;
    }

    /**
     * 传递闭包意义上实现的全部接口
     */
    public Set<TypeDescriptor> allInterfaces() {
        Set<TypeDescriptor> result = new LinkedHashSet<>();
        List<TypeDescriptor> pending = new ArrayList<>(interfaces);
        while (!pending.isEmpty()) {
            TypeDescriptor next = pending.remove(0);
            if (result.add(next)) {
                pending.addAll(next.interfaces);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return canonicalName;
        }
        int tick = canonicalName.indexOf('`');
        String base = tick < 0 ? canonicalName : canonicalName.substring(0, tick);
        return base + typeArguments.stream().map(TypeDescriptor::toString).toList().toString()
                .replace('[', '<').replace(']', '>');
    }
}
