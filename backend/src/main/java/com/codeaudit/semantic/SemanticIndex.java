package com.codeaudit.semantic;

import com.codeaudit.syntax.SyntaxNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 内存中的语义索引：宿主前端（或测试）在分析前填充，分析期间只读
 * <p>
 * 绑定以节点引用为键，因此改写后仍被新树共享的节点保留原有的语义信息，
 * 新生成的节点没有绑定。
 */
public class SemanticIndex implements SymbolResolver {

    private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();
    private final Map<SyntaxNode, Symbol> symbols = Collections.synchronizedMap(new IdentityHashMap<>());
    private final Map<SyntaxNode, TypeDescriptor> nodeTypes = Collections.synchronizedMap(new IdentityHashMap<>());

    /**
     * 把类型定义登记到类型全集
     */
    public SemanticIndex declare(TypeDescriptor type) {
        TypeDescriptor definition = type.originalDefinition();
        TypeDescriptor previous = types.putIfAbsent(definition.canonicalName(), definition);
        if (previous != null && previous != definition) {
            throw new IllegalArgumentException("类型重复声明: " + definition.canonicalName());
        }
        return this;
    }

    /**
     * 声明并返回一个类型定义
     */
    public TypeDescriptor define(String canonicalName, TypeDescriptor... interfaces) {
        TypeDescriptor type = TypeDescriptor.definition(canonicalName, interfaces);
        declare(type);
        return type;
    }

    public SemanticIndex bindSymbol(SyntaxNode node, Symbol symbol) {
        symbols.put(node, symbol);
        return this;
    }

    public SemanticIndex bindType(SyntaxNode node, TypeDescriptor type) {
        nodeTypes.put(node, type);
        return this;
    }

    @Override
    public Optional<Symbol> resolveSymbol(SyntaxNode node) {
        return Optional.ofNullable(symbols.get(node));
    }

    @Override
    public Optional<TypeDescriptor> typeOf(SyntaxNode expression) {
        TypeDescriptor bound = nodeTypes.get(expression);
        if (bound != null) {
            return Optional.of(bound);
        }
        // 未单独绑定类型时，退回到符号自身的类型
        return resolveSymbol(expression)
                .filter(s -> s.kind() != SymbolKind.METHOD && s.kind() != SymbolKind.CONSTRUCTOR)
                .map(Symbol::type);
    }

    @Override
    public Optional<TypeDescriptor> lookupType(String canonicalName) {
        return Optional.ofNullable(types.get(canonicalName));
    }
}
