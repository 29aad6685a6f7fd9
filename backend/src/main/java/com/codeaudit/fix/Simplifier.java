package com.codeaudit.fix;

import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 修复后的尽力化简，只作用于被改写的区域
 * <p>
 * 目前去掉元素和展开项外多余的括号；空白由重新渲染统一规范化。
 */
public final class Simplifier {

    // 去掉括号后优先级不变的表达式
    private static final Set<NodeKind> PRIMARY_KINDS = EnumSet.of(
            NodeKind.IDENTIFIER, NodeKind.NUMERIC_LITERAL, NodeKind.STRING_LITERAL,
            NodeKind.TRUE_LITERAL, NodeKind.FALSE_LITERAL, NodeKind.NULL_LITERAL,
            NodeKind.MEMBER_ACCESS, NodeKind.INVOCATION, NodeKind.OBJECT_CREATION,
            NodeKind.COLLECTION_EXPRESSION, NodeKind.PARENTHESIZED, NodeKind.INTERPOLATED_STRING);

    private Simplifier() {
    }

    /**
     * 化简 {@code regions} 中仍属于 {@code tree} 的各个子树
     */
    public static SyntaxTree simplify(SyntaxTree tree, Collection<SyntaxNode> regions) {
        SyntaxTree current = tree;
        for (SyntaxNode region : regions) {
            if (!current.contains(region)) {
                continue;
            }
            SyntaxNode simplified = simplify(region);
            if (simplified != region) {
                current = current.replace(region, simplified);
            }
        }
        return current;
    }

    /**
     * 返回化简后的节点；无变化时返回原实例
     */
    static SyntaxNode simplify(SyntaxNode node) {
        boolean changed = false;
        List<SyntaxNode> children = new ArrayList<>(node.childCount());
        for (SyntaxNode child : node.children()) {
            SyntaxNode simplified = simplify(child);
            changed |= simplified != child;
            children.add(simplified);
        }

        if (isElement(node) && children.get(0).is(NodeKind.PARENTHESIZED)) {
            SyntaxNode unwrapped = unwrap(children.get(0));
            if (unwrapped != children.get(0)) {
                children.set(0, unwrapped);
                changed = true;
            }
        }
        return changed ? node.withChildren(children) : node;
    }

    private static boolean isElement(SyntaxNode node) {
        return node.is(NodeKind.EXPRESSION_ELEMENT) || node.is(NodeKind.SPREAD_ELEMENT);
    }

    private static SyntaxNode unwrap(SyntaxNode parenthesized) {
        SyntaxNode inner = parenthesized;
        while (inner.is(NodeKind.PARENTHESIZED) && PRIMARY_KINDS.contains(inner.child(0).kind())) {
            inner = inner.child(0);
        }
        return inner;
    }
}
