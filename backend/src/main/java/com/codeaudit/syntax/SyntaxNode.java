package com.codeaudit.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 不可变语法节点
 * <p>
 * 节点只持有类型、词法文本和有序子节点；父节点、源码区间由所属的 {@link SyntaxTree} 计算。
 * 节点按引用（identity）比较，同一实例可以被改写前后的两棵树共享。
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final String text;
    private final List<SyntaxNode> children;

    public SyntaxNode(NodeKind kind, String text, List<SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
        this.children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
        for (SyntaxNode child : this.children) {
            Objects.requireNonNull(child, "子节点不能为 null: " + kind);
        }
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    /**
     * 词法文本：标识符名、字面量、成员名、运算符等；结构性节点为 null
     */
    public String text() {
        return text;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public Optional<SyntaxNode> firstChild(NodeKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).findFirst();
    }

    public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
        return new SyntaxNode(kind, text, newChildren);
    }

    /**
     * 返回替换了某个直接子节点（按引用匹配）的新节点，其余子节点共享
     */
    public SyntaxNode replaceChild(SyntaxNode oldChild, SyntaxNode newChild) {
        List<SyntaxNode> copy = new ArrayList<>(children);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i) == oldChild) {
                copy.set(i, newChild);
                return new SyntaxNode(kind, text, copy);
            }
        }
        throw new IllegalArgumentException("节点不是 " + kind + " 的直接子节点");
    }

    /**
     * 结构等价：类型、文本、子节点逐一等价
     */
    public boolean isEquivalentTo(SyntaxNode other) {
        if (this == other) {
            return true;
        }
        if (other == null || kind != other.kind || !Objects.equals(text, other.text)
                || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isEquivalentTo(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return SyntaxPrinter.print(this);
    }
}
