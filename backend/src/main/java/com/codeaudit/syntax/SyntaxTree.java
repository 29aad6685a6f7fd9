package com.codeaudit.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 不可变语法树
 * <p>
 * 构造时一次性计算规范化文本、节点区间和父节点索引。{@link #replace} 采用写时复制：
 * 只重建从根到目标节点的路径，其余子树与原树共享。
 */
public final class SyntaxTree {

    private final SyntaxNode root;
    private final String text;
    private final Map<SyntaxNode, SourceSpan> spans;
    private final Map<SyntaxNode, SyntaxNode> parents;
    private final List<SyntaxNode> nodes;

    private SyntaxTree(SyntaxNode root) {
        this.root = Objects.requireNonNull(root, "root");
        IdentityHashMap<SyntaxNode, SourceSpan> spanIndex = new IdentityHashMap<>();
        this.text = SyntaxPrinter.layout(root, spanIndex);
        this.spans = spanIndex;

        IdentityHashMap<SyntaxNode, SyntaxNode> parentIndex = new IdentityHashMap<>();
        List<SyntaxNode> preOrder = new ArrayList<>(spanIndex.size());
        index(root, parentIndex, preOrder);
        this.parents = parentIndex;
        this.nodes = Collections.unmodifiableList(preOrder);
    }

    public static SyntaxTree of(SyntaxNode root) {
        return new SyntaxTree(root);
    }

    private static void index(SyntaxNode node, Map<SyntaxNode, SyntaxNode> parentIndex, List<SyntaxNode> preOrder) {
        preOrder.add(node);
        for (SyntaxNode child : node.children()) {
            parentIndex.put(child, node);
            index(child, parentIndex, preOrder);
        }
    }

    public SyntaxNode root() {
        return root;
    }

    public String text() {
        return text;
    }

    public String text(SourceSpan span) {
        return text.substring(span.start(), span.end());
    }

    /**
     * 全部节点，先序、从左到右
     */
    public List<SyntaxNode> nodes() {
        return nodes;
    }

    public boolean contains(SyntaxNode node) {
        return spans.containsKey(node);
    }

    public SourceSpan spanOf(SyntaxNode node) {
        SourceSpan span = spans.get(node);
        if (span == null) {
            throw new IllegalArgumentException("节点不属于当前语法树: " + node.kind());
        }
        return span;
    }

    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        return Optional.ofNullable(parents.get(node));
    }

    /**
     * 由近及远的祖先节点（不含自身）
     */
    public List<SyntaxNode> ancestors(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        SyntaxNode current = parents.get(node);
        while (current != null) {
            result.add(current);
            current = parents.get(current);
        }
        return result;
    }

    public Optional<SyntaxNode> firstAncestorOrSelf(SyntaxNode node, NodeKind kind) {
        if (node.is(kind)) {
            return Optional.of(node);
        }
        return ancestors(node).stream().filter(a -> a.is(kind)).findFirst();
    }

    /**
     * 区间恰好为 {@code span} 的最外层节点
     */
    public Optional<SyntaxNode> findNode(SourceSpan span) {
        return nodes.stream().filter(n -> spans.get(n).equals(span)).findFirst();
    }

    /**
     * 用 {@code replacement} 替换 {@code target}，返回新树；原树不变
     */
    public SyntaxTree replace(SyntaxNode target, SyntaxNode replacement) {
        if (!contains(target)) {
            throw new IllegalArgumentException("替换目标不属于当前语法树: " + target.kind());
        }
        SyntaxNode current = target;
        SyntaxNode rebuilt = replacement;
        SyntaxNode parent = parents.get(current);
        while (parent != null) {
            rebuilt = parent.replaceChild(current, rebuilt);
            current = parent;
            parent = parents.get(current);
        }
        return new SyntaxTree(rebuilt);
    }

    public boolean isEquivalentTo(SyntaxTree other) {
        return other != null && root.isEquivalentTo(other.root);
    }

    @Override
    public String toString() {
        return text;
    }
}
