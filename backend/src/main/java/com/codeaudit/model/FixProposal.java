package com.codeaudit.model;

import com.codeaudit.syntax.SourceSpan;
import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 针对某条 Finding 的自动修复方案
 * <p>
 * 方案只依赖自身的目标节点，不假设同一批次中的其他方案已被应用。
 */
@Value
@Builder
public class FixProposal {

    /** 展示给用户的标题 */
    @NonNull
    String title;

    /** 同类修复的等价键，批量修复按此归类 */
    String equivalenceKey;

    /** 目标节点在分析时所属树中的区间 */
    @NonNull
    SourceSpan span;

    @JsonIgnore
    @NonNull
    SyntaxNode target;

    @JsonIgnore
    @NonNull
    NodeRewriter rewriter;

    /**
     * 计算替换节点
     */
    public SyntaxNode rewrite() {
        return rewriter.rewrite(target);
    }

    /**
     * 应用到给定树；目标已不在树中时原样返回（幂等）
     */
    public SyntaxTree apply(SyntaxTree tree) {
        if (!tree.contains(target)) {
            return tree;
        }
        return tree.replace(target, rewrite());
    }
}
