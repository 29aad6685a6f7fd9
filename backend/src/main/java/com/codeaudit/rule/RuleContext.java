package com.codeaudit.rule;

import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.semantic.SymbolResolver;
import com.codeaudit.semantic.TypeDescriptor;
import com.codeaudit.syntax.SourceSpan;
import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;

import java.util.Optional;

/**
 * 规则执行时可见的上下文：当前文档的语法树与解析器
 */
public record RuleContext(Document document) {

    public SyntaxTree tree() {
        return document.getTree();
    }

    public SymbolResolver resolver() {
        return document.getResolver();
    }

    public Optional<TypeDescriptor> lookupType(String canonicalName) {
        return resolver().lookupType(canonicalName);
    }

    /**
     * 按描述在给定节点处生成一条结果
     */
    public Finding report(RuleDescriptor descriptor, SyntaxNode node) {
        SourceSpan span = tree().spanOf(node);
        return Finding.builder()
                .ruleId(descriptor.getId())
                .severity(descriptor.getSeverity())
                .message(descriptor.getMessage())
                .documentName(document.getName())
                .span(span)
                .snippet(tree().text(span))
                .target(node)
                .build();
    }
}
