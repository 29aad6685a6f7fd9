package com.codeaudit.model;

import com.codeaudit.semantic.SymbolResolver;
import com.codeaudit.syntax.SyntaxTree;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * 一个待分析的文档：语法树 + 语义解析器 + 语言配置
 */
@Value
@Builder
public class Document {

    /** 文档名（通常为相对路径） */
    @NonNull
    String name;

    @With
    @NonNull
    SyntaxTree tree;

    @NonNull
    SymbolResolver resolver;

    /** 为 null 时使用全局配置的语言版本 */
    LanguageOptions options;
}
