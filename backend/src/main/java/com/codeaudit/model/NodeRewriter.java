package com.codeaudit.model;

import com.codeaudit.syntax.SyntaxNode;

/**
 * 纯函数：由目标节点计算替换节点，不得修改输入
 */
@FunctionalInterface
public interface NodeRewriter {

    SyntaxNode rewrite(SyntaxNode target);
}
