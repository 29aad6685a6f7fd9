package com.codeaudit.fix;

import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.FixProposal;

import java.util.List;
import java.util.Set;

/**
 * 为某些规则的结果提供自动修复
 * <p>
 * 当前文档无法合法应用修复时（如语言版本不支持目标语法）返回空列表，不抛异常。
 */
public interface CodeFixProvider {

    Set<String> fixableRuleIds();

    List<FixProposal> proposedFixes(Finding finding, Document document);
}
