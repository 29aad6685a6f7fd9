package com.codeaudit.rule;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 分析规则接口
 * <p>
 * 规则只读：不修改语法树，也看不到其他规则的结果。
 */
public interface CodeRule {

    /**
     * 规则名称，用于日志和异常记录
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 本规则可能报告的全部规则描述
     */
    List<RuleDescriptor> descriptors();

    /**
     * 订阅的节点类型，默认为各描述订阅类型的并集
     */
    default Set<NodeKind> interestedKinds() {
        Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
        descriptors().forEach(d -> kinds.addAll(d.getKinds()));
        return kinds;
    }

    /**
     * 检查一个节点，返回零或多条结果
     */
    List<Finding> evaluate(SyntaxNode node, RuleContext context);
}
