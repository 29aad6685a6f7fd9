package com.codeaudit.model;

import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.syntax.SourceSpan;
import com.codeaudit.syntax.SyntaxNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Optional;

/**
 * 单条分析结果
 */
@Value
@Builder(toBuilder = true)
public class Finding {

    /** 命中的规则标识 */
    String ruleId;

    /** 严重等级，报告时从规则描述复制 */
    @With
    Severity severity;

    /** 具体描述 */
    String message;

    /** 所在文档 */
    String documentName;

    /** 命中的源码区间 */
    SourceSpan span;

    /** 命中的源码文本 */
    String snippet;

    /** 命中的节点 */
    @JsonIgnore
    SyntaxNode target;

    /** 可选的自动修复方案，由修复注册阶段附加 */
    @With
    @JsonIgnore
    FixProposal fix;

    public Optional<FixProposal> fixProposal() {
        return Optional.ofNullable(fix);
    }

    public boolean isFixable() {
        return fix != null;
    }
}
