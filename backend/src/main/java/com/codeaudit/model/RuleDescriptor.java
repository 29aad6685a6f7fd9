package com.codeaudit.model;

import com.codeaudit.syntax.NodeKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * 规则描述：注册后不可变
 */
@Value
@Builder(toBuilder = true)
public class RuleDescriptor {

    /** 规则唯一标识，如 "FL0021" */
    String id;

    /** 规则标题 */
    String title;

    /** 报告消息 */
    String message;

    /** 严重等级: ERROR, WARNING, INFO */
    @With
    Severity severity;

    /** 规则分类（如 "Style"、"Usage"） */
    String category;

    /** 文档链接 */
    String helpLinkUri;

    /** 订阅的节点类型 */
    @Singular
    Set<NodeKind> kinds;

    public enum Severity {
        ERROR, WARNING, INFO
    }
}
