package com.codeaudit.model;

import com.codeaudit.syntax.SourceSpan;

/**
 * 规则在某个节点上执行时抛出的意外异常，被引擎隔离后记录于此
 */
public record RuleFault(String ruleName, String documentName, SourceSpan span, String message) {
}
