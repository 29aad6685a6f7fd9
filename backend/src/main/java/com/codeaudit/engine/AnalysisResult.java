package com.codeaudit.engine;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleFault;

import java.util.List;

/**
 * 单个文档的分析结果，结果顺序与先序遍历顺序一致
 */
public record AnalysisResult(List<Finding> findings, List<RuleFault> faults, int visitedNodes) {

    public AnalysisResult {
        findings = List.copyOf(findings);
        faults = List.copyOf(faults);
    }
}
