package com.codeaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 一次分析的汇总报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    /** 分析时间 */
    private LocalDateTime analysisTime;

    /** 分析的文档总数 */
    private int totalDocuments;

    /** 访问的语法节点总数 */
    private int totalNodes;

    /** 结果总数 */
    private int totalFindings;

    /** ERROR 级别数 */
    private int errorCount;

    /** WARNING 级别数 */
    private int warningCount;

    /** INFO 级别数 */
    private int infoCount;

    /** 附带自动修复的结果数 */
    private int fixableCount;

    /** 所有结果 */
    private List<Finding> findings;

    /** 规则执行异常 */
    private List<RuleFault> faults;

    /** 分析的文档列表 */
    private List<String> analyzedDocuments;

    /** 提示信息 */
    private List<String> notices;

    /** 是否因为结果过多达上限而截断 */
    private boolean limitReached;
}
