package com.codeaudit.service;

import com.codeaudit.config.AnalyzerProperties;
import com.codeaudit.engine.AnalysisResult;
import com.codeaudit.engine.RuleEngine;
import com.codeaudit.fix.FixService;
import com.codeaudit.model.AnalysisReport;
import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.model.RuleFault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * 批量分析服务：逐个文档运行规则引擎，附加修复方案并汇总报告
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final RuleEngine ruleEngine;
    private final FixService fixService;
    private final AnalyzerProperties properties;

    public AnalysisService(RuleEngine ruleEngine, FixService fixService, AnalyzerProperties properties) {
        this.ruleEngine = ruleEngine;
        this.fixService = fixService;
        this.properties = properties;
    }

    public AnalysisReport analyze(Document document) {
        return analyze(List.of(document));
    }

    public AnalysisReport analyze(List<Document> documents) {
        return analyze(documents, () -> false);
    }

    /**
     * 分析一组文档
     * <p>
     * 文档之间顺序执行，单个文档内部按引擎配置并行。结果数达到 {@code max-findings} 后停止，
     * 报告标记为截断。
     */
    public AnalysisReport analyze(List<Document> documents, BooleanSupplier cancelled) {
        Objects.requireNonNull(documents, "documents");
        int maxFindings = Math.max(0, properties.getMaxFindings());
        log.info("开始分析 {} 个文档，启用规则 {} 条", documents.size(), ruleEngine.supportedRules().size());

        List<String> notices = new ArrayList<>();
        if (documents.isEmpty()) {
            notices.add("没有需要分析的文档。");
        }

        List<Finding> allFindings = new ArrayList<>();
        List<RuleFault> allFaults = new ArrayList<>();
        List<String> analyzed = new ArrayList<>();
        int totalNodes = 0;
        boolean limitReached = false;

        for (Document document : documents) {
            if (limitReached) {
                break;
            }
            AnalysisResult result = ruleEngine.run(document, cancelled);
            analyzed.add(document.getName());
            totalNodes += result.visitedNodes();
            allFaults.addAll(result.faults());

            for (Finding finding : fixService.attachFixes(result.findings(), document)) {
                if (allFindings.size() >= maxFindings) {
                    limitReached = true;
                    break;
                }
                allFindings.add(finding);
            }
        }

        if (limitReached) {
            log.warn("结果数量达到上限 {}，停止进一步分析", maxFindings);
            notices.add("结果数量达到上限 " + maxFindings + "，报告已截断。");
        } else {
            log.info("分析完成，发现 {} 条结果", allFindings.size());
        }
        if (!allFaults.isEmpty()) {
            log.warn("{} 次规则执行出错，详见报告", allFaults.size());
            notices.add(allFaults.size() + " 次规则执行出错，相关节点的结果可能不完整。");
        }

        return AnalysisReport.builder()
                .analysisTime(LocalDateTime.now())
                .totalDocuments(analyzed.size())
                .totalNodes(totalNodes)
                .totalFindings(allFindings.size())
                .errorCount(count(allFindings, Severity.ERROR))
                .warningCount(count(allFindings, Severity.WARNING))
                .infoCount(count(allFindings, Severity.INFO))
                .fixableCount((int) allFindings.stream().filter(Finding::isFixable).count())
                .findings(List.copyOf(allFindings))
                .faults(List.copyOf(allFaults))
                .analyzedDocuments(List.copyOf(analyzed))
                .notices(List.copyOf(notices))
                .limitReached(limitReached)
                .build();
    }

    private static int count(List<Finding> findings, Severity severity) {
        return (int) findings.stream().filter(f -> f.getSeverity() == severity).count();
    }
}
