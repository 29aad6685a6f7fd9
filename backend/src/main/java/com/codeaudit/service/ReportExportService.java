package com.codeaudit.service;

import com.codeaudit.model.AnalysisReport;
import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleFault;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分析报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(AnalysisReport report) {
        byte[] content = buildMarkdown(report).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "code-audit-report-" + formatFileTs(report.getAnalysisTime()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(AnalysisReport report) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(
                    "code-audit-report-" + formatFileTs(report.getAnalysisTime()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    String buildMarkdown(AnalysisReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# 代码规范审查报告\n\n");
        md.append("**分析时间:** ")
                .append(report.getAnalysisTime() != null ? report.getAnalysisTime() : LocalDateTime.now())
                .append("\n\n");

        if (report.isLimitReached()) {
            md.append("> **警告：分析结果被截断**\n");
            md.append("> 结果数量超过上限，仅保存并展示前 ").append(report.getTotalFindings())
                    .append(" 条。建议缩小分析范围或禁用部分规则。\n\n");
        }

        md.append("## 统计摘要\n");
        md.append("- **文档总数:** ").append(report.getTotalDocuments()).append("\n");
        md.append("- **语法节点总数:** ").append(report.getTotalNodes()).append("\n");
        md.append("- **结果总数:** ").append(report.getTotalFindings())
                .append(" (错误: ").append(report.getErrorCount())
                .append(", 警告: ").append(report.getWarningCount())
                .append(", 提示: ").append(report.getInfoCount())
                .append(")\n");
        md.append("- **可自动修复:** ").append(report.getFixableCount()).append("\n\n");

        List<Finding> findings = report.getFindings() != null ? report.getFindings() : List.of();
        if (findings.isEmpty()) {
            md.append("**未发现问题**\n");
        } else {
            md.append("## 结果详情\n\n");
            for (Map.Entry<String, List<Finding>> entry : groupByDocument(findings).entrySet()) {
                md.append("### `").append(escapeInlineCode(entry.getKey())).append("` (")
                        .append(entry.getValue().size()).append(" 项)\n\n");
                for (Finding f : entry.getValue()) {
                    String severity = f.getSeverity() != null ? f.getSeverity().name() : "UNKNOWN";
                    md.append("**[").append(severity).append("]** ").append(orEmpty(f.getRuleId())).append("\n");
                    md.append("- **位置:** ").append(f.getSpan() != null ? f.getSpan().toString() : "unknown").append("\n");
                    md.append("- **说明:** ").append(orEmpty(f.getMessage())).append("\n");
                    if (notBlank(f.getSnippet())) {
                        md.append("- **匹配内容:** `")
                                .append(escapeInlineCode(f.getSnippet().replace("\n", " ")))
                                .append("`\n");
                    }
                    f.fixProposal().ifPresent(fix ->
                            md.append("- **自动修复:** ").append(fix.getTitle()).append("\n"));
                    md.append("\n");
                }
            }
        }

        List<RuleFault> faults = report.getFaults() != null ? report.getFaults() : List.of();
        if (!faults.isEmpty()) {
            md.append("## 规则执行异常\n\n");
            for (RuleFault fault : faults) {
                md.append("- `").append(escapeInlineCode(fault.ruleName())).append("` @ `")
                        .append(escapeInlineCode(fault.documentName())).append("` ")
                        .append(fault.span()).append(": ").append(orEmpty(fault.message())).append("\n");
            }
            md.append("\n");
        }

        List<String> documents = report.getAnalyzedDocuments() != null ? report.getAnalyzedDocuments() : List.of();
        md.append("## 文档列表\n\n");
        for (String document : documents) {
            md.append("- `").append(escapeInlineCode(document)).append("`\n");
        }
        return md.toString();
    }

    private Map<String, List<Finding>> groupByDocument(List<Finding> findings) {
        Map<String, List<Finding>> grouped = new LinkedHashMap<>();
        for (Finding f : findings) {
            String name = notBlank(f.getDocumentName()) ? f.getDocumentName() : "unknown";
            grouped.computeIfAbsent(name, k -> new ArrayList<>()).add(f);
        }
        return grouped;
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String formatFileTs(LocalDateTime time) {
        LocalDateTime effective = time != null ? time : LocalDateTime.now();
        return effective.format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
