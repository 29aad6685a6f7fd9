package com.codeaudit.service;

import com.codeaudit.config.AnalyzerProperties;
import com.codeaudit.engine.RuleEngine;
import com.codeaudit.engine.RuleRegistry;
import com.codeaudit.fix.CollectionExpressionFixProvider;
import com.codeaudit.fix.FixService;
import com.codeaudit.model.AnalysisReport;
import com.codeaudit.rule.checker.CollectionInitializationRule;
import com.codeaudit.service.ReportExportService.ExportPayload;
import com.codeaudit.support.CodeFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.codeaudit.support.CodeFixtures.inMethod;
import static com.codeaudit.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class ReportExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ReportExportService exportService = new ReportExportService(objectMapper);
    private final CodeFixtures fixtures = new CodeFixtures();

    private AnalysisReport report() {
        AnalyzerProperties properties = new AnalyzerProperties();
        AnalysisService service = new AnalysisService(
                new RuleEngine(new RuleRegistry().registerAll(List.of(new CollectionInitializationRule()))),
                new FixService(List.of(new CollectionExpressionFixProvider(properties))),
                properties);
        return service.analyze(fixtures.document(inMethod(local("xs", fixtures.newIntList()))));
    }

    @Test
    void shouldExportMarkdownGroupedByDocument() {
        ExportPayload payload = exportService.exportMarkdown(report());
        String markdown = new String(payload.content(), StandardCharsets.UTF_8);

        assertTrue(payload.filename().startsWith("code-audit-report-"));
        assertTrue(payload.filename().endsWith(".md"));
        assertTrue(markdown.contains("### `Sample.cs` (1 项)"));
        assertTrue(markdown.contains("**[INFO]** FL0021"));
        assertTrue(markdown.contains("`new List<int>()`"));
        assertTrue(markdown.contains("Use collection expression"));
    }

    @Test
    void shouldExportJsonWithoutSyntaxNodes() throws Exception {
        ExportPayload payload = exportService.exportJson(report());
        JsonNode json = objectMapper.readTree(payload.content());

        assertEquals("application/json;charset=UTF-8", payload.contentType());
        assertEquals(1, json.get("totalFindings").asInt());
        JsonNode finding = json.get("findings").get(0);
        assertEquals("FL0021", finding.get("ruleId").asText());
        assertTrue(finding.get("fixable").asBoolean());
        assertFalse(finding.has("target"));
        assertFalse(finding.has("fix"));
        assertEquals(finding.get("snippet").asText().length(),
                finding.get("span").get("end").asInt() - finding.get("span").get("start").asInt());
    }

    @Test
    void shouldMentionCleanReport() {
        String markdown = exportService.buildMarkdown(AnalysisReport.builder()
                .findings(List.of())
                .analyzedDocuments(List.of("Empty.cs"))
                .build());

        assertTrue(markdown.contains("未发现问题"));
        assertTrue(markdown.contains("- `Empty.cs`"));
    }
}
