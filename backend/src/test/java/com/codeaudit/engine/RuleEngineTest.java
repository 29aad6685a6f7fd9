package com.codeaudit.engine;

import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.rule.checker.CollectionInitializationRule;
import com.codeaudit.rule.checker.ForbiddenSentinelRule;
import com.codeaudit.rule.checker.MalformedInterpolationRule;
import com.codeaudit.rule.checker.UnsafeConcurrentAccessorRule;
import com.codeaudit.semantic.Symbol;
import com.codeaudit.semantic.TypeDescriptor;
import com.codeaudit.support.CodeFixtures;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.codeaudit.support.CodeFixtures.inMethod;
import static com.codeaudit.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class RuleEngineTest {

    private final CodeFixtures fixtures = new CodeFixtures();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReportFindingsInTraversalOrder() {
        Document document = fixtures.document(inMethod(
                local("a", fixtures.newIntList()),
                local("s", interpolatedString(interpolatedText("x"))),
                local("b", fixtures.intListOf(numeric(1)))));
        RuleEngine engine = new RuleEngine(new RuleRegistry().registerAll(
                List.of(new MalformedInterpolationRule(), new CollectionInitializationRule())));

        List<Finding> findings = engine.analyze(document);

        assertEquals(List.of("FL0021", "FL0014", "FL0021"), findings.stream().map(Finding::getRuleId).toList());
        assertTrue(findings.get(0).getSpan().start() < findings.get(1).getSpan().start());
        assertEquals("Sample.cs", findings.get(0).getDocumentName());
    }

    @Test
    void shouldIsolateFaultyRule() {
        Document document = fixtures.document(inMethod(local("a", fixtures.newIntList())));
        RuleEngine engine = new RuleEngine(new RuleRegistry().registerAll(
                List.of(new ExplodingRule(), new CollectionInitializationRule())));

        AnalysisResult result = engine.run(document, () -> false);

        assertEquals(1, result.findings().size());
        assertEquals("FL0021", result.findings().get(0).getRuleId());
        assertEquals(1, result.faults().size());
        assertEquals("ExplodingRule", result.faults().get(0).ruleName());
        assertEquals("boom", result.faults().get(0).message());
        assertEquals("Sample.cs", result.faults().get(0).documentName());
    }

    @Test
    void shouldKeepFindingsOfEveryOtherRuleWhenOneRuleThrows() {
        TypeDescriptor workStateInterface = fixtures.index.define("Libronix.Utility.Threading.IWorkState");
        TypeDescriptor workState = fixtures.index.define("Libronix.Utility.Threading.WorkState", workStateInterface);
        TypeDescriptor utility = fixtures.index.define("Libronix.Utility.DictionaryUtility");
        TypeDescriptor concurrent = fixtures.index.define("System.Collections.Concurrent.ConcurrentDictionary`2");

        SyntaxNode parameterType = type("IWorkState");
        fixtures.index.bindType(parameterType, workStateInterface);
        SyntaxNode cache = identifier("cache");
        SyntaxNode getOrAdd = member(cache, "GetOrAddValue");
        fixtures.index.bindType(cache, concurrent.construct(fixtures.string, fixtures.int32))
                .bindSymbol(getOrAdd, Symbol.method(utility, "GetOrAddValue", fixtures.int32));
        SyntaxNode sentinel = member(identifier("WorkState"), "None");
        fixtures.index.bindSymbol(sentinel, Symbol.property(workState, "None", workState));

        Document document = fixtures.document(compilationUnit(classDeclaration("C",
                method(type("void"), "M", parameterList(parameter(parameterType, "workState")), block(
                        local("a", fixtures.newIntList()),
                        local("s", interpolatedString(interpolatedText("$"), interpolation(identifier("v")))),
                        local("t", interpolatedString(interpolatedText("plain"))),
                        expressionStatement(invocation(getOrAdd, identifier("key"))),
                        expressionStatement(invocation(identifier("Start"), sentinel)))))));
        RuleEngine engine = new RuleEngine(new RuleRegistry().registerAll(List.of(
                new ExplodingRule(),
                new CollectionInitializationRule(),
                new UnsafeConcurrentAccessorRule(),
                new ForbiddenSentinelRule(),
                new MalformedInterpolationRule())));

        AnalysisResult result = engine.run(document, () -> false);

        assertEquals(List.of("FL0021", "FL0007", "FL0014", "FL0011", "FL0008"),
                result.findings().stream().map(Finding::getRuleId).toList());
        // 一个对象创建、两个插值字符串、两个调用、两个成员访问
        assertEquals(7, result.faults().size());
        assertTrue(result.faults().stream().allMatch(f -> f.ruleName().equals("ExplodingRule")));
    }

    @Test
    void shouldRecordNullFindingAsFault() {
        Document document = fixtures.document(inMethod(
                local("a", fixtures.newIntList()),
                local("t", interpolatedString(interpolatedText("plain")))));
        RuleEngine engine = new RuleEngine(new RuleRegistry().registerAll(List.of(
                new NullFindingRule(), new CollectionInitializationRule(), new MalformedInterpolationRule())));

        AnalysisResult result = engine.run(document, () -> false);

        assertEquals(List.of("FL0021", "FL0014"), result.findings().stream().map(Finding::getRuleId).toList());
        assertEquals(2, result.faults().size());
        assertEquals("NullFindingRule", result.faults().get(0).ruleName());
        assertEquals("规则返回了 null 结果", result.faults().get(0).message());
    }

    @Test
    void shouldStopWhenCancelled() {
        Document document = fixtures.document(inMethod(local("a", fixtures.newIntList())));
        RuleEngine engine = new RuleEngine(new RuleRegistry().registerAll(List.of(new CollectionInitializationRule())));
        AtomicInteger checks = new AtomicInteger();

        assertThrows(CancellationException.class, () -> engine.run(document, () -> checks.incrementAndGet() > 3));
        assertEquals(4, checks.get());
    }

    @Test
    void shouldProduceSameOutputInParallel() {
        List<SyntaxNode> statements = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            statements.add(local("a" + i, i % 2 == 0 ? fixtures.newIntList() : fixtures.intListOf(numeric(i))));
            statements.add(local("s" + i, interpolatedString(interpolatedText("t$"), interpolation(identifier("v")))));
        }
        Document document = fixtures.document(inMethod(statements.toArray(SyntaxNode[]::new)));
        List<CodeRule> rules = List.of(new CollectionInitializationRule(), new MalformedInterpolationRule());

        List<Finding> sequential = new RuleEngine(new RuleRegistry().registerAll(rules)).analyze(document);
        AnalysisResult parallel = new RuleEngine(new RuleRegistry().registerAll(rules), executor, 4)
                .run(document, () -> false);

        assertEquals(600, sequential.size());
        assertEquals(document.getTree().nodes().size(), parallel.visitedNodes());
        assertEquals(describe(sequential), describe(parallel.findings()));
    }

    @Test
    void shouldPropagateCancellationFromParallelSegments() {
        List<SyntaxNode> statements = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            statements.add(local("a" + i, fixtures.newIntList()));
        }
        Document document = fixtures.document(inMethod(statements.toArray(SyntaxNode[]::new)));
        RuleEngine engine = new RuleEngine(
                new RuleRegistry().registerAll(List.of(new CollectionInitializationRule())), executor, 4);

        assertThrows(CancellationException.class, () -> engine.run(document, () -> true));
    }

    @Test
    void shouldStampConfiguredSeverity() {
        Document document = fixtures.document(inMethod(local("a", fixtures.newIntList())));
        RuleRegistry registry = new RuleRegistry(Set.of(), Map.of("FL0021", Severity.WARNING))
                .registerAll(List.of(new CollectionInitializationRule()));

        List<Finding> findings = new RuleEngine(registry).analyze(document);

        assertEquals(Severity.WARNING, findings.get(0).getSeverity());
    }

    @Test
    void shouldDropFindingsOfDisabledDescriptor() {
        Document document = fixtures.document(inMethod(
                local("a", interpolatedString(interpolatedText("plain"))),
                local("b", interpolatedString(interpolatedText("$"), interpolation(identifier("x"))))));
        RuleRegistry registry = new RuleRegistry(Set.of("FL0014"), Map.of())
                .registerAll(List.of(new MalformedInterpolationRule()));

        List<Finding> findings = new RuleEngine(registry).analyze(document);

        assertEquals(List.of("FL0007"), findings.stream().map(Finding::getRuleId).toList());
    }

    @Test
    void shouldRejectMissingDocument() {
        RuleEngine engine = new RuleEngine(new RuleRegistry());

        assertThrows(NullPointerException.class, () -> engine.analyze(null));
    }

    private static List<String> describe(List<Finding> findings) {
        return findings.stream().map(f -> f.getRuleId() + f.getSpan()).toList();
    }

    private static class ExplodingRule implements CodeRule {

        private static final RuleDescriptor DESCRIPTOR = RuleDescriptor.builder()
                .id("TEST0001")
                .title("Exploding")
                .message("always fails")
                .severity(Severity.WARNING)
                .kind(NodeKind.OBJECT_CREATION)
                .kind(NodeKind.INVOCATION)
                .kind(NodeKind.MEMBER_ACCESS)
                .kind(NodeKind.INTERPOLATED_STRING)
                .build();

        @Override
        public List<RuleDescriptor> descriptors() {
            return List.of(DESCRIPTOR);
        }

        @Override
        public List<Finding> evaluate(SyntaxNode node, RuleContext context) {
            throw new IllegalStateException("boom");
        }
    }

    private static class NullFindingRule implements CodeRule {

        private static final RuleDescriptor DESCRIPTOR = RuleDescriptor.builder()
                .id("TEST0002")
                .title("Null finding")
                .message("returns a null element")
                .severity(Severity.INFO)
                .kind(NodeKind.OBJECT_CREATION)
                .kind(NodeKind.INTERPOLATED_STRING)
                .build();

        @Override
        public List<RuleDescriptor> descriptors() {
            return List.of(DESCRIPTOR);
        }

        @Override
        public List<Finding> evaluate(SyntaxNode node, RuleContext context) {
            return Arrays.asList((Finding) null);
        }
    }
}
