package com.codeaudit.engine;

import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleFault;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * 规则引擎：对语法树做一次先序遍历，把每个节点分发给订阅了该节点类型的规则
 * <p>
 * 规则之间互相隔离：每条规则各自返回结果，单条规则抛出的异常只记录为 {@link RuleFault}，
 * 不影响其他规则和后续节点。并行模式下节点按先序切成连续的分段，各分段独立收集结果，
 * 最后按分段顺序合并，因此输出与顺序执行完全一致。
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    // 节点数低于该值时不值得并行
    private static final int MIN_NODES_PER_SEGMENT = 64;

    private final RuleRegistry registry;
    private final Executor executor;
    private final int parallelism;

    public RuleEngine(RuleRegistry registry) {
        this(registry, null, 1);
    }

    public RuleEngine(RuleRegistry registry, Executor executor, int parallelism) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = executor;
        this.parallelism = executor == null ? 1 : Math.max(1, parallelism);
    }

    public Set<RuleDescriptor> supportedRules() {
        return registry.supportedRules();
    }

    /**
     * 分析文档，返回按遍历顺序排列的结果
     */
    public List<Finding> analyze(Document document) {
        return run(document, () -> false).findings();
    }

    /**
     * 分析文档；每访问一个节点前检查 {@code cancelled}，取消时抛出 {@link CancellationException}
     */
    public AnalysisResult run(Document document, BooleanSupplier cancelled) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(cancelled, "cancelled");

        List<SyntaxNode> nodes = document.getTree().nodes();
        RuleContext context = new RuleContext(document);

        int segments = Math.min(parallelism, Math.max(1, nodes.size() / MIN_NODES_PER_SEGMENT));
        if (segments <= 1) {
            Segment segment = new Segment();
            visit(nodes, 0, nodes.size(), context, cancelled, segment);
            return segment.toResult(nodes.size());
        }

        int size = (nodes.size() + segments - 1) / segments;
        List<CompletableFuture<Segment>> futures = new ArrayList<>(segments);
        for (int from = 0; from < nodes.size(); from += size) {
            int start = from;
            int end = Math.min(nodes.size(), from + size);
            futures.add(CompletableFuture.supplyAsync(() -> {
                Segment segment = new Segment();
                visit(nodes, start, end, context, cancelled, segment);
                return segment;
            }, executor));
        }

        Segment merged = new Segment();
        try {
            for (CompletableFuture<Segment> future : futures) {
                Segment segment = future.join();
                merged.findings.addAll(segment.findings);
                merged.faults.addAll(segment.faults);
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        log.debug("文档 {} 分 {} 段并行分析完成，共 {} 个节点", document.getName(), futures.size(), nodes.size());
        return merged.toResult(nodes.size());
    }

    private void visit(List<SyntaxNode> nodes, int from, int to, RuleContext context,
                       BooleanSupplier cancelled, Segment segment) {
        for (int i = from; i < to; i++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("分析已取消: " + context.document().getName());
            }
            SyntaxNode node = nodes.get(i);
            for (CodeRule rule : registry.rulesFor(node.kind())) {
                evaluate(rule, node, context, segment);
            }
        }
    }

    private void evaluate(CodeRule rule, SyntaxNode node, RuleContext context, Segment segment) {
        // 结果列表的遍历同样可能出错，整条规则在该节点上的结果要么全部保留，要么全部作废
        List<Finding> accepted = new ArrayList<>();
        try {
            List<Finding> produced = rule.evaluate(node, context);
            if (produced == null) {
                return;
            }
            for (Finding finding : produced) {
                Objects.requireNonNull(finding, "规则返回了 null 结果");
                RuleDescriptor descriptor = registry.descriptor(finding.getRuleId());
                if (descriptor == null) {
                    log.debug("忽略未启用规则 {} 的结果", finding.getRuleId());
                    continue;
                }
                accepted.add(finding.withSeverity(descriptor.getSeverity()));
            }
        } catch (RuntimeException e) {
            log.warn("规则 {} 在 {} 的节点 {} 处执行出错: {}",
                    rule.name(), context.document().getName(), node.kind(), e.getMessage(), e);
            segment.faults.add(new RuleFault(rule.name(), context.document().getName(),
                    context.tree().spanOf(node), String.valueOf(e.getMessage())));
            return;
        }
        segment.findings.addAll(accepted);
    }

    private static final class Segment {
        private final List<Finding> findings = new ArrayList<>();
        private final List<RuleFault> faults = new ArrayList<>();

        private AnalysisResult toResult(int visitedNodes) {
            return new AnalysisResult(findings, faults, visitedNodes);
        }
    }
}
