package com.codeaudit.fix;

import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.FixProposal;
import com.codeaudit.syntax.SourceSpan;
import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 修复服务：收集可用修复、单条应用、批量应用
 * <p>
 * 修复不抛异常：无法应用的方案（目标已不在树中、与同批次方案区间冲突）被跳过。
 * 同一文档内的修复顺序执行；不同文档各自持有语法树，可以并发修复。
 */
@Service
public class FixService {

    private static final Logger log = LoggerFactory.getLogger(FixService.class);

    private final List<CodeFixProvider> providers;

    public FixService(List<CodeFixProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    /**
     * 结果可用的全部修复方案
     */
    public List<FixProposal> proposedFixes(Finding finding, Document document) {
        List<FixProposal> proposals = new ArrayList<>();
        for (CodeFixProvider provider : providers) {
            if (provider.fixableRuleIds().contains(finding.getRuleId())) {
                proposals.addAll(provider.proposedFixes(finding, document));
            }
        }
        return proposals;
    }

    /**
     * 为每条结果附加第一个可用的修复方案（修复注册阶段）
     */
    public List<Finding> attachFixes(List<Finding> findings, Document document) {
        return findings.stream()
                .map(finding -> proposedFixes(finding, document).stream()
                        .findFirst()
                        .map(finding::withFix)
                        .orElse(finding))
                .toList();
    }

    /**
     * 应用单个修复并化简被改写的区域
     */
    public SyntaxTree apply(SyntaxTree tree, FixProposal proposal) {
        return applyBatch(tree, List.of(proposal));
    }

    /**
     * 批量应用同一次分析产生的修复
     * <p>
     * 按源码顺序处理（起点相同时外层优先）；与已接受方案区间重叠的方案被跳过。
     * 全部应用后统一做一次化简。
     */
    public SyntaxTree applyBatch(SyntaxTree tree, List<FixProposal> proposals) {
        Objects.requireNonNull(tree, "tree");

        List<FixProposal> applicable = new ArrayList<>();
        for (FixProposal proposal : proposals) {
            if (tree.contains(proposal.getTarget())) {
                applicable.add(proposal);
            } else {
                log.debug("修复 {} 的目标已不在语法树中，跳过", proposal.getTitle());
            }
        }
        applicable.sort(Comparator.<FixProposal, SourceSpan>comparing(p -> tree.spanOf(p.getTarget()))
                .thenComparing(FixProposal::getTitle));

        List<FixProposal> accepted = new ArrayList<>();
        List<SourceSpan> taken = new ArrayList<>();
        for (FixProposal proposal : applicable) {
            SourceSpan span = tree.spanOf(proposal.getTarget());
            if (taken.stream().anyMatch(span::overlaps)) {
                log.debug("修复 {} 的区间 {} 与已接受的修复冲突，跳过", proposal.getTitle(), span);
                continue;
            }
            taken.add(span);
            accepted.add(proposal);
        }

        SyntaxTree current = tree;
        List<SyntaxNode> rewritten = new ArrayList<>(accepted.size());
        for (FixProposal proposal : accepted) {
            SyntaxNode replacement = proposal.rewrite();
            current = current.replace(proposal.getTarget(), replacement);
            rewritten.add(replacement);
        }
        if (accepted.size() < proposals.size()) {
            log.info("批量修复: 应用 {} 个，跳过 {} 个", accepted.size(), proposals.size() - accepted.size());
        }
        return Simplifier.simplify(current, rewritten);
    }

    /**
     * 一次性修复文档中给定结果所附带的全部修复
     */
    public Document fixAll(Document document, List<Finding> findings) {
        List<FixProposal> proposals = findings.stream()
                .map(finding -> finding.fixProposal()
                        .or(() -> proposedFixes(finding, document).stream().findFirst()))
                .flatMap(Optional::stream)
                .toList();
        if (proposals.isEmpty()) {
            return document;
        }
        return document.withTree(applyBatch(document.getTree(), proposals));
    }
}
