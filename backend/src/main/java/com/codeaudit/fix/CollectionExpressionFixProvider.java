package com.codeaudit.fix;

import com.codeaudit.config.AnalyzerProperties;
import com.codeaudit.model.Document;
import com.codeaudit.model.Finding;
import com.codeaudit.model.FixProposal;
import com.codeaudit.model.LanguageOptions;
import com.codeaudit.rule.checker.CollectionInitializationRule;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxFactory;
import com.codeaudit.syntax.SyntaxNode;
import com.codeaudit.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * FL0021 的修复：把 {@code new List<T>(...)} 改写为集合表达式
 * <ul>
 *   <li>有初始化器：{@code new List<int> { 1, 2 }} → {@code [1, 2]}，元素原样保留顺序</li>
 *   <li>单个参数：{@code new List<int>(items)} → {@code [..items]}</li>
 *   <li>其他：{@code new List<int>()} → {@code []}</li>
 * </ul>
 */
@Component
public class CollectionExpressionFixProvider implements CodeFixProvider {

    private static final Logger log = LoggerFactory.getLogger(CollectionExpressionFixProvider.class);

    public static final String TITLE = "Use collection expression";
    public static final String EQUIVALENCE_KEY = "use-collection-expression";

    private final AnalyzerProperties properties;

    public CollectionExpressionFixProvider(AnalyzerProperties properties) {
        this.properties = properties;
    }

    @Override
    public Set<String> fixableRuleIds() {
        return Set.of(CollectionInitializationRule.RULE_ID);
    }

    @Override
    public List<FixProposal> proposedFixes(Finding finding, Document document) {
        LanguageOptions options = document.getOptions() != null
                ? document.getOptions()
                : LanguageOptions.of(properties.getLanguageVersion());
        if (!options.supportsCollectionExpressions()) {
            log.debug("{} 的语言版本 {} 不支持集合表达式，不提供修复", document.getName(), options.languageVersion());
            return List.of();
        }

        SyntaxTree tree = document.getTree();
        if (finding.getTarget() == null || !tree.contains(finding.getTarget())) {
            return List.of();
        }
        Optional<SyntaxNode> creation = tree.firstAncestorOrSelf(finding.getTarget(), NodeKind.OBJECT_CREATION);
        if (creation.isEmpty()) {
            return List.of();
        }

        return List.of(FixProposal.builder()
                .title(TITLE)
                .equivalenceKey(EQUIVALENCE_KEY)
                .span(tree.spanOf(creation.get()))
                .target(creation.get())
                .rewriter(CollectionExpressionFixProvider::toCollectionExpression)
                .build());
    }

    static SyntaxNode toCollectionExpression(SyntaxNode creation) {
        Optional<SyntaxNode> initializer = creation.firstChild(NodeKind.INITIALIZER);
        if (initializer.isPresent()) {
            return SyntaxFactory.collectionExpression(initializer.get().children().stream()
                    .map(SyntaxFactory::expressionElement)
                    .toList());
        }

        List<SyntaxNode> arguments = creation.firstChild(NodeKind.ARGUMENT_LIST)
                .map(SyntaxNode::children)
                .orElse(List.of());
        if (arguments.size() == 1) {
            return SyntaxFactory.collectionExpression(List.of(SyntaxFactory.spreadElement(arguments.get(0))));
        }
        return SyntaxFactory.collectionExpression(List.of());
    }
}
