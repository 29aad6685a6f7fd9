package com.codeaudit.rule.checker;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.semantic.Symbol;
import com.codeaudit.semantic.SymbolKind;
import com.codeaudit.semantic.TypeDescriptor;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * FL0021 建议用集合表达式替代显式构造 {@code List<T>}
 * <p>
 * 判断顺序：
 * <ol>
 *   <li>构造的类型必须是 {@code List`1}，否则不报告</li>
 *   <li>无参数且无初始化器：总是报告</li>
 *   <li>有初始化器：元素不超过 10 个且全部是简单表达式时报告</li>
 *   <li>恰好一个参数：参数不是延迟序列变换链（Where/Select/...）时报告，修复时作为展开元素</li>
 * </ol>
 * 其余情况不报告。
 */
@Component
public class CollectionInitializationRule implements CodeRule {

    public static final String RULE_ID = "FL0021";

    static final String LIST_TYPE = "System.Collections.Generic.List`1";

    private static final int MAX_INITIALIZER_ELEMENTS = 10;

    private static final Set<NodeKind> SIMPLE_ELEMENT_KINDS = EnumSet.of(
            NodeKind.NUMERIC_LITERAL, NodeKind.STRING_LITERAL,
            NodeKind.TRUE_LITERAL, NodeKind.FALSE_LITERAL,
            NodeKind.IDENTIFIER, NodeKind.MEMBER_ACCESS);

    // 只按方法名匹配，不核对方法来自哪个库
    private static final Set<String> CHAIN_METHODS = Set.of(
            "Where", "Select", "SelectMany", "OrderBy", "OrderByDescending",
            "GroupBy", "Join", "Skip", "Take", "Distinct", "Union", "Intersect",
            "Except", "Zip", "DefaultIfEmpty");

    static final RuleDescriptor DESCRIPTOR = RuleDescriptor.builder()
            .id(RULE_ID)
            .title("Use collection expression")
            .message("Use collection expression instead of explicit collection creation")
            .severity(Severity.INFO)
            .category("Style")
            .helpLinkUri("https://github.com/Faithlife/FaithlifeAnalyzers/wiki/" + RULE_ID)
            .kind(NodeKind.OBJECT_CREATION)
            .build();

    @Override
    public List<RuleDescriptor> descriptors() {
        return List.of(DESCRIPTOR);
    }

    @Override
    public List<Finding> evaluate(SyntaxNode creation, RuleContext context) {
        if (!isListCreation(creation, context)) {
            return List.of();
        }

        Optional<SyntaxNode> initializer = creation.firstChild(NodeKind.INITIALIZER);
        List<SyntaxNode> arguments = creation.firstChild(NodeKind.ARGUMENT_LIST)
                .map(SyntaxNode::children)
                .orElse(List.of());

        if (arguments.isEmpty() && initializer.isEmpty()) {
            return List.of(context.report(DESCRIPTOR, creation));
        }

        if (initializer.isPresent()) {
            return isSimpleInitializer(initializer.get())
                    ? List.of(context.report(DESCRIPTOR, creation))
                    : List.of();
        }

        if (arguments.size() == 1 && !isChain(arguments.get(0))) {
            return List.of(context.report(DESCRIPTOR, creation));
        }
        return List.of();
    }

    private boolean isListCreation(SyntaxNode creation, RuleContext context) {
        Optional<TypeDescriptor> listType = context.lookupType(LIST_TYPE);
        if (listType.isEmpty()) {
            return false;
        }
        return context.resolver().resolveSymbol(creation)
                .filter(symbol -> symbol.kind() == SymbolKind.CONSTRUCTOR)
                .map(Symbol::containingType)
                .map(TypeDescriptor::originalDefinition)
                .filter(type -> context.resolver().sameType(type, listType.get()))
                .isPresent();
    }

    static boolean isSimpleInitializer(SyntaxNode initializer) {
        return initializer.childCount() <= MAX_INITIALIZER_ELEMENTS
                && initializer.children().stream().allMatch(CollectionInitializationRule::isSimpleElement);
    }

    private static boolean isSimpleElement(SyntaxNode element) {
        return SIMPLE_ELEMENT_KINDS.contains(element.kind());
    }

    /**
     * 最外层调用的方法名属于延迟序列变换时视为变换链
     */
    static boolean isChain(SyntaxNode argument) {
        if (!argument.is(NodeKind.INVOCATION)) {
            return false;
        }
        SyntaxNode callee = argument.child(0);
        return callee.is(NodeKind.MEMBER_ACCESS) && CHAIN_METHODS.contains(callee.text());
    }
}
