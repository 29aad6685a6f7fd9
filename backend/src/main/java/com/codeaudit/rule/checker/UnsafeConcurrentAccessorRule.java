package com.codeaudit.rule.checker;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.semantic.SymbolKind;
import com.codeaudit.semantic.TypeDescriptor;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * FL0011 {@code DictionaryUtility.GetOrAddValue()} 不是线程安全的，不应作用于 {@code ConcurrentDictionary}
 * <p>
 * 同时识别 {@code dict.GetOrAddValue(...)} 与 {@code dict?.GetOrAddValue(...)}。
 * 不提供自动修复：替换为哪种线程安全写法需要人工判断。
 */
@Component
public class UnsafeConcurrentAccessorRule implements CodeRule {

    public static final String RULE_ID = "FL0011";

    static final String METHOD_NAME = "GetOrAddValue";
    static final String DICTIONARY_UTILITY_TYPE = "Libronix.Utility.DictionaryUtility";
    static final String CONCURRENT_DICTIONARY_TYPE = "System.Collections.Concurrent.ConcurrentDictionary`2";

    static final RuleDescriptor DESCRIPTOR = RuleDescriptor.builder()
            .id(RULE_ID)
            .title("GetOrAddValue() Usage")
            .message("GetOrAddValue() is not threadsafe and should not be used with ConcurrentDictionary; use GetOrAdd() instead.")
            .severity(Severity.WARNING)
            .category("Usage")
            .helpLinkUri("https://github.com/Faithlife/FaithlifeAnalyzers/wiki/" + RULE_ID)
            .kind(NodeKind.INVOCATION)
            .build();

    @Override
    public List<RuleDescriptor> descriptors() {
        return List.of(DESCRIPTOR);
    }

    @Override
    public List<Finding> evaluate(SyntaxNode invocation, RuleContext context) {
        SyntaxNode callee = invocation.child(0);
        if (!callee.is(NodeKind.MEMBER_ACCESS) && !callee.is(NodeKind.CONDITIONAL_ACCESS)) {
            return List.of();
        }
        if (!METHOD_NAME.equals(callee.text())) {
            return List.of();
        }

        Optional<TypeDescriptor> dictionaryUtility = context.lookupType(DICTIONARY_UTILITY_TYPE);
        Optional<TypeDescriptor> concurrentDictionary = context.lookupType(CONCURRENT_DICTIONARY_TYPE);
        if (dictionaryUtility.isEmpty() || concurrentDictionary.isEmpty()) {
            return List.of();
        }

        boolean declaredOnUtility = context.resolver().resolveSymbol(callee)
                .filter(symbol -> symbol.kind() == SymbolKind.METHOD)
                .filter(symbol -> symbol.isDeclaredOn(dictionaryUtility.get(), context.resolver()))
                .isPresent();
        if (!declaredOnUtility) {
            return List.of();
        }

        SyntaxNode receiver = callee.child(0);
        boolean concurrentReceiver = context.resolver().typeOf(receiver)
                .map(TypeDescriptor::originalDefinition)
                .filter(type -> context.resolver().sameType(type, concurrentDictionary.get()))
                .isPresent();
        if (!concurrentReceiver) {
            return List.of();
        }
        return List.of(context.report(DESCRIPTOR, callee));
    }
}
