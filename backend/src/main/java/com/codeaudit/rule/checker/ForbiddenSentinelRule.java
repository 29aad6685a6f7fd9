package com.codeaudit.rule.checker;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.semantic.Symbol;
import com.codeaudit.semantic.SymbolKind;
import com.codeaudit.semantic.SymbolResolver;
import com.codeaudit.semantic.TypeDescriptor;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * FL0008 方法已能拿到 IWorkState 时禁止使用 {@code WorkState.None} / {@code WorkState.ToDo}
 * <p>
 * 以下任一成立即视为"已能拿到"：
 * <ul>
 *   <li>所在方法返回 {@code IEnumerable<AsyncAction>}</li>
 *   <li>所在方法有类型为 IWorkState、CancellationToken、AsyncMethodContext 或实现了 IWorkState 的参数</li>
 * </ul>
 */
@Component
public class ForbiddenSentinelRule implements CodeRule {

    public static final String RULE_ID = "FL0008";

    static final String WORK_STATE_INTERFACE = "Libronix.Utility.Threading.IWorkState";
    static final String WORK_STATE_TYPE = "Libronix.Utility.Threading.WorkState";
    static final String ASYNC_ACTION_TYPE = "Libronix.Utility.Threading.AsyncAction";
    static final String ASYNC_METHOD_CONTEXT_TYPE = "Libronix.Utility.Threading.AsyncMethodContext";
    static final String CANCELLATION_TOKEN_TYPE = "System.Threading.CancellationToken";
    static final String ENUMERABLE_TYPE = "System.Collections.Generic.IEnumerable`1";

    private static final Set<String> SENTINEL_NAMES = Set.of("None", "ToDo");

    static final RuleDescriptor DESCRIPTOR = RuleDescriptor.builder()
            .id(RULE_ID)
            .title("WorkState.None and WorkState.ToDo Usage")
            .message("WorkState.None and WorkState.ToDo must not be used when an IWorkState is available.")
            .severity(Severity.ERROR)
            .category("Usage")
            .helpLinkUri("https://github.com/Faithlife/FaithlifeAnalyzers/wiki/" + RULE_ID)
            .kind(NodeKind.MEMBER_ACCESS)
            .build();

    @Override
    public List<RuleDescriptor> descriptors() {
        return List.of(DESCRIPTOR);
    }

    @Override
    public List<Finding> evaluate(SyntaxNode access, RuleContext context) {
        if (!SENTINEL_NAMES.contains(access.text())) {
            return List.of();
        }

        Optional<TypeDescriptor> workStateInterface = context.lookupType(WORK_STATE_INTERFACE);
        Optional<TypeDescriptor> workState = context.lookupType(WORK_STATE_TYPE);
        if (workStateInterface.isEmpty() || workState.isEmpty()) {
            return List.of();
        }

        boolean sentinel = context.resolver().resolveSymbol(access)
                .filter(symbol -> symbol.kind() == SymbolKind.PROPERTY)
                .filter(symbol -> symbol.isDeclaredOn(workState.get(), context.resolver()))
                .map(Symbol::name)
                .filter(SENTINEL_NAMES::contains)
                .isPresent();
        if (!sentinel) {
            return List.of();
        }

        Optional<SyntaxNode> method = context.tree().ancestors(access).stream()
                .filter(ancestor -> ancestor.is(NodeKind.METHOD_DECLARATION))
                .findFirst();
        if (method.isEmpty()) {
            return List.of();
        }

        if (returnsAsyncActions(method.get(), context)
                || hasWorkStateParameter(method.get(), workStateInterface.get(), context)) {
            return List.of(context.report(DESCRIPTOR, access));
        }
        return List.of();
    }

    private boolean returnsAsyncActions(SyntaxNode method, RuleContext context) {
        Optional<TypeDescriptor> enumerable = context.lookupType(ENUMERABLE_TYPE);
        Optional<TypeDescriptor> asyncAction = context.lookupType(ASYNC_ACTION_TYPE);
        if (enumerable.isEmpty() || asyncAction.isEmpty()) {
            return false;
        }
        SymbolResolver resolver = context.resolver();
        return resolver.typeOf(method.child(0))
                .filter(type -> resolver.sameType(type.originalDefinition(), enumerable.get()))
                .filter(type -> type.typeArguments().size() == 1)
                .filter(type -> resolver.sameType(type.typeArguments().get(0), asyncAction.get()))
                .isPresent();
    }

    private boolean hasWorkStateParameter(SyntaxNode method, TypeDescriptor workStateInterface, RuleContext context) {
        SymbolResolver resolver = context.resolver();
        Optional<TypeDescriptor> cancellationToken = context.lookupType(CANCELLATION_TOKEN_TYPE);
        Optional<TypeDescriptor> asyncMethodContext = context.lookupType(ASYNC_METHOD_CONTEXT_TYPE);

        return method.child(1).children().stream()
                .map(parameter -> resolver.typeOf(parameter.child(0)))
                .flatMap(Optional::stream)
                .anyMatch(type -> resolver.sameType(type, workStateInterface)
                        || cancellationToken.filter(t -> resolver.sameType(type, t)).isPresent()
                        || asyncMethodContext.filter(t -> resolver.sameType(type, t)).isPresent()
                        || type.allInterfaces().stream().anyMatch(i -> resolver.sameType(i, workStateInterface)));
    }
}
