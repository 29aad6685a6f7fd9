package com.codeaudit.rule.checker;

import com.codeaudit.model.Finding;
import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.rule.RuleContext;
import com.codeaudit.syntax.NodeKind;
import com.codeaudit.syntax.SyntaxNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 插值字符串检查
 * <ul>
 *   <li>FL0014 没有任何插值段的插值字符串</li>
 *   <li>FL0007 紧跟在以 {@code $} 结尾的文本段之后的插值段，多半是误写的 {@code ${...}}</li>
 * </ul>
 */
@Component
public class MalformedInterpolationRule implements CodeRule {

    public static final String DOLLAR_RULE_ID = "FL0007";
    public static final String UNNECESSARY_RULE_ID = "FL0014";

    private static final String STRAY_MARKER = "$";

    static final RuleDescriptor DOLLAR = RuleDescriptor.builder()
            .id(DOLLAR_RULE_ID)
            .title("Unintentional ${} in interpolated strings")
            .message("Avoid using ${} in interpolated strings.")
            .severity(Severity.WARNING)
            .category("Usage")
            .helpLinkUri("https://github.com/Faithlife/FaithlifeAnalyzers/wiki/" + DOLLAR_RULE_ID)
            .kind(NodeKind.INTERPOLATED_STRING)
            .build();

    static final RuleDescriptor UNNECESSARY = RuleDescriptor.builder()
            .id(UNNECESSARY_RULE_ID)
            .title("Unnecessary interpolated string")
            .message("Avoid using an interpolated string where an equivalent literal string exists.")
            .severity(Severity.WARNING)
            .category("Usage")
            .helpLinkUri("https://github.com/Faithlife/FaithlifeAnalyzers/wiki/" + UNNECESSARY_RULE_ID)
            .kind(NodeKind.INTERPOLATED_STRING)
            .build();

    @Override
    public List<RuleDescriptor> descriptors() {
        return List.of(DOLLAR, UNNECESSARY);
    }

    @Override
    public List<Finding> evaluate(SyntaxNode interpolatedString, RuleContext context) {
        List<Finding> findings = new ArrayList<>();

        boolean hasInterpolation = interpolatedString.children().stream()
                .anyMatch(part -> part.is(NodeKind.INTERPOLATION));
        if (!hasInterpolation) {
            findings.add(context.report(UNNECESSARY, interpolatedString));
        }

        boolean afterMarker = false;
        for (SyntaxNode part : interpolatedString.children()) {
            if (part.is(NodeKind.INTERPOLATED_TEXT) && part.text() != null && part.text().endsWith(STRAY_MARKER)) {
                afterMarker = true;
                continue;
            }
            if (afterMarker) {
                findings.add(context.report(DOLLAR, part));
            }
            afterMarker = false;
        }
        return findings;
    }
}
