package com.codeaudit.engine;

import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.CodeRule;
import com.codeaudit.syntax.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 规则注册表：节点类型 → 按注册顺序排列的规则列表
 * <p>
 * 每个引擎实例持有自己的注册表，不同实例可以启用不同的规则子集。
 * 注册阶段完成后只读，可在多个工作线程间共享。
 */
public class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<NodeKind, List<CodeRule>> rulesByKind = new EnumMap<>(NodeKind.class);
    private final Map<String, RuleDescriptor> descriptors = new LinkedHashMap<>();
    private final List<CodeRule> rules = new ArrayList<>();
    private final Set<String> knownIds = new LinkedHashSet<>();
    private final Set<String> disabledRules;
    private final Map<String, Severity> severityOverrides;

    public RuleRegistry() {
        this(Set.of(), Map.of());
    }

    public RuleRegistry(Collection<String> disabledRules, Map<String, Severity> severityOverrides) {
        this.disabledRules = Set.copyOf(disabledRules);
        this.severityOverrides = Map.copyOf(severityOverrides);
    }

    /**
     * 注册一条规则；全部描述都被禁用的规则不订阅任何节点
     *
     * @return 是否实际启用
     */
    public boolean register(CodeRule rule) {
        for (RuleDescriptor descriptor : rule.descriptors()) {
            if (knownIds.contains(descriptor.getId())) {
                throw new IllegalArgumentException("规则标识重复: " + descriptor.getId());
            }
        }

        List<RuleDescriptor> enabled = new ArrayList<>();
        for (RuleDescriptor descriptor : rule.descriptors()) {
            knownIds.add(descriptor.getId());
            if (!disabledRules.contains(descriptor.getId())) {
                enabled.add(descriptor);
            }
        }
        if (enabled.isEmpty()) {
            log.info("规则 {} 已被禁用", rule.name());
            return false;
        }

        for (RuleDescriptor descriptor : enabled) {
            Severity override = severityOverrides.get(descriptor.getId());
            descriptors.put(descriptor.getId(), override == null ? descriptor : descriptor.withSeverity(override));
        }
        rules.add(rule);
        for (NodeKind kind : rule.interestedKinds()) {
            rulesByKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(rule);
        }
        return true;
    }

    public RuleRegistry registerAll(Collection<? extends CodeRule> candidates) {
        candidates.forEach(this::register);
        return this;
    }

    public List<CodeRule> rulesFor(NodeKind kind) {
        return rulesByKind.getOrDefault(kind, List.of());
    }

    public List<CodeRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * 已启用的规则描述，按注册顺序
     */
    public Set<RuleDescriptor> supportedRules() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(descriptors.values()));
    }

    /**
     * 生效的描述（已应用严重等级覆盖）；未注册或已禁用时返回 null
     */
    public RuleDescriptor descriptor(String ruleId) {
        return descriptors.get(ruleId);
    }

    public boolean isEnabled(String ruleId) {
        return descriptors.containsKey(ruleId);
    }
}
