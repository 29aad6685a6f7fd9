package com.codeaudit.engine;

import com.codeaudit.model.RuleDescriptor;
import com.codeaudit.model.RuleDescriptor.Severity;
import com.codeaudit.rule.checker.CollectionInitializationRule;
import com.codeaudit.rule.checker.ForbiddenSentinelRule;
import com.codeaudit.rule.checker.MalformedInterpolationRule;
import com.codeaudit.rule.checker.UnsafeConcurrentAccessorRule;
import com.codeaudit.syntax.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    @Test
    void shouldIndexRulesByInterestedKind() {
        CollectionInitializationRule collection = new CollectionInitializationRule();
        MalformedInterpolationRule interpolation = new MalformedInterpolationRule();
        RuleRegistry registry = new RuleRegistry().registerAll(List.of(collection, interpolation));

        assertEquals(List.of(collection), registry.rulesFor(NodeKind.OBJECT_CREATION));
        assertEquals(List.of(interpolation), registry.rulesFor(NodeKind.INTERPOLATED_STRING));
        assertTrue(registry.rulesFor(NodeKind.IDENTIFIER).isEmpty());
        assertEquals(List.of("FL0021", "FL0007", "FL0014"),
                registry.supportedRules().stream().map(RuleDescriptor::getId).toList());
    }

    @Test
    void shouldRejectDuplicateRuleId() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(new CollectionInitializationRule());

        assertThrows(IllegalArgumentException.class, () -> registry.register(new CollectionInitializationRule()));
        assertEquals(1, registry.rules().size());
    }

    @Test
    void shouldRejectDuplicateIdEvenWhenDisabled() {
        RuleRegistry registry = new RuleRegistry(Set.of("FL0021"), Map.of());
        assertFalse(registry.register(new CollectionInitializationRule()));

        assertThrows(IllegalArgumentException.class, () -> registry.register(new CollectionInitializationRule()));
    }

    @Test
    void shouldSkipFullyDisabledRule() {
        RuleRegistry registry = new RuleRegistry(Set.of("FL0011"), Map.of())
                .registerAll(List.of(new UnsafeConcurrentAccessorRule(), new ForbiddenSentinelRule()));

        assertFalse(registry.isEnabled("FL0011"));
        assertNull(registry.descriptor("FL0011"));
        assertTrue(registry.rulesFor(NodeKind.INVOCATION).isEmpty());
        assertEquals(1, registry.rules().size());
    }

    @Test
    void shouldKeepRuleWhenOnlySomeDescriptorsAreDisabled() {
        RuleRegistry registry = new RuleRegistry(Set.of("FL0014"), Map.of());

        assertTrue(registry.register(new MalformedInterpolationRule()));
        assertTrue(registry.isEnabled("FL0007"));
        assertFalse(registry.isEnabled("FL0014"));
        assertEquals(1, registry.rulesFor(NodeKind.INTERPOLATED_STRING).size());
    }

    @Test
    void shouldApplySeverityOverrides() {
        RuleRegistry registry = new RuleRegistry(Set.of(), Map.of("FL0021", Severity.ERROR));
        registry.register(new CollectionInitializationRule());

        assertEquals(Severity.ERROR, registry.descriptor("FL0021").getSeverity());
        assertEquals("Style", registry.descriptor("FL0021").getCategory());
    }
}
