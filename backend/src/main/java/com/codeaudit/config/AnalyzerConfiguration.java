package com.codeaudit.config;

import com.codeaudit.engine.RuleEngine;
import com.codeaudit.engine.RuleRegistry;
import com.codeaudit.rule.CodeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 规则注册表与引擎装配
 */
@Configuration
public class AnalyzerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfiguration.class);

    @Bean
    public RuleRegistry ruleRegistry(List<CodeRule> rules, AnalyzerProperties properties) {
        RuleRegistry registry = new RuleRegistry(properties.getDisabledRules(), properties.getSeverityOverrides());
        registry.registerAll(rules);
        log.info("加载了 {} 个规则实现, {} 条启用的规则", registry.rules().size(), registry.supportedRules().size());
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(AnalyzerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getEngine().getParallelism()));
    }

    @Bean
    public RuleEngine ruleEngine(RuleRegistry ruleRegistry, ExecutorService analysisExecutor,
                                 AnalyzerProperties properties) {
        return new RuleEngine(ruleRegistry, analysisExecutor, properties.getEngine().getParallelism());
    }
}
