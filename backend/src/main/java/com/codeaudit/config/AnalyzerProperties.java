package com.codeaudit.config;

import com.codeaudit.model.LanguageOptions;
import com.codeaudit.model.RuleDescriptor.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 分析器配置，对应 application.yml 中的 {@code code-audit.*}
 */
@Data
@ConfigurationProperties(prefix = "code-audit")
public class AnalyzerProperties {

    /** 未显式指定语言配置的文档所使用的语言版本 */
    private int languageVersion = LanguageOptions.COLLECTION_EXPRESSIONS_VERSION;

    /** 单次分析最多保留的结果数，超过后截断报告 */
    private int maxFindings = 1000;

    /** 禁用的规则标识 */
    private Set<String> disabledRules = new LinkedHashSet<>();

    /** 按规则标识覆盖默认严重等级 */
    private Map<String, Severity> severityOverrides = new LinkedHashMap<>();

    private final Engine engine = new Engine();

    @Data
    public static class Engine {

        /** 单个文档内的并行分段数，1 表示顺序执行 */
        private int parallelism = 1;
    }
}
