package com.codeaudit.model;

/**
 * 目标文件的语言版本配置，由宿主的项目/构建配置决定
 */
public record LanguageOptions(int languageVersion) {

    /** 集合表达式（{@code [a, ..b]}）从该版本起可用 */
    public static final int COLLECTION_EXPRESSIONS_VERSION = 12;

    public static LanguageOptions of(int languageVersion) {
        return new LanguageOptions(languageVersion);
    }

    public boolean supportsCollectionExpressions() {
        return languageVersion >= COLLECTION_EXPRESSIONS_VERSION;
    }
}
