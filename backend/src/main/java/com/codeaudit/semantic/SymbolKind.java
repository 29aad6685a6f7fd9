package com.codeaudit.semantic;

public enum SymbolKind {
    TYPE, CONSTRUCTOR, METHOD, PROPERTY, FIELD, PARAMETER, LOCAL
}
