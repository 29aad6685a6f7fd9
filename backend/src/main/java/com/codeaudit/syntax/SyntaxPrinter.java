package com.codeaudit.syntax;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把语法树渲染为规范化源码文本，并记录每个节点在文本中的区间
 * <p>
 * 空白统一由这里决定，因此重新渲染即完成空白规范化。
 */
public final class SyntaxPrinter {

    private final StringBuilder out = new StringBuilder();
    private final Map<SyntaxNode, SourceSpan> spans;

    private SyntaxPrinter(Map<SyntaxNode, SourceSpan> spans) {
        this.spans = spans;
    }

    public static String print(SyntaxNode node) {
        SyntaxPrinter printer = new SyntaxPrinter(null);
        printer.write(node);
        return printer.out.toString();
    }

    /**
     * 渲染并把各节点区间写入 {@code spans}
     */
    static String layout(SyntaxNode root, IdentityHashMap<SyntaxNode, SourceSpan> spans) {
        SyntaxPrinter printer = new SyntaxPrinter(spans);
        printer.write(root);
        return printer.out.toString();
    }

    private void write(SyntaxNode node) {
        int start = out.length();
        render(node);
        if (spans != null && spans.put(node, new SourceSpan(start, out.length())) != null) {
            throw new IllegalStateException("同一节点实例在树中出现了多次: " + node.kind());
        }
    }

    private void render(SyntaxNode node) {
        List<SyntaxNode> c = node.children();
        switch (node.kind()) {
            case COMPILATION_UNIT -> join(c, "\n");
            case USING_DIRECTIVE -> out.append("using ").append(node.text()).append(';');
            case CLASS_DECLARATION -> {
                out.append("class ").append(node.text()).append(" {");
                for (SyntaxNode member : c) {
                    out.append(' ');
                    write(member);
                }
                out.append(" }");
            }
            case METHOD_DECLARATION -> {
                // 子节点: 返回类型, 参数列表, 方法体
                write(c.get(0));
                out.append(' ').append(node.text());
                write(c.get(1));
                out.append(' ');
                write(c.get(2));
            }
            case PARAMETER_LIST, ARGUMENT_LIST -> {
                out.append('(');
                join(c, ", ");
                out.append(')');
            }
            case PARAMETER -> {
                write(c.get(0));
                out.append(' ').append(node.text());
            }
            case TYPE, IDENTIFIER, NUMERIC_LITERAL, INTERPOLATED_TEXT -> out.append(node.text());
            case BLOCK -> {
                out.append('{');
                for (SyntaxNode statement : c) {
                    out.append(' ');
                    write(statement);
                }
                out.append(" }");
            }
            case LOCAL_DECLARATION -> {
                out.append("var ").append(node.text()).append(" = ");
                write(c.get(0));
                out.append(';');
            }
            case EXPRESSION_STATEMENT -> {
                write(c.get(0));
                out.append(';');
            }
            case RETURN_STATEMENT -> {
                out.append("return");
                if (!c.isEmpty()) {
                    out.append(' ');
                    write(c.get(0));
                }
                out.append(';');
            }
            case OBJECT_CREATION -> {
                // 子节点: 类型, [参数列表], [初始化器]
                out.append("new ");
                for (SyntaxNode part : c) {
                    if (part.is(NodeKind.INITIALIZER)) {
                        out.append(' ');
                    }
                    write(part);
                }
            }
            case INITIALIZER -> {
                out.append('{');
                if (!c.isEmpty()) {
                    out.append(' ');
                    join(c, ", ");
                }
                out.append(" }");
            }
            case INVOCATION -> {
                write(c.get(0));
                write(c.get(1));
            }
            case MEMBER_ACCESS -> {
                write(c.get(0));
                out.append('.').append(node.text());
            }
            case CONDITIONAL_ACCESS -> {
                write(c.get(0));
                out.append("?.").append(node.text());
            }
            case STRING_LITERAL -> out.append('"').append(node.text()).append('"');
            case TRUE_LITERAL -> out.append("true");
            case FALSE_LITERAL -> out.append("false");
            case NULL_LITERAL -> out.append("null");
            case BINARY -> {
                write(c.get(0));
                out.append(' ').append(node.text()).append(' ');
                write(c.get(1));
            }
            case LAMBDA -> {
                out.append(node.text()).append(" => ");
                write(c.get(0));
            }
            case PARENTHESIZED -> {
                out.append('(');
                write(c.get(0));
                out.append(')');
            }
            case INTERPOLATED_STRING -> {
                out.append("$\"");
                c.forEach(this::write);
                out.append('"');
            }
            case INTERPOLATION -> {
                out.append('{');
                write(c.get(0));
                out.append('}');
            }
            case COLLECTION_EXPRESSION -> {
                out.append('[');
                join(c, ", ");
                out.append(']');
            }
            case EXPRESSION_ELEMENT -> write(c.get(0));
            case SPREAD_ELEMENT -> {
                out.append("..");
                write(c.get(0));
            }
            default -> throw new IllegalStateException("未知节点类型: " + node.kind());
        }
    }

    private void join(List<SyntaxNode> nodes, String separator) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            write(nodes.get(i));
        }
    }
}
