package com.uplc.decompiler.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renders {@link GeneratedCode} as source text with two-space indentation.
 *
 * Block bodies are laid out from an explicit work stack, so arbitrarily deep block trees
 * format without recursion. The output depends only on the input tree.
 */
public final class CodeFormatter {

    private static final String INDENT = "  ";

    private CodeFormatter() {}

    public static String format(GeneratedCode code) {
        List<String> lines = new ArrayList<>();

        for (String module : code.imports) lines.add("use " + module);
        if (!code.imports.isEmpty()) lines.add("");

        for (GeneratedCode.ConstantDeclaration c : code.constants) {
            lines.add("const " + c.name + " = " + c.value);
        }
        if (!code.constants.isEmpty()) lines.add("");

        for (TypeDefinition t : code.types) {
            formatType(t, lines);
            lines.add("");
        }

        ValidatorBlock v = code.validator;
        lines.add("validator " + v.name + " {");
        for (int i = 0; i < v.handlers.size(); i++) {
            if (i > 0) lines.add("");
            HandlerBlock h = v.handlers.get(i);
            lines.add(INDENT + h.kind + "(" + joinParams(h.params) + ") {");
            formatBlock(h.body, 2, lines);
            lines.add(INDENT + "}");
        }
        lines.add("}");

        return String.join("\n", lines) + "\n";
    }

    /** Lines of one block at the given indentation level. */
    public static String formatBlock(CodeBlock block, int level) {
        List<String> lines = new ArrayList<>();
        formatBlock(block, level, lines);
        return String.join("\n", lines);
    }

    private static void formatType(TypeDefinition t, List<String> lines) {
        lines.add("type " + t.name + " {");
        if (t.kind == TypeDefinition.Kind.ENUM) {
            for (TypeDefinition.Variant variant : t.variants) {
                if (variant.fields.isEmpty()) {
                    lines.add(INDENT + variant.name);
                } else {
                    StringBuilder sb = new StringBuilder(INDENT).append(variant.name).append(" { ");
                    for (int i = 0; i < variant.fields.size(); i++) {
                        if (i > 0) sb.append(", ");
                        sb.append(variant.fields.get(i).name).append(": ").append(variant.fields.get(i).type);
                    }
                    lines.add(sb.append(" }").toString());
                }
            }
        } else {
            for (TypeDefinition.Field f : t.fields) lines.add(INDENT + f.name + ": " + f.type + ",");
        }
        lines.add("}");
    }

    private static String joinParams(List<ParameterInfo> params) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.toString();
    }

    private static final class Item {
        final CodeBlock block;
        final int level;

        Item(CodeBlock block, int level) {
            this.block = block;
            this.level = level;
        }
    }

    private static void formatBlock(CodeBlock root, int rootLevel, List<String> lines) {
        // Items are finished lines (String) or blocks still to lay out.
        Deque<Object> work = new ArrayDeque<>();
        work.push(new Item(root, rootLevel));
        while (!work.isEmpty()) {
            Object o = work.pop();
            if (o instanceof String) {
                lines.add((String) o);
                continue;
            }
            Item item = (Item) o;
            CodeBlock b = item.block;
            int level = item.level;
            String pad = pad(level);
            List<Object> parts = new ArrayList<>();
            switch (b.kind) {
                case EXPRESSION:
                    addText(parts, pad, b.content);
                    break;
                case LET:
                    addText(parts, pad, "let " + b.label + " = " + b.content);
                    break;
                case EXPECT:
                    addText(parts, pad, "expect " + b.content);
                    break;
                case BLOCK:
                    for (CodeBlock c : b.children) parts.add(new Item(c, level));
                    break;
                case WHEN:
                    parts.add(pad + "when " + b.content + " is {");
                    for (CodeBlock.Branch br : b.branches) {
                        String armPad = pad(level + 1);
                        if (isSimple(br.body)) {
                            parts.add(armPad + br.pattern + " -> " + br.body.content);
                        } else {
                            parts.add(armPad + br.pattern + " -> {");
                            parts.add(new Item(br.body, level + 2));
                            parts.add(armPad + "}");
                        }
                    }
                    parts.add(pad + "}");
                    break;
                case IF: {
                    parts.add(pad + "if " + b.label + " {");
                    CodeBlock current = b;
                    while (true) {
                        parts.add(new Item(current.branches.get(0).body, level + 1));
                        CodeBlock otherwise = current.branches.get(1).body;
                        if (otherwise.kind == CodeBlock.Kind.IF) {
                            parts.add(pad + "} else if " + otherwise.label + " {");
                            current = otherwise;
                            continue;
                        }
                        parts.add(pad + "} else {");
                        parts.add(new Item(otherwise, level + 1));
                        parts.add(pad + "}");
                        break;
                    }
                    break;
                }
            }
            for (int i = parts.size() - 1; i >= 0; i--) work.push(parts.get(i));
        }
    }

    private static boolean isSimple(CodeBlock b) {
        return b.kind == CodeBlock.Kind.EXPRESSION && b.content.indexOf('\n') < 0;
    }

    /** Multi-line text keeps its relative layout under the block's indentation. */
    private static void addText(List<Object> parts, String pad, String text) {
        String[] split = text.split("\n", -1);
        for (String line : split) parts.add(line.isEmpty() ? "" : pad + line);
    }

    private static String pad(int level) {
        StringBuilder sb = new StringBuilder(level * INDENT.length());
        for (int i = 0; i < level; i++) sb.append(INDENT);
        return sb.toString();
    }
}
