package dev.ionfusion.fuusak.format;

import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.ist.Atom;
import dev.ionfusion.fuusak.ist.AtomicType;
import dev.ionfusion.fuusak.ist.BlockComment;
import dev.ionfusion.fuusak.ist.Clob;
import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.ist.LineComment;
import dev.ionfusion.fuusak.ist.MultilineText;
import dev.ionfusion.fuusak.ist.Newlines;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Nodes;
import dev.ionfusion.fuusak.ist.Sequence;
import dev.ionfusion.fuusak.ist.StructKey;
import dev.ionfusion.fuusak.shared.TextUtil;
import java.util.List;

/**
 * Renders an intermediate syntax tree as text.
 *
 * <p>Output accumulates in one buffer; the current column is recomputed from the buffer when a node
 * needs it. Every node receives the indent its caller wants after a line break, and newline runs are
 * the only nodes that break lines. Trailing whitespace is stripped from every line at the end.
 */
public final class Formatter {
    private final FusionConfig config;
    private final StringBuilder output = new StringBuilder();

    private Formatter(FusionConfig config) {
        this.config = config;
    }

    /**
     * Formats {@code tree} as is; the fix-up pass is the caller's choice.
     */
    public static String render(FusionConfig config, IntermediateSyntaxTree tree) {
        Formatter formatter = new Formatter(config);
        formatter.visitTopLevel(tree.expressions());
        return formatter.finish();
    }

    private String finish() {
        StringBuilder result = new StringBuilder(output.length() + 1);
        for (String line : TextUtil.lines(output.toString())) {
            result.append(line.stripTrailing()).append('\n');
        }
        return result.toString();
    }

    /**
     * Top-level nodes sharing a line stay one space apart so neighbouring atoms never merge.
     */
    private void visitTopLevel(List<Node> nodes) {
        Node previous = null;
        for (Node node : nodes) {
            if (previous != null && !node.isNewlines() && !previous.isNewlines() && !(previous instanceof LineComment)) {
                output.append(' ');
            }
            visit(node, 0);
            previous = node;
        }
    }

    private void visit(Node node, int nextIndent) {
        if (node instanceof Atom atom) {
            visitAtom(atom);
        } else if (node instanceof Clob clob) {
            visitClob(clob, nextIndent);
        } else if (node instanceof BlockComment comment) {
            visitBlockComment(comment);
        } else if (node instanceof LineComment comment) {
            visitLineComment(comment, nextIndent);
        } else if (node instanceof MultilineText text) {
            visitMultilineString(text);
        } else if (node instanceof Newlines newlines) {
            newline(newlines.count(), nextIndent);
        } else if (node instanceof StructKey key) {
            visitStructKey(key);
        } else if (node instanceof Sequence sequence) {
            switch (sequence.kind()) {
                case LIST -> visitList(sequence);
                case SEXPR -> visitSExpr(sequence);
                case STRUCT -> visitStruct(sequence);
                default -> throw new IllegalStateException("Unexpected sequence kind " + sequence.kind());
            }
        } else {
            throw new IllegalStateException("Unexpected node " + node.kind() + " at " + node.span());
        }
    }

    private void visitAnnotations(List<String> annotations) {
        annotations.forEach(output::append);
    }

    private void visitAtom(Atom atom) {
        visitAnnotations(atom.annotations());
        if (atom.type() == AtomicType.QUOTED_STRING) {
            output.append('"').append(atom.value()).append('"');
        } else {
            output.append(atom.value());
        }
    }

    private void visitClob(Clob clob, int nextIndent) {
        visitAnnotations(clob.annotations());
        output.append("{{");

        int continuationIndent = Nodes.countItemsBeforeNewline(clob.parts()) == 0
            ? nextIndent + 1
            : TextUtil.findCursorPos(output) + 1;
        for (Node part : clob.parts()) {
            if (!part.isNewlines() && !TextUtil.alreadyHasWhitespaceBeforeCursor(output)) {
                output.append(' ');
            }
            if (part instanceof Newlines newlines) {
                newline(newlines.count(), continuationIndent);
            } else if (part instanceof MultilineText text) {
                output.append("'''").append(text.value()).append("'''");
            } else if (part instanceof Atom atom) {
                visitAtom(atom);
            } else {
                throw new IllegalStateException("Unexpected clob part " + part.kind());
            }
        }
        if (!TextUtil.alreadyHasWhitespaceBeforeCursor(output)) {
            output.append(' ');
        }
        output.append("}}");
    }

    private void visitBlockComment(BlockComment comment) {
        List<String> lines = comment.lines();
        int continuationIndent = TextUtil.findCursorPos(output) + 1;
        output.append("/*");
        if (lines.size() == 1) {
            output.append(' ').append(lines.get(0).strip()).append(' ');
        } else {
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                boolean blank = line.isBlank();
                if (i > 0 && blank && i == lines.size() - 1) {
                    break;
                } else if (i > 0) {
                    output.append(TextUtil.spaces(continuationIndent)).append('*');
                }
                if (!blank) {
                    output.append(' ');
                }
                output.append(line).append('\n');
            }
            if (TextUtil.lastIsOneOf(output, '\n')) {
                output.append(TextUtil.spaces(continuationIndent));
            }
        }
        output.append("*/");
    }

    private void visitLineComment(LineComment comment, int nextIndent) {
        output.append(comment.value());
        newline(0, nextIndent);
    }

    private void visitMultilineString(MultilineText text) {
        visitAnnotations(text.annotations());
        int continuationIndent = TextUtil.findCursorPos(output);
        output.append("'''");
        String value = config.formatMultilineStringContents()
            ? TextUtil.formatIndentedMultiline(TextUtil.trimIndent(text.value()), continuationIndent)
            : text.value();
        output.append(trimTrailingSpacesAndTabs(value));
        if (TextUtil.lastIsOneOf(output, '\n')) {
            output.append(TextUtil.spaces(continuationIndent));
        }
        output.append("'''");
    }

    private void visitSExpr(Sequence sexpr) {
        visitAnnotations(sexpr.annotations());
        int openingIndent = TextUtil.findCursorPos(output);
        output.append('(');

        List<Node> items = sexpr.items();
        if (!items.isEmpty()) {
            int continuationIndent = Indentation.continuationIndent(config, items, openingIndent);
            boolean[] spaceAfter = bindWhitespace(items);
            for (int i = 0; i < items.size(); i++) {
                visit(items.get(i), continuationIndent);
                if (spaceAfter[i]) {
                    output.append(' ');
                }
            }
        }
        output.append(')');
    }

    /**
     * Decides which s-expression items are followed by a space. A leading {@code |} opens a lambda
     * argument list that is printed tight: {@code (|x y| body)}.
     */
    static boolean[] bindWhitespace(List<Node> items) {
        boolean[] spaceAfter = new boolean[items.size()];
        boolean firstIsArgList = false;
        for (int i = 0; i < items.size(); i++) {
            Node item = items.get(i);
            boolean first = i == 0;
            boolean notLast = i != items.size() - 1;
            if (first && isArgListDelimiter(item)) {
                spaceAfter[i] = false;
                firstIsArgList = true;
            } else if (!first && firstIsArgList && isArgListDelimiter(item)) {
                spaceAfter[i] = true;
            } else {
                boolean nextEndsArgList = notLast && firstIsArgList && isArgListDelimiter(items.get(i + 1));
                spaceAfter[i] = !nextEndsArgList && notLast && !item.isNewlines();
            }
        }
        return spaceAfter;
    }

    private static boolean isArgListDelimiter(Node node) {
        return node.symbolValue().filter("|"::equals).isPresent();
    }

    private void visitList(Sequence list) {
        visitAnnotations(list.annotations());
        output.append('[');
        List<Node> items = list.items();
        if (!items.isEmpty()) {
            int openingIndent = TextUtil.findCursorPos(output) - 1;
            int continuationIndent = openingIndent + 1;
            for (int i = 0; i < items.size(); i++) {
                Node item = items.get(i);
                if (!item.isNewlines() && TextUtil.lastIsOneOf(output, ',')) {
                    output.append(' ');
                }
                if (item.isNewlines() && i == items.size() - 1) {
                    visit(item, openingIndent);
                } else {
                    visit(item, continuationIndent);
                }
                if (item.isValue() && hasValueAfter(items, i)) {
                    output.append(',');
                }
            }
        }
        output.append(']');
    }

    private void visitStructKey(StructKey key) {
        if (!TextUtil.lastIsOneOf(output, '\n')) {
            output.append(' ');
        }
        output.append(key.value()).append(':');
    }

    private void visitStruct(Sequence struct) {
        visitAnnotations(struct.annotations());

        int emptyContinuation = TextUtil.findCursorPos(output);
        int keyContinuation = emptyContinuation + 1;
        int nestedStructContinuation = keyContinuation + 1;
        int valueContinuation = keyContinuation + 3;

        output.append('{');
        List<Node> items = struct.items();
        for (int i = 0; i < items.size(); i++) {
            Node item = items.get(i);
            if (item.isNewlines()) {
                Node next = nextKeyOrValue(items, i);
                if (next == null) {
                    visit(item, emptyContinuation);
                } else if (next.isStructKey()) {
                    visit(item, keyContinuation);
                } else if (next.isStruct()) {
                    visit(item, nestedStructContinuation);
                } else {
                    visit(item, valueContinuation);
                }
            } else {
                if (TextUtil.lastIsOneOf(output, ':', '/') || item.isComment()) {
                    output.append(' ');
                }
                visit(item, 0);
                if (item.isValue() && hasValueAfter(items, i)) {
                    output.append(',');
                }
            }
        }
        if (!TextUtil.lastIsOneOf(output, '{', '}', ' ', '\n')) {
            output.append(' ');
        }
        output.append('}');
    }

    private static Node nextKeyOrValue(List<Node> items, int index) {
        for (int i = index + 1; i < items.size(); i++) {
            Node candidate = items.get(i);
            if (candidate.isValue() || candidate.isStructKey()) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean hasValueAfter(List<Node> items, int index) {
        for (int i = index + 1; i < items.size(); i++) {
            if (items.get(i).isValue()) {
                return true;
            }
        }
        return false;
    }

    private void newline(int count, int indent) {
        output.append("\n".repeat(count)).append(TextUtil.spaces(indent));
    }

    private static String trimTrailingSpacesAndTabs(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '\t')) {
            end--;
        }
        return value.substring(0, end);
    }
}
