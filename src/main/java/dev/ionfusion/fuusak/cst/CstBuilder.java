package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.grammar.FusionGrammar;
import dev.ionfusion.fuusak.grammar.ParseNode;
import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import dev.ionfusion.fuusak.shared.TextUtil;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the concrete syntax tree from the generic parse tree.
 *
 * <p>Atomic values keep their raw source text, so numbers, timestamps and escapes are never
 * re-interpreted. Whitespace without a line break leaves no trace; a line comment consumes its own line
 * break and is therefore followed by a {@code Newlines(1)} node.
 */
public final class CstBuilder {
    private final String source;

    private CstBuilder(String source) {
        this.source = source;
    }

    /**
     * Parses {@code source}; errors are reported against {@code fileName}.
     *
     * @throws FusionException on the first syntax error
     */
    public static List<Expr> parse(String fileName, String source) {
        ParseNode file;
        try {
            file = FusionGrammar.parseFile(source);
        } catch (FusionException ex) {
            throw ex.resolve(fileName, source);
        }
        return new CstBuilder(source).visitAll(file.children());
    }

    private List<Expr> visitAll(List<ParseNode> nodes) {
        List<Expr> exprs = new ArrayList<>();
        for (ParseNode node : nodes) {
            exprs.addAll(visit(node));
        }
        return exprs;
    }

    private List<Expr> visit(ParseNode node) {
        Span span = node.span();
        return switch (node.rule()) {
            case EXPR -> visitExpr(node);
            case NULL -> atomic(ExprKind.NULL, node);
            case BOOLEAN -> atomic(ExprKind.BOOLEAN, node);
            case TIMESTAMP -> atomic(ExprKind.TIMESTAMP, node);
            case REAL -> atomic(ExprKind.REAL, node);
            case INTEGER -> atomic(ExprKind.INTEGER, node);
            case SYMBOL -> atomic(ExprKind.SYMBOL, node);
            case BLOB -> atomic(ExprKind.BLOB, node);
            case SHORT_STRING -> List.of(ValueExpr.of(ExprKind.QUOTED_STRING, span, inner(node, 1)));
            case LONG_STRING -> List.of(ValueExpr.of(ExprKind.MULTILINE_STRING, span, inner(node, 3)));
            case CLOB -> sequence(ExprKind.CLOB, node);
            case STRUCTURE -> sequence(ExprKind.STRUCT, node);
            case STRUCT_MEMBER -> sequence(ExprKind.STRUCT_MEMBER, node);
            case LIST -> sequence(ExprKind.LIST, node);
            case SEXPR -> sequence(ExprKind.SEXPR, node);
            case STRUCT_KEY -> List.of(new TextExpr(ExprKind.STRUCT_KEY, span, node.text(source)));
            case WHITESPACE -> visitWhitespace(node);
            case LINE_COMMENT -> List.of(
                new TextExpr(ExprKind.COMMENT_LINE, span, node.text(source).stripTrailing()),
                new NewlinesExpr(span, 1)
            );
            case BLOCK_COMMENT -> List.of(new BlockCommentExpr(span, blockCommentLines(node.text(source))));
            case FILE, ANNOTATIONS, ANNOTATION, STRING, ANY_COMMENT ->
                throw new IllegalStateException("Unexpected " + node.rule() + " at " + span);
        };
    }

    private List<Expr> visitExpr(ParseNode node) {
        if (node.children().size() == 1) {
            return visit(node.child(0));
        }
        if (node.children().size() != 2) {
            throw new IllegalStateException("Malformed expression at " + node.span());
        }
        List<String> annotations = node.child(0).children().stream()
            .map(annotation -> annotation.text(source))
            .toList();
        return visit(node.child(1)).stream()
            .map(expr -> expr.withAnnotations(annotations))
            .toList();
    }

    private List<Expr> atomic(ExprKind kind, ParseNode node) {
        return List.of(ValueExpr.of(kind, node.span(), node.text(source)));
    }

    private List<Expr> sequence(ExprKind kind, ParseNode node) {
        return List.of(SequenceExpr.of(kind, node.span(), visitAll(node.children())));
    }

    private String inner(ParseNode node, int delimiterLength) {
        String text = node.text(source);
        return text.substring(delimiterLength, text.length() - delimiterLength);
    }

    private List<Expr> visitWhitespace(ParseNode node) {
        int count = TextUtil.countNewlines(node.text(source));
        return count > 0 ? List.of(new NewlinesExpr(node.span(), count)) : List.of();
    }

    /**
     * Strips the comment delimiters, then trims each line and removes one leading {@code *} plus at most
     * one space after it.
     */
    static List<String> blockCommentLines(String comment) {
        String body = comment.substring(2, comment.length() - 2);
        List<String> lines = new ArrayList<>();
        for (String raw : TextUtil.lines(body)) {
            String line = raw.strip();
            if (line.startsWith("*")) {
                line = line.substring(1);
                if (line.startsWith(" ")) {
                    line = line.substring(1);
                }
            }
            lines.add(line);
        }
        return lines;
    }
}
