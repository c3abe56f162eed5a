package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.cst.BlockCommentExpr;
import dev.ionfusion.fuusak.cst.Expr;
import dev.ionfusion.fuusak.cst.ExprKind;
import dev.ionfusion.fuusak.cst.NewlinesExpr;
import dev.ionfusion.fuusak.cst.SequenceExpr;
import dev.ionfusion.fuusak.cst.TextExpr;
import dev.ionfusion.fuusak.cst.ValueExpr;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps CST nodes onto IST nodes. Struct members are spliced into their struct, clob contents are
 * narrowed to string parts. A shape the parser never produces is an {@link IllegalStateException}.
 */
final class Lowering {
    private Lowering() {}

    static List<Node> lowerAll(List<Expr> exprs) {
        List<Node> nodes = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            nodes.add(lower(expr));
        }
        return nodes;
    }

    static Node lower(Expr expr) {
        if (expr instanceof ValueExpr value) {
            if (value.kind() == ExprKind.MULTILINE_STRING) {
                return new MultilineText(value.span(), value.annotations(), value.value());
            }
            return new Atom(atomicType(value.kind()), value.span(), value.annotations(), value.value());
        }
        if (expr instanceof NewlinesExpr newlines) {
            return new Newlines(newlines.span(), newlines.count());
        }
        if (expr instanceof BlockCommentExpr comment) {
            return new BlockComment(comment.span(), comment.lines());
        }
        if (expr instanceof TextExpr text && text.kind() == ExprKind.COMMENT_LINE) {
            return new LineComment(text.span(), text.value());
        }
        if (expr instanceof SequenceExpr sequence) {
            return switch (sequence.kind()) {
                case LIST -> new Sequence(NodeKind.LIST, sequence.span(), sequence.annotations(),
                    lowerAll(sequence.items()));
                case SEXPR -> new Sequence(NodeKind.SEXPR, sequence.span(), sequence.annotations(),
                    lowerAll(sequence.items()));
                case STRUCT -> new Sequence(NodeKind.STRUCT, sequence.span(), sequence.annotations(),
                    lowerStructItems(sequence.items()));
                case CLOB -> new Clob(sequence.span(), sequence.annotations(), lowerClobParts(sequence.items()));
                default -> throw unexpected(expr);
            };
        }
        throw unexpected(expr);
    }

    private static List<Node> lowerStructItems(List<Expr> items) {
        List<Node> nodes = new ArrayList<>();
        for (Expr item : items) {
            if (item.kind() == ExprKind.STRUCT_MEMBER) {
                for (Expr part : item.items()) {
                    if (part instanceof TextExpr key && key.kind() == ExprKind.STRUCT_KEY) {
                        nodes.add(new StructKey(key.span(), key.value()));
                    } else {
                        nodes.add(lower(part));
                    }
                }
            } else {
                nodes.add(lower(item));
            }
        }
        return nodes;
    }

    private static List<Node> lowerClobParts(List<Expr> items) {
        List<Node> parts = new ArrayList<>(items.size());
        for (Expr item : items) {
            switch (item.kind()) {
                case QUOTED_STRING, MULTILINE_STRING, NEWLINES -> parts.add(lower(item));
                default -> throw unexpected(item);
            }
        }
        return parts;
    }

    private static AtomicType atomicType(ExprKind kind) {
        return switch (kind) {
            case BLOB -> AtomicType.BLOB;
            case BOOLEAN -> AtomicType.BOOLEAN;
            case INTEGER -> AtomicType.INTEGER;
            case NULL -> AtomicType.NULL;
            case QUOTED_STRING -> AtomicType.QUOTED_STRING;
            case REAL -> AtomicType.REAL;
            case SYMBOL -> AtomicType.SYMBOL;
            case TIMESTAMP -> AtomicType.TIMESTAMP;
            default -> throw new IllegalStateException("Not an atomic kind: " + kind);
        };
    }

    private static IllegalStateException unexpected(Expr expr) {
        return new IllegalStateException("Unexpected " + expr.kind() + " at " + expr.span() + " while lowering");
    }
}
