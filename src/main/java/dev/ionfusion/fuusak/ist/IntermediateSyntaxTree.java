package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.cst.Expr;
import java.util.List;

/**
 * Root of the intermediate syntax tree: the top-level nodes of one file.
 */
public record IntermediateSyntaxTree(List<Node> expressions) {
    public IntermediateSyntaxTree {
        expressions = List.copyOf(expressions);
    }

    public static IntermediateSyntaxTree fromCst(List<Expr> cst) {
        return new IntermediateSyntaxTree(Lowering.lowerAll(cst));
    }
}
