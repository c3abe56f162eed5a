package dev.ionfusion.fuusak.format;

import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Nodes;
import java.util.List;
import java.util.Optional;

final class Indentation {
    private static final int SMART_INDENT_NEWLINE_THRESHOLD = 3;

    private Indentation() {}

    static IndentType classify(FusionConfig config, List<Node> items) {
        IndentType type = switch (Nodes.countItemsBeforeNewline(items)) {
            case 0 -> IndentType.END_OF_OPENING;
            case 1 -> IndentType.FIXED;
            default -> IndentType.UNDETERMINED;
        };
        if (items.isEmpty()) {
            return type;
        }

        Node first = items.get(0);
        Optional<String> symbol = first.symbolValue();
        if (symbol.isPresent()) {
            if (type != IndentType.FIXED) {
                type = IndentType.END_OF_OPENING_SYMBOL;
            }
            if (config.fixedIndentSymbols().contains(symbol.get())) {
                type = IndentType.FIXED;
            } else if (config.smartIndentSymbols().contains(symbol.get())
                && type == IndentType.END_OF_OPENING_SYMBOL
                && Nodes.countNewlines(items) > SMART_INDENT_NEWLINE_THRESHOLD) {
                type = IndentType.FIXED;
            }
        } else if (!first.isSExpr()) {
            type = IndentType.END_OF_OPENING;
        } else {
            type = IndentType.FIXED;
        }
        return type;
    }

    /**
     * Column for the lines after the first of an s-expression whose {@code (} sits at {@code openingColumn}.
     */
    static int continuationIndent(FusionConfig config, List<Node> items, int openingColumn) {
        return switch (classify(config, items)) {
            case END_OF_OPENING -> openingColumn + 1;
            case FIXED -> openingColumn + 2;
            case END_OF_OPENING_SYMBOL -> openingColumn + items.get(0).symbolValue().orElse("").length() + 2;
            case UNDETERMINED -> throw new IllegalStateException("Unclassified continuation indent");
        };
    }
}
