package dev.ionfusion.fuusak.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.ionfusion.fuusak.cst.BlockCommentExpr;
import dev.ionfusion.fuusak.cst.Expr;
import dev.ionfusion.fuusak.cst.NewlinesExpr;
import dev.ionfusion.fuusak.cst.TextExpr;
import dev.ionfusion.fuusak.cst.ValueExpr;
import dev.ionfusion.fuusak.ist.Atom;
import dev.ionfusion.fuusak.ist.BlockComment;
import dev.ionfusion.fuusak.ist.Clob;
import dev.ionfusion.fuusak.ist.LineComment;
import dev.ionfusion.fuusak.ist.MultilineText;
import dev.ionfusion.fuusak.ist.Newlines;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import dev.ionfusion.fuusak.ist.StructKey;
import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Locale;

/**
 * Tree dumps for {@code debug-ast} and {@code debug-ist}. Spans are shown as the source text they cover.
 */
public final class DebugView {
    static final int EXCERPT_LIMIT = 40;
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public enum Format {
        JSON,
        YAML;

        public static Format from(String value) {
            return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private DebugView() {}

    public static String render(JsonNode tree, Format format) {
        ObjectMapper mapper = format == Format.YAML ? YAML : JSON;
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render debug view", ex);
        }
    }

    public static ArrayNode cst(List<Expr> exprs, String source) {
        ArrayNode array = NODES.arrayNode();
        exprs.forEach(expr -> array.add(cstNode(expr, source)));
        return array;
    }

    public static ArrayNode ist(List<Node> nodes, String source) {
        ArrayNode array = NODES.arrayNode();
        nodes.forEach(node -> array.add(istNode(node, source)));
        return array;
    }

    private static ObjectNode cstNode(Expr expr, String source) {
        ObjectNode node = header(expr.kind().name(), expr.span(), source);
        annotations(node, expr.annotations());
        if (expr instanceof ValueExpr value) {
            node.put("value", value.value());
        } else if (expr instanceof TextExpr text) {
            node.put("value", text.value());
        } else if (expr instanceof BlockCommentExpr comment) {
            ArrayNode lines = node.putArray("lines");
            comment.lines().forEach(lines::add);
        } else if (expr instanceof NewlinesExpr newlines) {
            node.put("count", newlines.count());
        } else {
            node.set("items", cst(expr.items(), source));
        }
        return node;
    }

    private static ObjectNode istNode(Node node, String source) {
        ObjectNode json = header(node.kind().name(), node.span(), source);
        annotations(json, node.annotations());
        if (node instanceof Atom atom) {
            json.put("type", atom.type().name());
            json.put("value", atom.value());
        } else if (node instanceof MultilineText text) {
            json.put("value", text.value());
        } else if (node instanceof Clob clob) {
            json.set("parts", ist(clob.parts(), source));
        } else if (node instanceof Sequence sequence) {
            json.set("items", ist(sequence.items(), source));
        } else if (node instanceof LineComment comment) {
            json.put("value", comment.value());
        } else if (node instanceof BlockComment comment) {
            ArrayNode lines = json.putArray("lines");
            comment.lines().forEach(lines::add);
        } else if (node instanceof StructKey key) {
            json.put("value", key.value());
        } else if (node instanceof Newlines newlines) {
            json.put("count", newlines.count());
        }
        return json;
    }

    private static ObjectNode header(String kind, Span span, String source) {
        ObjectNode node = NODES.objectNode();
        node.put("kind", kind);
        node.put("span", span.excerpt(source, EXCERPT_LIMIT));
        if (span.isTruncated(EXCERPT_LIMIT)) {
            node.put("truncated", true);
        }
        return node;
    }

    private static void annotations(ObjectNode node, List<String> annotations) {
        if (!annotations.isEmpty()) {
            ArrayNode array = node.putArray("annotations");
            annotations.forEach(array::add);
        }
    }
}
