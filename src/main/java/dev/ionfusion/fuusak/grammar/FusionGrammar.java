package dev.ionfusion.fuusak.grammar;

import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent recognizer for Fusion source text.
 *
 * <p>Produces a generic {@link ParseNode} tree. Whitespace runs and comments are kept as children of the
 * enclosing file, list, s-expression, struct or struct member; commas, colons and delimiters are not.
 * On failure the error points at the furthest position reached, listing what was expected there.
 */
public final class FusionGrammar {
    /**
     * Deepest container nesting accepted; deeper input fails like any other syntax error.
     */
    public static final int MAX_DEPTH = 512;

    private static final String OPERATOR_CHARS = "!#%&*+-./;<=>?@^`|~";
    private static final String STOP_CHARS = "()[]{},\"'";
    private static final List<String> NULL_TYPES = List.of(
        "blob", "clob", "bool", "int", "list", "decimal", "float",
        "symbol", "string", "timestamp", "sexp", "struct"
    );

    private final String source;
    private int pos;
    private int furthest = -1;
    private int depth;
    private final Set<String> expected = new LinkedHashSet<>();

    private FusionGrammar(String source) {
        this.source = source;
    }

    /**
     * Parses a whole file.
     *
     * @throws FusionException with a span at the failing position
     */
    public static ParseNode parseFile(String source) {
        return new FusionGrammar(source).file();
    }

    /**
     * Matches {@code rule} at the start of {@code input}; the match may end before the end of the input.
     *
     * @throws FusionException when the rule does not match
     */
    public static ParseNode parse(Rule rule, String input) {
        FusionGrammar grammar = new FusionGrammar(input);
        ParseNode node = grammar.entry(rule);
        if (node == null) {
            throw grammar.failure();
        }
        return node;
    }

    private ParseNode entry(Rule rule) {
        return switch (rule) {
            case FILE -> file();
            case EXPR -> expr(true);
            case ANNOTATIONS -> annotations();
            case ANNOTATION -> annotation();
            case NULL -> nullValue();
            case BOOLEAN -> booleanValue();
            case TIMESTAMP -> timestamp();
            case REAL -> real();
            case INTEGER -> integer();
            case SYMBOL -> symbol(true);
            case STRING -> string();
            case SHORT_STRING -> shortString();
            case LONG_STRING -> longString();
            case CLOB -> clob();
            case BLOB -> blob();
            case STRUCTURE -> structure();
            case STRUCT_MEMBER -> structMember();
            case STRUCT_KEY -> structKey();
            case LIST -> list();
            case SEXPR -> sexpr();
            case WHITESPACE -> whitespace();
            case ANY_COMMENT -> comment();
            case LINE_COMMENT -> lineComment();
            case BLOCK_COMMENT -> blockComment();
        };
    }

    private ParseNode file() {
        List<ParseNode> children = new ArrayList<>();
        while (true) {
            trivia(children);
            if (atEnd()) {
                break;
            }
            ParseNode expr = expr(false);
            if (expr == null) {
                throw failure();
            }
            children.add(expr);
        }
        return node(Rule.FILE, 0, children);
    }

    // Trivia

    private void trivia(List<ParseNode> children) {
        while (true) {
            ParseNode next = whitespace();
            if (next == null) {
                next = comment();
            }
            if (next == null) {
                return;
            }
            children.add(next);
        }
    }

    private ParseNode whitespace() {
        int start = pos;
        while (!atEnd() && isWhitespace(peek())) {
            pos++;
        }
        return pos > start ? leaf(Rule.WHITESPACE, start) : null;
    }

    private void skipWhitespace() {
        while (!atEnd() && isWhitespace(peek())) {
            pos++;
        }
    }

    private ParseNode comment() {
        ParseNode comment = lineComment();
        return comment != null ? comment : blockComment();
    }

    private ParseNode lineComment() {
        if (!lookingAt("//")) {
            return null;
        }
        int start = pos;
        pos += 2;
        while (!atEnd() && peek() != '\n') {
            pos++;
        }
        if (!atEnd()) {
            pos++;
        }
        return leaf(Rule.LINE_COMMENT, start);
    }

    private ParseNode blockComment() {
        if (!lookingAt("/*")) {
            return null;
        }
        int end = source.indexOf("*/", pos + 2);
        if (end < 0) {
            expectAt(source.length(), "'*/'");
            return null;
        }
        int start = pos;
        pos = end + 2;
        return leaf(Rule.BLOCK_COMMENT, start);
    }

    // Expressions

    private ParseNode expr(boolean allowOperators) {
        int start = pos;
        List<ParseNode> children = new ArrayList<>();
        ParseNode annotations = annotations();
        if (annotations != null) {
            children.add(annotations);
            skipWhitespace();
        }
        if (++depth > MAX_DEPTH) {
            throw FusionException.spanned(new Span(pos, pos), "nesting deeper than " + MAX_DEPTH + " levels");
        }
        ParseNode value;
        try {
            value = value(allowOperators);
        } finally {
            depth--;
        }
        if (value == null) {
            return reset(start);
        }
        children.add(value);
        return node(Rule.EXPR, start, children);
    }

    private ParseNode annotations() {
        int start = pos;
        List<ParseNode> annotations = new ArrayList<>();
        while (true) {
            int before = pos;
            if (!annotations.isEmpty()) {
                skipWhitespace();
            }
            ParseNode annotation = annotation();
            if (annotation == null) {
                pos = before;
                break;
            }
            annotations.add(annotation);
        }
        if (annotations.isEmpty()) {
            return reset(start);
        }
        return node(Rule.ANNOTATIONS, start, annotations);
    }

    private ParseNode annotation() {
        int start = pos;
        if (!identifier() && !quotedSymbol()) {
            return null;
        }
        skipWhitespace();
        if (!lookingAt("::")) {
            return reset(start);
        }
        pos += 2;
        return leaf(Rule.ANNOTATION, start);
    }

    private ParseNode value(boolean allowOperators) {
        ParseNode value = nullValue();
        if (value == null) {
            value = booleanValue();
        }
        if (value == null) {
            value = timestamp();
        }
        if (value == null) {
            value = real();
        }
        if (value == null) {
            value = integer();
        }
        if (value == null) {
            value = symbol(allowOperators);
        }
        if (value == null) {
            value = string();
        }
        if (value == null) {
            value = clob();
        }
        if (value == null) {
            value = blob();
        }
        if (value == null) {
            value = structure();
        }
        if (value == null) {
            value = list();
        }
        if (value == null) {
            value = sexpr();
        }
        if (value == null) {
            expect("value");
        }
        return value;
    }

    // Atoms

    private ParseNode nullValue() {
        int start = pos;
        if (!lookingAt("null")) {
            return null;
        }
        pos += 4;
        if (peek() == '.') {
            pos++;
            String type = NULL_TYPES.stream()
                .filter(candidate -> lookingAt(candidate) && !isIdentPart(peek(candidate.length())))
                .findFirst()
                .orElse(null);
            if (type == null) {
                return reset(start);
            }
            pos += type.length();
        } else if (isIdentPart(peek())) {
            return reset(start);
        }
        return leaf(Rule.NULL, start);
    }

    private ParseNode booleanValue() {
        int start = pos;
        for (String keyword : List.of("true", "false")) {
            if (lookingAt(keyword) && !isIdentPart(peek(keyword.length()))) {
                pos += keyword.length();
                return leaf(Rule.BOOLEAN, start);
            }
        }
        return null;
    }

    private ParseNode timestamp() {
        int start = pos;
        if (!digits(4)) {
            return reset(start);
        }
        if (consume('T')) {
            return stopped(Rule.TIMESTAMP, start);
        }
        if (!consume('-') || !digits(2)) {
            return reset(start);
        }
        if (consume('T')) {
            return stopped(Rule.TIMESTAMP, start);
        }
        if (!consume('-') || !digits(2)) {
            return reset(start);
        }
        if (consume('T')) {
            int timeStart = pos;
            if (!time()) {
                pos = timeStart;
            }
        }
        return stopped(Rule.TIMESTAMP, start);
    }

    private boolean time() {
        if (!digits(2) || !consume(':') || !digits(2)) {
            return false;
        }
        if (consume(':')) {
            if (!digits(2)) {
                return false;
            }
            if (consume('.') && digitRun() == 0) {
                return false;
            }
        }
        if (consume('Z')) {
            return true;
        }
        if (!consume('+') && !consume('-')) {
            return false;
        }
        return digits(2) && consume(':') && digits(2);
    }

    private ParseNode real() {
        int start = pos;
        for (String special : List.of("nan", "+inf", "-inf")) {
            if (lookingAt(special) && isStop(pos + special.length())) {
                pos += special.length();
                return leaf(Rule.REAL, start);
            }
        }
        consume('-');
        if (!decimalInt()) {
            return reset(start);
        }
        boolean isReal = false;
        if (consume('.')) {
            isReal = true;
            if (isDigit(peek())) {
                digitsWithUnderscores();
            }
        }
        if (exponent()) {
            isReal = true;
        }
        if (!isReal) {
            return reset(start);
        }
        return stopped(Rule.REAL, start);
    }

    private boolean exponent() {
        int start = pos;
        char marker = peek();
        if (marker != 'e' && marker != 'E' && marker != 'd' && marker != 'D') {
            return false;
        }
        pos++;
        if (!consume('+')) {
            consume('-');
        }
        if (digitRun() == 0) {
            pos = start;
            return false;
        }
        return true;
    }

    private ParseNode integer() {
        int start = pos;
        consume('-');
        if (lookingAtIgnoreCase("0x")) {
            pos += 2;
            if (!runWithUnderscores(FusionGrammar::isHexDigit)) {
                return reset(start);
            }
        } else if (lookingAtIgnoreCase("0b")) {
            pos += 2;
            if (!runWithUnderscores(chr -> chr == '0' || chr == '1')) {
                return reset(start);
            }
        } else if (!decimalInt()) {
            return reset(start);
        }
        return stopped(Rule.INTEGER, start);
    }

    private boolean decimalInt() {
        if (peek() == '0') {
            pos++;
            return true;
        }
        if (peek() >= '1' && peek() <= '9') {
            digitsWithUnderscores();
            return true;
        }
        return false;
    }

    private void digitsWithUnderscores() {
        runWithUnderscores(FusionGrammar::isDigit);
    }

    private boolean runWithUnderscores(CharPredicate accepted) {
        if (!accepted.test(peek())) {
            return false;
        }
        while (true) {
            if (accepted.test(peek())) {
                pos++;
            } else if (peek() == '_' && accepted.test(peek(1))) {
                pos += 2;
            } else {
                return true;
            }
        }
    }

    private ParseNode symbol(boolean allowOperators) {
        int start = pos;
        if (identifier() || quotedSymbol() || (allowOperators && operator())) {
            return leaf(Rule.SYMBOL, start);
        }
        return null;
    }

    private boolean identifier() {
        if (!isIdentStart(peek())) {
            return false;
        }
        pos++;
        while (isIdentPart(peek())) {
            pos++;
        }
        return true;
    }

    private boolean quotedSymbol() {
        if (peek() != '\'' || lookingAt("'''")) {
            return false;
        }
        int start = pos;
        pos++;
        while (true) {
            if (atEnd() || peek() == '\n' || peek() == '\r') {
                pos = start;
                return false;
            }
            char chr = peek();
            if (chr == '\\') {
                if (pos + 1 >= source.length()) {
                    pos = start;
                    return false;
                }
                pos += 2;
            } else {
                pos++;
                if (chr == '\'') {
                    return true;
                }
            }
        }
    }

    private boolean operator() {
        int start = pos;
        while (OPERATOR_CHARS.indexOf(peek()) >= 0) {
            if (peek() == '/' && (peek(1) == '/' || peek(1) == '*')) {
                break;
            }
            pos++;
        }
        return pos > start;
    }

    private ParseNode string() {
        ParseNode string = shortString();
        return string != null ? string : longString();
    }

    private ParseNode shortString() {
        int start = pos;
        if (!consume('"')) {
            return null;
        }
        while (true) {
            if (atEnd() || peek() == '\n' || peek() == '\r') {
                expect("'\"'");
                return reset(start);
            }
            char chr = peek();
            if (chr == '\\') {
                if (pos + 1 >= source.length()) {
                    pos++;
                    expect("'\"'");
                    return reset(start);
                }
                pos += 2;
            } else {
                pos++;
                if (chr == '"') {
                    return leaf(Rule.SHORT_STRING, start);
                }
            }
        }
    }

    private ParseNode longString() {
        int start = pos;
        if (!lookingAt("'''")) {
            return null;
        }
        pos += 3;
        while (true) {
            if (atEnd()) {
                expect("\"'''\"");
                return reset(start);
            }
            if (peek() == '\\' && pos + 1 < source.length()) {
                pos += 2;
            } else if (lookingAt("'''")) {
                pos += 3;
                return leaf(Rule.LONG_STRING, start);
            } else {
                pos++;
            }
        }
    }

    private ParseNode clob() {
        int start = pos;
        if (!lookingAt("{{")) {
            return null;
        }
        pos += 2;
        List<ParseNode> children = new ArrayList<>();
        boolean hasStrings = false;
        while (true) {
            ParseNode whitespace = whitespace();
            if (whitespace != null) {
                children.add(whitespace);
            }
            if (lookingAt("}}")) {
                pos += 2;
                return hasStrings ? node(Rule.CLOB, start, children) : reset(start);
            }
            ParseNode string = string();
            if (string == null) {
                return reset(start);
            }
            children.add(string);
            hasStrings = true;
        }
    }

    private ParseNode blob() {
        int start = pos;
        if (!lookingAt("{{")) {
            return null;
        }
        pos += 2;
        while (!atEnd() && (isWhitespace(peek()) || isBase64(peek()))) {
            pos++;
        }
        if (!lookingAt("}}")) {
            expect("'}}'");
            return reset(start);
        }
        pos += 2;
        return leaf(Rule.BLOB, start);
    }

    // Containers

    private ParseNode structure() {
        int start = pos;
        if (!consume('{')) {
            return null;
        }
        List<ParseNode> children = new ArrayList<>();
        while (true) {
            trivia(children);
            if (consume('}')) {
                return node(Rule.STRUCTURE, start, children);
            }
            ParseNode member = structMember();
            if (member == null) {
                expect("struct key");
                expect("'}'");
                return reset(start);
            }
            children.add(member);
            trivia(children);
            if (consume(',')) {
                continue;
            }
            if (consume('}')) {
                return node(Rule.STRUCTURE, start, children);
            }
            expect("','");
            expect("'}'");
            return reset(start);
        }
    }

    private ParseNode structMember() {
        int start = pos;
        ParseNode key = structKey();
        if (key == null) {
            return null;
        }
        List<ParseNode> children = new ArrayList<>();
        children.add(key);
        trivia(children);
        if (!consume(':')) {
            expect("':'");
            return reset(start);
        }
        trivia(children);
        ParseNode value = expr(false);
        if (value == null) {
            return reset(start);
        }
        children.add(value);
        return node(Rule.STRUCT_MEMBER, start, children);
    }

    private ParseNode structKey() {
        int start = pos;
        if (identifier() || quotedSymbol() || shortString() != null || longString() != null) {
            return leaf(Rule.STRUCT_KEY, start);
        }
        return null;
    }

    private ParseNode list() {
        int start = pos;
        if (!consume('[')) {
            return null;
        }
        List<ParseNode> children = new ArrayList<>();
        while (true) {
            trivia(children);
            if (consume(']')) {
                return node(Rule.LIST, start, children);
            }
            ParseNode item = expr(false);
            if (item == null) {
                expect("']'");
                return reset(start);
            }
            children.add(item);
            trivia(children);
            if (consume(',')) {
                continue;
            }
            if (consume(']')) {
                return node(Rule.LIST, start, children);
            }
            expect("','");
            expect("']'");
            return reset(start);
        }
    }

    private ParseNode sexpr() {
        int start = pos;
        if (!consume('(')) {
            return null;
        }
        List<ParseNode> children = new ArrayList<>();
        while (true) {
            trivia(children);
            if (consume(')')) {
                return node(Rule.SEXPR, start, children);
            }
            ParseNode item = expr(true);
            if (item == null) {
                expect("')'");
                return reset(start);
            }
            children.add(item);
        }
    }

    // Scanning helpers

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return peek(0);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean lookingAt(String text) {
        return source.startsWith(text, pos);
    }

    private boolean lookingAtIgnoreCase(String text) {
        return source.regionMatches(true, pos, text, 0, text.length());
    }

    private boolean consume(char expectedChar) {
        if (peek() == expectedChar && !atEnd()) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean digits(int count) {
        for (int i = 0; i < count; i++) {
            if (!isDigit(peek(i))) {
                return false;
            }
        }
        pos += count;
        return true;
    }

    private int digitRun() {
        int start = pos;
        while (isDigit(peek())) {
            pos++;
        }
        return pos - start;
    }

    private boolean isStop(int index) {
        if (index >= source.length()) {
            return true;
        }
        char chr = source.charAt(index);
        if (isWhitespace(chr) || STOP_CHARS.indexOf(chr) >= 0) {
            return true;
        }
        return chr == '/' && index + 1 < source.length()
            && (source.charAt(index + 1) == '/' || source.charAt(index + 1) == '*');
    }

    private ParseNode stopped(Rule rule, int start) {
        return isStop(pos) ? leaf(rule, start) : reset(start);
    }

    private ParseNode reset(int start) {
        pos = start;
        return null;
    }

    private ParseNode leaf(Rule rule, int start) {
        return new ParseNode(rule, new Span(start, pos), List.of());
    }

    private ParseNode node(Rule rule, int start, List<ParseNode> children) {
        return new ParseNode(rule, new Span(start, pos), children);
    }

    private void expect(String what) {
        expectAt(pos, what);
    }

    private void expectAt(int position, String what) {
        if (position > furthest) {
            furthest = position;
            expected.clear();
        }
        if (position == furthest) {
            expected.add(what);
        }
    }

    private FusionException failure() {
        int position = Math.max(furthest, 0);
        List<String> names = new ArrayList<>(expected);
        String message;
        if (names.isEmpty()) {
            message = "unexpected input";
        } else if (names.size() == 1) {
            message = "expected " + names.get(0);
        } else if (names.size() == 2) {
            message = "expected " + names.get(0) + " or " + names.get(1);
        } else {
            String head = String.join(", ", names.subList(0, names.size() - 1));
            message = "expected " + head + ", or " + names.get(names.size() - 1);
        }
        return FusionException.spanned(new Span(position, position), message);
    }

    private static boolean isWhitespace(char chr) {
        return chr == ' ' || chr == '\t' || chr == '\n' || chr == '\r' || chr == '\f' || chr == '\u000B';
    }

    private static boolean isDigit(char chr) {
        return chr >= '0' && chr <= '9';
    }

    private static boolean isHexDigit(char chr) {
        return isDigit(chr) || (chr >= 'a' && chr <= 'f') || (chr >= 'A' && chr <= 'F');
    }

    private static boolean isIdentStart(char chr) {
        return (chr >= 'a' && chr <= 'z') || (chr >= 'A' && chr <= 'Z') || chr == '_' || chr == '$';
    }

    private static boolean isIdentPart(char chr) {
        return isIdentStart(chr) || isDigit(chr);
    }

    private static boolean isBase64(char chr) {
        return isIdentStart(chr) && chr != '_' && chr != '$' || isDigit(chr) || chr == '+' || chr == '/' || chr == '=';
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char chr);
    }
}
