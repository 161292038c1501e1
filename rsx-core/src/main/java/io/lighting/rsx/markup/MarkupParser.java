package io.lighting.rsx.markup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

final class MarkupParser {
    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of("match", "while", "loop", "let");

    private final TemplateSource source;
    private final ParserOptions options;
    private final String input;
    private final int[] lineStarts;
    private int index;

    MarkupParser(TemplateSource source, ParserOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
        this.input = source.text();
        this.lineStarts = computeLineStarts(input);
    }

    ParsedTemplate parse() {
        List<TemplateNode> roots = parseNodes(Scope.ROOT, null, null, 0);
        return new ParsedTemplate(source.key(), roots, span(0, input.length()));
    }

    private enum Scope {
        ROOT,
        ELEMENT,
        BLOCK
    }

    private List<TemplateNode> parseNodes(Scope scope, SourceSpan opening, String openingLabel, int depth) {
        List<TemplateNode> nodes = new ArrayList<>();
        TextRun run = new TextRun();
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == '<') {
                if (startsWith("<!--")) {
                    skipMarkupComment();
                    continue;
                }
                if (startsWith("</")) {
                    if (scope == Scope.ELEMENT) {
                        flush(run, nodes);
                        return nodes;
                    }
                    throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Unexpected closing tag", index, index + 2);
                }
                if (startsWith("<!") || startsWith("<?")) {
                    throw error(
                        SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                        "Declarations and processing instructions are not supported",
                        index,
                        index + 2
                    );
                }
                flush(run, nodes);
                nodes.add(parseTag(depth + 1));
                continue;
            }
            if (ch == '{') {
                int commentEnd = blockCommentEnd();
                if (commentEnd >= 0) {
                    index = commentEnd;
                    continue;
                }
                String keyword = peekKeyword();
                if ("if".equals(keyword)) {
                    flush(run, nodes);
                    nodes.add(parseConditional(depth + 1));
                    continue;
                }
                if ("for".equals(keyword)) {
                    flush(run, nodes);
                    nodes.add(parseLoop(depth + 1));
                    continue;
                }
                if (keyword != null && UNSUPPORTED_KEYWORDS.contains(keyword)) {
                    throw error(
                        SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                        "'" + keyword + "' blocks are not supported",
                        index,
                        index + 1
                    );
                }
                run.add(parsePlaceholder());
                continue;
            }
            if (ch == '}') {
                if (scope == Scope.BLOCK) {
                    flush(run, nodes);
                    return nodes;
                }
                throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Unexpected '}'", index, index + 1);
            }
            if (ch == '>') {
                throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Unexpected '>' in text", index, index + 1);
            }
            run.appendLiteral(ch, index);
            index++;
        }
        if (scope != Scope.ROOT) {
            throw new TemplateSyntaxException(
                new SyntaxError(SyntaxErrorKind.UNCLOSED_ELEMENT, openingLabel + " is not closed", opening)
            );
        }
        flush(run, nodes);
        return nodes;
    }

    private TemplateNode parseTag(int depth) {
        int start = index;
        index++;
        TagName name = parseTagName(start);
        if (depth > options.maxDepth()) {
            throw error(
                SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                "Nesting deeper than " + options.maxDepth() + " levels is not supported",
                start,
                index
            );
        }
        boolean component = name.isComponent();
        List<Attribute> attributes = parseAttributes(
            component ? SlotKind.COMPONENT_PROP : SlotKind.ATTRIBUTE_VALUE,
            start,
            name
        );
        boolean selfClosing;
        if (startsWith("/>")) {
            index += 2;
            selfClosing = true;
        } else {
            index++;
            selfClosing = false;
        }
        List<TemplateNode> children = List.of();
        if (!selfClosing) {
            children = parseNodes(Scope.ELEMENT, span(start, index), "Element <" + name.raw() + ">", depth);
            parseClosingTag(name);
        }
        SourceSpan span = span(start, index);
        if (component) {
            return new Component(name.segments(), attributes, children, span);
        }
        return new Element(name.segments().get(0), name.namespace(), attributes, children, span);
    }

    private TagName parseTagName(int tagStart) {
        int nameStart = index;
        if (!isNameStart(peek())) {
            throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected tag name", tagStart, index + 1);
        }
        String namespace = null;
        List<String> segments = new ArrayList<>();
        segments.add(parseName());
        while (true) {
            if (startsWith("::")) {
                if (namespace != null || !isNameStart(peekAt(index + 2))) {
                    throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Invalid component path", nameStart, index + 2);
                }
                index += 2;
                segments.add(parseName());
                continue;
            }
            if (peek() == '.' && isNameStart(peekAt(index + 1))) {
                if (namespace != null) {
                    throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Invalid component path", nameStart, index + 1);
                }
                index++;
                segments.add(parseName());
                continue;
            }
            if (peek() == ':' && namespace == null && segments.size() == 1 && isNameStart(peekAt(index + 1))) {
                if (!options.allowNamespaces()) {
                    throw error(
                        SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                        "Namespaced tags are not enabled",
                        nameStart,
                        index + 1
                    );
                }
                namespace = segments.remove(0);
                index++;
                segments.add(parseName());
                continue;
            }
            break;
        }
        return new TagName(namespace, segments, input.substring(nameStart, index));
    }

    private List<Attribute> parseAttributes(SlotKind kind, int tagStart, TagName tag) {
        List<Attribute> attributes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                throw error(SyntaxErrorKind.UNCLOSED_ELEMENT, "Tag <" + tag.raw() + " is not closed", tagStart, index);
            }
            if (peek() == '>' || startsWith("/>")) {
                return attributes;
            }
            if (peek() == '{') {
                if (startsWithAfterWhitespace(index + 1, "...")) {
                    throw error(
                        SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                        "Spread attributes are not supported",
                        index,
                        index + 1
                    );
                }
                throw error(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, "Expected attribute name", index, index + 1);
            }
            Attribute attribute = parseAttribute(kind);
            if (!seen.add(attribute.qualifiedName())) {
                throw new TemplateSyntaxException(new SyntaxError(
                    SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX,
                    "Duplicate attribute '" + attribute.qualifiedName() + "'",
                    attribute.span()
                ));
            }
            attributes.add(attribute);
        }
    }

    private Attribute parseAttribute(SlotKind kind) {
        int start = index;
        if (!isNameStart(peek())) {
            throw error(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, "Expected attribute name", start, start + 1);
        }
        String namespace = null;
        String name = parseName();
        if (peek() == ':' && isNameStart(peekAt(index + 1))) {
            if (!options.allowNamespaces()) {
                throw error(
                    SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                    "Namespaced attributes are not enabled",
                    start,
                    index + 1
                );
            }
            namespace = name;
            index++;
            name = parseName();
        }
        int nameEnd = index;
        skipWhitespace();
        if (peek() != '=') {
            index = nameEnd;
            return new Attribute(name, namespace, new AttributeValue.Literal("true"), span(start, nameEnd));
        }
        index++;
        skipWhitespace();
        if (isAtEnd()) {
            throw error(
                SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX,
                "Missing value for attribute '" + name + "'",
                start,
                index
            );
        }
        char ch = peek();
        if (ch == '"' || ch == '\'') {
            int valueStart = index;
            int close = input.indexOf(ch, index + 1);
            if (close < 0) {
                throw error(
                    SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX,
                    "Unterminated value for attribute '" + name + "'",
                    valueStart,
                    input.length()
                );
            }
            String text = input.substring(index + 1, close);
            index = close + 1;
            return new Attribute(name, namespace, new AttributeValue.Literal(text), span(start, index));
        }
        if (ch == '{') {
            int open = index;
            int end = scanExpressionEnd(open + 1, SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, open, "Attribute expression");
            String text = normalizeExpression(input.substring(open + 1, end));
            index = end + 1;
            if (text.isEmpty()) {
                throw error(
                    SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX,
                    "Empty expression for attribute '" + name + "'",
                    open,
                    index
                );
            }
            DynamicSlot slot = DynamicSlot.unassigned(kind, text, span(open, index));
            return new Attribute(name, namespace, new AttributeValue.Dynamic(slot), span(start, index));
        }
        throw error(
            SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX,
            "Expected quoted value or {expression} for attribute '" + name + "'",
            index,
            index + 1
        );
    }

    private void parseClosingTag(TagName name) {
        int start = index;
        index += 2;
        skipWhitespace();
        if (!isNameStart(peek())) {
            throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected closing tag name", start, index + 1);
        }
        TagName closing = parseTagName(start);
        if (!closing.raw().equals(name.raw())) {
            throw error(
                SyntaxErrorKind.UNCLOSED_ELEMENT,
                "Element <" + name.raw() + "> is not closed, found </" + closing.raw() + ">",
                start,
                index
            );
        }
        skipWhitespace();
        if (peek() == '>') {
            index++;
            return;
        }
        if (isAtEnd()) {
            throw error(
                SyntaxErrorKind.UNCLOSED_ELEMENT,
                "Closing tag </" + name.raw() + "> is not closed",
                start,
                index
            );
        }
        if (isNameStart(peek())) {
            throw error(
                SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                "Closing tags cannot carry attributes",
                index,
                index + 1
            );
        }
        throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected '>'", index, index + 1);
    }

    private TemplateNode parseConditional(int depth) {
        int start = index;
        index++;
        skipWhitespace();
        index += "if".length();
        List<Conditional.Branch> branches = new ArrayList<>();
        while (true) {
            DynamicSlot guard = parseGuard(start);
            branches.add(new Conditional.Branch(guard, parseBody(depth, "if")));
            skipWhitespace();
            if (!peekWord("else")) {
                break;
            }
            index += "else".length();
            skipWhitespace();
            if (peekWord("if")) {
                index += "if".length();
                continue;
            }
            if (peek() != '{') {
                throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected '{' or 'if' after 'else'", index, index + 1);
            }
            branches.add(new Conditional.Branch(null, parseBody(depth, "else")));
            skipWhitespace();
            break;
        }
        expectBlockEnd(start, "if");
        return new Conditional(branches, span(start, index));
    }

    private DynamicSlot parseGuard(int blockStart) {
        skipWhitespace();
        int headerStart = index;
        int bodyOpen = scanHeaderEnd(headerStart, "if", blockStart);
        String text = normalizeExpression(input.substring(headerStart, bodyOpen));
        if (text.isEmpty()) {
            throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Missing condition after 'if'", headerStart, bodyOpen + 1);
        }
        index = bodyOpen;
        return DynamicSlot.unassigned(
            SlotKind.CONDITIONAL_GUARD,
            text,
            span(headerStart, trimEnd(headerStart, bodyOpen))
        );
    }

    private TemplateNode parseLoop(int depth) {
        int start = index;
        index++;
        skipWhitespace();
        index += "for".length();
        skipWhitespace();
        int headerStart = index;
        int bodyOpen = scanHeaderEnd(headerStart, "for", start);
        String header = input.substring(headerStart, bodyOpen);
        int inAt = findInKeyword(header);
        String pattern = inAt < 0 ? "" : normalizeExpression(header.substring(0, inAt));
        String iterable = inAt < 0 ? "" : normalizeExpression(header.substring(inAt + 2));
        if (pattern.isEmpty() || iterable.isEmpty()) {
            throw error(
                SyntaxErrorKind.UNEXPECTED_TOKEN,
                "Expected 'pattern in iterable' after 'for'",
                headerStart,
                bodyOpen
            );
        }
        DynamicSlot iterator = DynamicSlot.unassigned(
            SlotKind.LOOP_ITERATOR,
            pattern + " in " + iterable,
            span(headerStart, trimEnd(headerStart, bodyOpen))
        );
        index = bodyOpen;
        TemplateBody body = parseBody(depth, "for");
        skipWhitespace();
        expectBlockEnd(start, "for");
        return new Loop(pattern, iterator, body, span(start, index));
    }

    private TemplateBody parseBody(int depth, String label) {
        int open = index;
        if (depth > options.maxDepth()) {
            throw error(
                SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
                "Nesting deeper than " + options.maxDepth() + " levels is not supported",
                open,
                open + 1
            );
        }
        index++;
        List<TemplateNode> nodes = parseNodes(Scope.BLOCK, span(open, open + 1), "'" + label + "' body", depth);
        index++;
        return new TemplateBody(nodes, span(open, index));
    }

    private void expectBlockEnd(int blockStart, String keyword) {
        if (isAtEnd()) {
            throw error(
                SyntaxErrorKind.UNCLOSED_ELEMENT,
                "'" + keyword + "' block is not closed",
                blockStart,
                blockStart + 1
            );
        }
        if (peek() != '}') {
            throw error(
                SyntaxErrorKind.UNEXPECTED_TOKEN,
                "Expected '}' to close the '" + keyword + "' block",
                index,
                index + 1
            );
        }
        index++;
    }

    private Piece parsePlaceholder() {
        int start = index;
        int end = scanExpressionEnd(start + 1, SyntaxErrorKind.UNCLOSED_ELEMENT, start, "Expression");
        String text = normalizeExpression(input.substring(start + 1, end));
        index = end + 1;
        if (text.isEmpty()) {
            throw error(SyntaxErrorKind.UNEXPECTED_TOKEN, "Empty expression", start, index);
        }
        if (text.startsWith("...")) {
            throw error(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, "Spread expressions are not supported", start, index);
        }
        return new Piece(start, index, text, true);
    }

    /**
     * Turns a drained run into nodes. Whitespace-only literal pieces that span a
     * line break are layout and are dropped, as is a run holding nothing but
     * whitespace. What remains becomes one {@code Text} node if any literal is
     * left, otherwise one {@code Expression} node per placeholder.
     */
    private void flush(TextRun run, List<TemplateNode> nodes) {
        List<Piece> pieces = new ArrayList<>();
        boolean hasPlaceholder = false;
        boolean hasLiteral = false;
        for (Piece piece : run.drain()) {
            if (!piece.dynamic() && piece.text().isBlank() && piece.text().indexOf('\n') >= 0) {
                continue;
            }
            hasPlaceholder |= piece.dynamic();
            hasLiteral |= !piece.dynamic();
            pieces.add(piece);
        }
        if (!hasPlaceholder && (!hasLiteral || pieces.get(0).text().isBlank())) {
            return;
        }
        if (!hasLiteral) {
            for (Piece piece : pieces) {
                SourceSpan span = span(piece.start(), piece.end());
                nodes.add(new Expression(
                    DynamicSlot.unassigned(SlotKind.NODE_EXPRESSION, piece.text(), span),
                    span
                ));
            }
            return;
        }
        List<TextSegment> segments = new ArrayList<>();
        int last = pieces.size() - 1;
        for (int i = 0; i <= last; i++) {
            Piece piece = pieces.get(i);
            SourceSpan span = span(piece.start(), piece.end());
            if (piece.dynamic()) {
                segments.add(new TextSegment.Dynamic(
                    DynamicSlot.unassigned(SlotKind.TEXT_INTERPOLATION, piece.text(), span)
                ));
                continue;
            }
            String text = normalizeLiteral(piece.text(), i == 0, i == last);
            if (!text.isEmpty()) {
                segments.add(new TextSegment.Literal(text, span));
            }
        }
        nodes.add(new Text(segments, span(pieces.get(0).start(), pieces.get(last).end())));
    }

    /**
     * Whitespace touching a run edge is dropped when it spans a line break;
     * everything else collapses to a single space.
     */
    private static String normalizeLiteral(String raw, boolean first, boolean last) {
        String text = raw;
        if (first) {
            int lead = 0;
            while (lead < text.length() && Character.isWhitespace(text.charAt(lead))) {
                lead++;
            }
            if (text.substring(0, lead).indexOf('\n') >= 0) {
                text = text.substring(lead);
            }
        }
        if (last) {
            int trail = text.length();
            while (trail > 0 && Character.isWhitespace(text.charAt(trail - 1))) {
                trail--;
            }
            if (text.substring(trail).indexOf('\n') >= 0) {
                text = text.substring(0, trail);
            }
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean inWhitespace = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                if (!inWhitespace) {
                    out.append(' ');
                }
                inWhitespace = true;
            } else {
                out.append(ch);
                inWhitespace = false;
            }
        }
        return out.toString();
    }

    static String normalizeExpression(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        boolean pendingSpace = false;
        int i = 0;
        while (i < raw.length()) {
            char ch = raw.charAt(i);
            if (Character.isWhitespace(ch)) {
                pendingSpace = true;
                i++;
                continue;
            }
            if (pendingSpace && out.length() > 0) {
                out.append(' ');
            }
            pendingSpace = false;
            if (ch == '"' || ch == '\'' || ch == '`') {
                int end = i + 1;
                while (end < raw.length() && raw.charAt(end) != ch) {
                    end += raw.charAt(end) == '\\' ? 2 : 1;
                }
                end = Math.min(end + 1, raw.length());
                out.append(raw, i, end);
                i = end;
                continue;
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private int scanExpressionEnd(int from, SyntaxErrorKind unclosedKind, int openAt, String label) {
        int depth = 0;
        int i = from;
        while (i < input.length()) {
            char ch = input.charAt(i);
            if (ch == '"' || ch == '\'' || ch == '`') {
                i = skipQuoted(i, unclosedKind);
                continue;
            }
            if (ch == '{' || ch == '(' || ch == '[') {
                depth++;
            } else if (ch == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (ch == ')' || ch == ']') {
                depth = Math.max(0, depth - 1);
            }
            i++;
        }
        throw error(unclosedKind, label + " is not closed", openAt, openAt + 1);
    }

    private int scanHeaderEnd(int from, String keyword, int blockStart) {
        int depth = 0;
        int i = from;
        while (i < input.length()) {
            char ch = input.charAt(i);
            if (ch == '"' || ch == '\'' || ch == '`') {
                i = skipQuoted(i, SyntaxErrorKind.UNCLOSED_ELEMENT);
                continue;
            }
            if (ch == '(' || ch == '[') {
                depth++;
            } else if (ch == ')' || ch == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && ch == '{') {
                return i;
            } else if (depth == 0 && ch == '}') {
                throw error(
                    SyntaxErrorKind.UNEXPECTED_TOKEN,
                    "Expected '{' to open the '" + keyword + "' body",
                    i,
                    i + 1
                );
            }
            i++;
        }
        throw error(
            SyntaxErrorKind.UNCLOSED_ELEMENT,
            "'" + keyword + "' block is not closed",
            blockStart,
            blockStart + 1
        );
    }

    private int skipQuoted(int at, SyntaxErrorKind unclosedKind) {
        char quote = input.charAt(at);
        int i = at + 1;
        while (i < input.length()) {
            char ch = input.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                return i + 1;
            }
            i++;
        }
        throw error(unclosedKind, "Unterminated string literal", at, input.length());
    }

    private static int findInKeyword(String header) {
        int depth = 0;
        for (int i = 1; i + 2 < header.length(); i++) {
            char ch = header.charAt(i);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0
                && header.startsWith("in", i)
                && Character.isWhitespace(header.charAt(i - 1))
                && Character.isWhitespace(header.charAt(i + 2))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index just past a brace-wrapped block comment starting at the current
     * position, or -1 when the brace opens something else.
     */
    private int blockCommentEnd() {
        int i = index + 1;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        if (!input.startsWith("/*", i)) {
            return -1;
        }
        int close = input.indexOf("*/", i + 2);
        if (close < 0) {
            throw error(SyntaxErrorKind.UNCLOSED_ELEMENT, "Comment is not closed", i, i + 2);
        }
        int after = close + 2;
        while (after < input.length() && Character.isWhitespace(input.charAt(after))) {
            after++;
        }
        if (after < input.length() && input.charAt(after) == '}') {
            return after + 1;
        }
        return -1;
    }

    private void skipMarkupComment() {
        int close = input.indexOf("-->", index + 4);
        if (close < 0) {
            throw error(SyntaxErrorKind.UNCLOSED_ELEMENT, "Comment is not closed", index, index + 4);
        }
        index = close + 3;
    }

    private String peekKeyword() {
        int i = index + 1;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        int start = i;
        if (i >= input.length() || !isIdentifierStart(input.charAt(i))) {
            return null;
        }
        while (i < input.length() && isIdentifierPart(input.charAt(i))) {
            i++;
        }
        if (i >= input.length()) {
            return null;
        }
        char next = input.charAt(i);
        if (!Character.isWhitespace(next) && next != '(' && next != '!') {
            return null;
        }
        return input.substring(start, i);
    }

    private boolean peekWord(String word) {
        return input.startsWith(word, index) && !isIdentifierPart(peekAt(index + word.length()));
    }

    private boolean startsWithAfterWhitespace(int from, String prefix) {
        int i = from;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return input.startsWith(prefix, i);
    }

    private String parseName() {
        int start = index;
        index++;
        while (!isAtEnd() && isNamePart(peek())) {
            index++;
        }
        return input.substring(start, index);
    }

    private int trimEnd(int start, int end) {
        int i = end;
        while (i > start && Character.isWhitespace(input.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            index++;
        }
    }

    private boolean startsWith(String prefix) {
        return input.startsWith(prefix, index);
    }

    private char peek() {
        return peekAt(index);
    }

    private char peekAt(int at) {
        if (at >= input.length()) {
            return '\0';
        }
        return input.charAt(at);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }

    private static boolean isNameStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isNamePart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-';
    }

    private static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private TemplateSyntaxException error(SyntaxErrorKind kind, String message, int start, int end) {
        int from = Math.min(start, input.length());
        int to = Math.max(from, Math.min(end, input.length()));
        return new TemplateSyntaxException(new SyntaxError(kind, message, span(from, to)));
    }

    private SourceSpan span(int start, int end) {
        return new SourceSpan(source.file(), position(start), position(end));
    }

    private SourcePosition position(int at) {
        int line = lineOf(at);
        SourcePosition origin = source.origin();
        int column = line == 0 ? origin.column() + at : at - lineStarts[line] + 1;
        return new SourcePosition(origin.line() + line, column, origin.offset() + at);
    }

    private int lineOf(int at) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= at) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }

    private record TagName(String namespace, List<String> segments, String raw) {
        boolean isComponent() {
            return namespace == null && (segments.size() > 1 || Character.isUpperCase(segments.get(0).charAt(0)));
        }
    }

    private record Piece(int start, int end, String text, boolean dynamic) {
    }

    /**
     * Collects the literal characters and placeholders between two structural
     * nodes. Skipped comments do not split the run.
     */
    private static final class TextRun {
        private final List<Piece> pieces = new ArrayList<>();
        private final StringBuilder literal = new StringBuilder();
        private int literalStart = -1;
        private int literalEnd;

        void appendLiteral(char ch, int at) {
            if (literalStart < 0) {
                literalStart = at;
            }
            literal.append(ch);
            literalEnd = at + 1;
        }

        void add(Piece placeholder) {
            closeLiteral();
            pieces.add(placeholder);
        }

        List<Piece> drain() {
            closeLiteral();
            List<Piece> drained = List.copyOf(pieces);
            pieces.clear();
            return drained;
        }

        private void closeLiteral() {
            if (literalStart >= 0) {
                pieces.add(new Piece(literalStart, literalEnd, literal.toString(), false));
                literal.setLength(0);
                literalStart = -1;
            }
        }
    }
}
