package io.lighting.rsx.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MarkupParserErrorTest {

    @Test
    void rejectsStrayClosingBrace() {
        SyntaxError error = parseError("<div>\n  <p>}</p>\n</div>");

        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, error.kind());
        assertEquals(new SourcePosition(2, 6, 11), error.span().start());
    }

    @Test
    void rejectsStrayTokens() {
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("a > b").kind());
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("</div>").kind());
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("<p>{}</p>").kind());
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("< p/>").kind());
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("{for item {<p/>}}").kind());
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, parseError("{if {<p/>}}").kind());
    }

    @Test
    void reportsUnclosedElementAtItsOpeningTag() {
        SyntaxError error = parseError("<div><span></span>");

        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, error.kind());
        assertEquals(new SourcePosition(1, 1, 0), error.span().start());
        assertTrue(error.message().contains("<div>"));
    }

    @Test
    void reportsMismatchedClosingTagAsUnclosed() {
        SyntaxError error = parseError("<div></span>");

        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, error.kind());
        assertTrue(error.message().contains("</span>"));
    }

    @Test
    void reportsUnclosedBlocksAndComments() {
        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, parseError("<p>{count</p>").kind());
        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, parseError("{if ok { <p/> }").kind());
        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, parseError("<!-- note").kind());
        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, parseError("<p>{\"text}</p>").kind());
        assertEquals(SyntaxErrorKind.UNCLOSED_ELEMENT, parseError("<input disabled").kind());
    }

    @Test
    void rejectsMalformedAttributes() {
        assertEquals(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, parseError("<a href=/>").kind());
        assertEquals(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, parseError("<a href=").kind());
        assertEquals(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, parseError("<a title=\"oops/>").kind());
        assertEquals(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, parseError("<a href={}/>").kind());
    }

    @Test
    void rejectsDuplicateAttributesAtTheSecondOccurrence() {
        SyntaxError error = parseError("<a x=\"1\" x=\"2\"/>");

        assertEquals(SyntaxErrorKind.INVALID_ATTRIBUTE_SYNTAX, error.kind());
        assertEquals(9, error.span().start().offset());
    }

    @Test
    void rejectsUnsupportedConstructs() {
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("{match x { _ => 1 }}").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("{while x {<p/>}}").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("{let x = 1}").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("<div {...props}/>").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("<p>{...rest}</p>").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("<!DOCTYPE html>").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("<?xml version=\"1.0\"?>").kind());
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, parseError("<div></div class>").kind());
    }

    @Test
    void enforcesMaximumDepth() {
        ParserOptions options = ParserOptions.builder().maxDepth(2).build();

        Templates.parse(TemplateSource.of("<a><b/></a>"), options);
        TemplateSyntaxException ex = assertThrows(
            TemplateSyntaxException.class,
            () -> Templates.parse(TemplateSource.of("<a><b><c/></b></a>"), options)
        );
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, ex.kind());
    }

    @Test
    void capsTheConfigurableDepth() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ParserOptions.builder().maxDepth(ParserOptions.MAX_DEPTH_LIMIT + 1)
        );
        ParserOptions options = ParserOptions.builder().maxDepth(ParserOptions.MAX_DEPTH_LIMIT).build();
        int depth = ParserOptions.MAX_DEPTH_LIMIT;
        String nested = "<a>".repeat(depth) + "</a>".repeat(depth);

        Template template = Templates.parse(TemplateSource.of(nested), options);
        assertEquals(1, template.roots().size());

        ParseResult tooDeep = Templates.tryParse(TemplateSource.of("<a>" + nested + "</a>"), options);
        assertEquals(
            SyntaxErrorKind.UNSUPPORTED_CONSTRUCT,
            assertInstanceOf(ParseResult.Failure.class, tooDeep).error().kind()
        );
    }

    @Test
    void namespacesCanBeDisabled() {
        ParserOptions options = ParserOptions.builder().allowNamespaces(false).build();

        TemplateSyntaxException ex = assertThrows(
            TemplateSyntaxException.class,
            () -> Templates.parse(TemplateSource.of("<svg:rect/>"), options)
        );
        assertEquals(SyntaxErrorKind.UNSUPPORTED_CONSTRUCT, ex.kind());
    }

    @Test
    void syntaxErrorIsAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> Templates.parse("<div>"));
    }

    @Test
    void tryParseReturnsTheError() {
        ParseResult result = Templates.tryParse(TemplateSource.of("F.java", 4, 2, "<p>}"), ParserOptions.defaults());

        assertFalse(result.isSuccess());
        SyntaxError error = assertInstanceOf(ParseResult.Failure.class, result).error();
        assertEquals("F.java", error.span().file());
        assertEquals(new SourcePosition(4, 5, 3), error.span().start());
    }

    private static SyntaxError parseError(String markup) {
        TemplateSyntaxException ex = assertThrows(TemplateSyntaxException.class, () -> Templates.parse(markup));
        return ex.error();
    }
}
