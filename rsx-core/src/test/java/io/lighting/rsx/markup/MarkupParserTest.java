package io.lighting.rsx.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MarkupParserTest {

    @Test
    void parsesElementWithAttributesAndInterpolatedText() {
        Template template = Templates.parse("<div class=\"card\" id={id}>Hello {name}!</div>");

        assertEquals(1, template.roots().size());
        Element div = assertInstanceOf(Element.class, template.roots().get(0));
        assertEquals("div", div.tag());
        assertNull(div.namespace());

        Attribute cssClass = div.attributes().get(0);
        assertEquals("class", cssClass.name());
        assertEquals(new AttributeValue.Literal("card"), cssClass.value());
        Attribute id = div.attributes().get(1);
        assertTrue(id.isDynamic());
        DynamicSlot idSlot = ((AttributeValue.Dynamic) id.value()).slot();
        assertEquals(SlotKind.ATTRIBUTE_VALUE, idSlot.kind());
        assertEquals("id", idSlot.expression());

        Text text = assertInstanceOf(Text.class, div.children().get(0));
        assertEquals(3, text.segments().size());
        assertEquals("Hello ", ((TextSegment.Literal) text.segments().get(0)).text());
        DynamicSlot name = ((TextSegment.Dynamic) text.segments().get(1)).slot();
        assertEquals(SlotKind.TEXT_INTERPOLATION, name.kind());
        assertEquals("name", name.expression());
        assertEquals("!", ((TextSegment.Literal) text.segments().get(2)).text());
    }

    @Test
    void parsesComponentsByCapitalizedNameOrPath() {
        Template template = Templates.parse("<Counter/><ui::Button label={text} primary/><ui.Icon name='star'/>");

        Component counter = assertInstanceOf(Component.class, template.roots().get(0));
        assertEquals(List.of("Counter"), counter.path());

        Component button = assertInstanceOf(Component.class, template.roots().get(1));
        assertEquals(List.of("ui", "Button"), button.path());
        assertEquals("ui::Button", button.name());
        DynamicSlot label = ((AttributeValue.Dynamic) button.props().get(0).value()).slot();
        assertEquals(SlotKind.COMPONENT_PROP, label.kind());
        assertEquals(new AttributeValue.Literal("true"), button.props().get(1).value());

        Component icon = assertInstanceOf(Component.class, template.roots().get(2));
        assertEquals(List.of("ui", "Icon"), icon.path());
        assertEquals(new AttributeValue.Literal("star"), icon.props().get(0).value());
    }

    @Test
    void parsesNamespacedTagsAndAttributes() {
        Template template = Templates.parse("<svg:use xlink:href=\"#icon\"/>");

        Element use = assertInstanceOf(Element.class, template.roots().get(0));
        assertEquals("svg", use.namespace());
        assertEquals("use", use.tag());
        assertEquals("svg:use", use.qualifiedTag());
        assertEquals("xlink:href", use.attributes().get(0).qualifiedName());
    }

    @Test
    void parsesConditionalChains() {
        Template template = Templates.parse("""
            {if count > 0 {
              <span>{count}</span>
            } else if loading {
              <p>wait</p>
            } else {
              <p>none</p>
            }}
            """);

        Conditional conditional = assertInstanceOf(Conditional.class, template.roots().get(0));
        assertEquals(3, conditional.branches().size());
        assertTrue(conditional.hasElse());
        assertEquals("count > 0", conditional.branches().get(0).guard().expression());
        assertEquals(SlotKind.CONDITIONAL_GUARD, conditional.branches().get(0).guard().kind());
        assertEquals("loading", conditional.branches().get(1).guard().expression());
        assertTrue(conditional.branches().get(2).isElse());

        Element span = assertInstanceOf(Element.class, conditional.branches().get(0).body().nodes().get(0));
        Expression count = assertInstanceOf(Expression.class, span.children().get(0));
        assertEquals(SlotKind.NODE_EXPRESSION, count.slot().kind());
    }

    @Test
    void parsesLoops() {
        Template template = Templates.parse("<ul>{for item in items { <li>{item.name()}</li> }}</ul>");

        Element list = assertInstanceOf(Element.class, template.roots().get(0));
        Loop loop = assertInstanceOf(Loop.class, list.children().get(0));
        assertEquals("item", loop.pattern());
        assertEquals(SlotKind.LOOP_ITERATOR, loop.iterator().kind());
        assertEquals("item in items", loop.iterator().expression());
        Element item = assertInstanceOf(Element.class, loop.body().nodes().get(0));
        assertEquals("li", item.tag());
        assertEquals("item.name()", ((Expression) item.children().get(0)).slot().expression());
    }

    @Test
    void placeholdersOnSeparateLinesBecomeExpressionNodes() {
        Template template = Templates.parse("<p>\n  {first}\n  {last}\n</p>");

        Element paragraph = (Element) template.roots().get(0);
        assertEquals(2, paragraph.children().size());
        assertEquals("first", ((Expression) paragraph.children().get(0)).slot().expression());
        assertEquals("last", ((Expression) paragraph.children().get(1)).slot().expression());
    }

    @Test
    void keepsSameLineSpaceBetweenPlaceholders() {
        Template template = Templates.parse("<p>{first} {last}</p>");

        Element paragraph = (Element) template.roots().get(0);
        assertEquals(1, paragraph.children().size());
        Text text = assertInstanceOf(Text.class, paragraph.children().get(0));
        assertEquals(3, text.segments().size());
        DynamicSlot first = ((TextSegment.Dynamic) text.segments().get(0)).slot();
        assertEquals(SlotKind.TEXT_INTERPOLATION, first.kind());
        assertEquals("first", first.expression());
        assertEquals(" ", ((TextSegment.Literal) text.segments().get(1)).text());
        assertEquals("last", ((TextSegment.Dynamic) text.segments().get(2)).slot().expression());
    }

    @Test
    void dropsRunsOfSameLineWhitespaceBetweenTags() {
        Template template = Templates.parse("<ul> <li/> <li/> </ul>");

        Element list = (Element) template.roots().get(0);
        assertEquals(2, list.children().size());
    }

    @Test
    void collapsesWhitespaceInLiteralText() {
        Template template = Templates.parse("<p>\n    Hello\n    world  again\n</p>");

        Text text = (Text) ((Element) template.roots().get(0)).children().get(0);
        assertTrue(text.isStatic());
        assertEquals("Hello world again", ((TextSegment.Literal) text.segments().get(0)).text());
    }

    @Test
    void normalizesExpressionWhitespaceOutsideStrings() {
        Template template = Templates.parse("<p title={ format( \"a  b\",   x ) }>{  a   +\n b }</p>");

        Element paragraph = (Element) template.roots().get(0);
        DynamicSlot title = ((AttributeValue.Dynamic) paragraph.attributes().get(0).value()).slot();
        assertEquals("format( \"a  b\", x )", title.expression());
        assertEquals("a + b", ((Expression) paragraph.children().get(0)).slot().expression());
    }

    @Test
    void keepsBalancedBracesInsideExpressions() {
        Template template = Templates.parse("<div style={{ color: \"red}\" }}/>");

        Element div = (Element) template.roots().get(0);
        DynamicSlot style = ((AttributeValue.Dynamic) div.attributes().get(0).value()).slot();
        assertEquals("{ color: \"red}\" }", style.expression());
    }

    @Test
    void skipsCommentsWithoutSplittingText() {
        Template template = Templates.parse("<div><!-- note -->{/* hidden */}<br/>a <!-- x --> b</div>");

        Element div = (Element) template.roots().get(0);
        assertEquals(2, div.children().size());
        assertEquals("br", ((Element) div.children().get(0)).tag());
        Text text = (Text) div.children().get(1);
        assertEquals(1, text.segments().size());
        assertEquals("a b", ((TextSegment.Literal) text.segments().get(0)).text());
    }

    @Test
    void acceptsFragmentsWithSeveralRoots() {
        Template template = Templates.parse("<header/>\n<main/>\n<footer/>");

        assertEquals(3, template.roots().size());
        assertTrue(template.isStatic());
    }

    @Test
    void tracksSpansRelativeToTheInvocation() {
        TemplateSource source = TemplateSource.of("src/View.java", 10, 5, "<div>\n  <b>{x}</b>\n</div>");

        Template template = Templates.parse(source);

        assertEquals(new TemplateKey("src/View.java", 10, 5), template.key());
        Element div = (Element) template.roots().get(0);
        assertEquals(new SourcePosition(10, 5, 0), div.span().start());
        Element bold = (Element) div.children().get(0);
        assertEquals(new SourcePosition(11, 3, 8), bold.span().start());
        DynamicSlot x = template.slot(0);
        assertEquals(new SourcePosition(11, 6, 11), x.span().start());
        assertEquals(new SourcePosition(11, 9, 14), x.span().end());
        assertEquals("src/View.java", x.span().file());
    }

    @Test
    void offsetsCountFromTheOriginOffset() {
        TemplateSource inline = TemplateSource.of("src/View.java", 4, 20, "<p>{x}</p>");
        TemplateSource located = new TemplateSource("src/View.java", new SourcePosition(4, 20, 57), "<p>{x}</p>");

        assertEquals(new SourcePosition(4, 23, 3), Templates.parse(inline).slot(0).span().start());
        assertEquals(new SourcePosition(4, 23, 60), Templates.parse(located).slot(0).span().start());
        assertEquals(inline.key(), located.key());
    }

    @Test
    void keyDoesNotDependOnTheBody() {
        Template before = Templates.parse(TemplateSource.of("A.java", 3, 7, "<p>{a}</p>"));
        Template after = Templates.parse(TemplateSource.of("A.java", 3, 7, "<section>\n<p>{a}</p>\n</section>"));

        assertEquals(before.key(), after.key());
    }

    @Test
    void tryParseReportsSuccess() {
        ParseResult result = Templates.tryParse(TemplateSource.of("<br/>"), ParserOptions.defaults());

        assertTrue(result.isSuccess());
        ParseResult.Success success = assertInstanceOf(ParseResult.Success.class, result);
        assertFalse(success.template().roots().isEmpty());
    }
}
