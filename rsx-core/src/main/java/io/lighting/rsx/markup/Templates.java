package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Entry point for turning markup into {@link Template}s.
 * <p>
 * Parsing is pure and synchronous; independent invocations may run in parallel.
 * <pre>{@code
 * Template template = Templates.parse(TemplateSource.of("src/app/View.java", 12, 9, """
 *     <ul class="todos">
 *       {for todo in todos {
 *         <li class={todo.cssClass()}>{todo.title()}</li>
 *       }}
 *     </ul>
 *     """));
 * }</pre>
 */
public final class Templates {
    private Templates() {
    }

    public static Template parse(String markup) {
        return parse(TemplateSource.of(markup));
    }

    public static Template parse(TemplateSource source) {
        return parse(source, ParserOptions.defaults());
    }

    /**
     * Parses the markup and assigns slot indices.
     *
     * @throws TemplateSyntaxException if the markup is malformed
     */
    public static Template parse(TemplateSource source, ParserOptions options) {
        return SlotAssigner.assign(parseMarkup(source, options));
    }

    /**
     * Parses the markup without assigning slot indices.
     */
    public static ParsedTemplate parseMarkup(TemplateSource source, ParserOptions options) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        return new MarkupParser(source, options).parse();
    }

    /**
     * Same as {@link #parse(TemplateSource, ParserOptions)} but reports a
     * syntax error as a value instead of throwing.
     */
    public static ParseResult tryParse(TemplateSource source, ParserOptions options) {
        try {
            return new ParseResult.Success(parse(source, options));
        } catch (TemplateSyntaxException ex) {
            return new ParseResult.Failure(ex.error());
        }
    }
}
