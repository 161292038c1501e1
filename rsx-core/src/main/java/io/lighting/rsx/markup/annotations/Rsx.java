package io.lighting.rsx.markup.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code static final String} constant holding markup.
 * <p>
 * The annotation processor parses every marked constant at compile time, so
 * malformed markup fails the build with the location of the syntax error:
 * <pre>{@code
 * @Rsx
 * static final String CARD = """
 *     <section class="card">
 *       <h2>{title}</h2>
 *       {if expanded { <p>{body}</p> }}
 *     </section>
 *     """;
 * }</pre>
 * Only kept in source; it has no runtime effect.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.FIELD)
public @interface Rsx {
}
