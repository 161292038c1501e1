package io.lighting.rsx.apt;

import io.lighting.rsx.markup.ParseResult;
import io.lighting.rsx.markup.ParserOptions;
import io.lighting.rsx.markup.SyntaxError;
import io.lighting.rsx.markup.TemplateSource;
import io.lighting.rsx.markup.Templates;
import io.lighting.rsx.markup.annotations.Rsx;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.tools.Diagnostic;

/**
 * Compile-time check for {@link Rsx} constants.
 * <p>
 * Each marked field must be a {@code static final String} compile-time
 * constant; its value is parsed and any syntax error is reported as a compiler
 * error on the field. Line and column in the message are relative to the
 * constant's value.
 */
@SupportedAnnotationTypes("io.lighting.rsx.markup.annotations.Rsx")
public final class RsxTemplateProcessor extends AbstractProcessor {

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (roundEnv.processingOver()) {
            return false;
        }
        for (Element element : roundEnv.getElementsAnnotatedWith(Rsx.class)) {
            validate(element);
        }
        return true;
    }

    private void validate(Element element) {
        if (element.getKind() != ElementKind.FIELD) {
            error(element, "@Rsx can only be applied to fields");
            return;
        }
        if (!element.getModifiers().containsAll(Set.of(Modifier.STATIC, Modifier.FINAL))) {
            error(element, "@Rsx requires a static final field");
            return;
        }
        if (!element.asType().toString().equals(String.class.getName())) {
            error(element, "@Rsx requires a String constant");
            return;
        }
        Object constant = ((VariableElement) element).getConstantValue();
        if (!(constant instanceof String markup)) {
            error(element, "@Rsx requires a compile-time constant String");
            return;
        }
        TemplateSource source = TemplateSource.of(sourceName(element), 1, 1, markup);
        ParseResult result = Templates.tryParse(source, ParserOptions.defaults());
        if (result instanceof ParseResult.Failure failure) {
            SyntaxError syntaxError = failure.error();
            error(
                element,
                "Invalid markup (" + syntaxError.kind() + " at " + syntaxError.span().start() + "): "
                    + syntaxError.message()
            );
        }
    }

    private String sourceName(Element field) {
        Element owner = field.getEnclosingElement();
        if (owner instanceof TypeElement type) {
            return type.getQualifiedName() + "#" + field.getSimpleName();
        }
        return field.getSimpleName().toString();
    }

    private void error(Element element, String message) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
    }
}
