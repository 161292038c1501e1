package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Outcome of {@link Templates#tryParse}: either a template or the syntax error
 * that stopped the parse.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    record Success(Template template) implements ParseResult {
        public Success {
            Objects.requireNonNull(template, "template");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(SyntaxError error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
