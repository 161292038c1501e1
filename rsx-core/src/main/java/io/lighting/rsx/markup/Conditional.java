package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * An {@code if / else if / else} chain. Branches are tried in order; only the
 * last one may lack a guard, in which case it is the {@code else} branch.
 */
public record Conditional(List<Branch> branches, SourceSpan span) implements TemplateNode {
    public Conditional {
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("Conditional must have at least one branch");
        }
        for (int i = 0; i < branches.size() - 1; i++) {
            if (branches.get(i).isElse()) {
                throw new IllegalArgumentException("Only the last branch may be an else branch");
            }
        }
        Objects.requireNonNull(span, "span");
    }

    public boolean hasElse() {
        return branches.get(branches.size() - 1).isElse();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    /**
     * @param guard condition slot, {@code null} for the {@code else} branch
     */
    public record Branch(DynamicSlot guard, TemplateBody body) {
        public Branch {
            Objects.requireNonNull(body, "body");
        }

        public boolean isElse() {
            return guard == null;
        }
    }
}
