package io.lighting.rsx.diff;

import io.lighting.rsx.markup.Attribute;
import io.lighting.rsx.markup.AttributeValue;
import io.lighting.rsx.markup.Component;
import io.lighting.rsx.markup.Conditional;
import io.lighting.rsx.markup.DynamicSlot;
import io.lighting.rsx.markup.Element;
import io.lighting.rsx.markup.Expression;
import io.lighting.rsx.markup.Loop;
import io.lighting.rsx.markup.SourceSpan;
import io.lighting.rsx.markup.Template;
import io.lighting.rsx.markup.TemplateNode;
import io.lighting.rsx.markup.Text;
import io.lighting.rsx.markup.TextSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an edited template can be patched into a running program.
 * <p>
 * The comparison first checks the structural skeleton: tags, namespaces,
 * attribute name sets (order-insensitive), child counts and kinds, text segment
 * kinds, component paths, conditional branch shapes and loop bodies, recursing
 * into nested bodies. Any difference yields {@link Verdict.NeedsFullRebuild} for
 * the whole template. When the skeleton matches, every slot of the new template
 * is paired with the slot at the same position in the old one.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class TemplateDiffer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateDiffer.class);

    private final DiffOptions options;

    public TemplateDiffer() {
        this(DiffOptions.defaults());
    }

    public TemplateDiffer(DiffOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public static Verdict diff(Template previous, Template next) {
        return new TemplateDiffer().compare(previous, next);
    }

    /**
     * Compares two parses of the same template.
     *
     * @throws IllegalArgumentException if the templates have different keys
     */
    public Verdict compare(Template previous, Template next) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");
        if (!previous.key().equals(next.key())) {
            throw new IllegalArgumentException(
                "Cannot diff templates with different keys: " + previous.key() + " vs " + next.key()
            );
        }
        Comparison comparison = new Comparison();
        if (!comparison.nodes(previous.roots(), next.roots(), "")) {
            LOGGER.debug("Template {} needs a full rebuild: {}", next.key(), comparison.mismatch.reason());
            return comparison.mismatch;
        }
        List<SlotMapping> mapping = new ArrayList<>(comparison.mapping);
        mapping.sort(Comparator.comparingInt(SlotMapping::newIndex));
        if (!isBijection(mapping, previous.slots().size(), next.slots().size())) {
            return new Verdict.NeedsFullRebuild("Slot table does not match the template structure", next.span());
        }
        LOGGER.debug(
            "Template {} is hot-reloadable: {} slots, {} literal patches",
            next.key(),
            mapping.size(),
            comparison.patches.size()
        );
        return new Verdict.HotReloadable(mapping, comparison.patches);
    }

    private static boolean isBijection(List<SlotMapping> mapping, int oldCount, int newCount) {
        if (mapping.size() != newCount || oldCount != newCount) {
            return false;
        }
        boolean[] seenNew = new boolean[newCount];
        boolean[] seenOld = new boolean[oldCount];
        for (SlotMapping entry : mapping) {
            if (entry.newIndex() >= newCount || entry.oldIndex() >= oldCount) {
                return false;
            }
            if (seenNew[entry.newIndex()] || seenOld[entry.oldIndex()]) {
                return false;
            }
            seenNew[entry.newIndex()] = true;
            seenOld[entry.oldIndex()] = true;
        }
        return true;
    }

    /**
     * State of one comparison: collected mappings and patches, or the first mismatch.
     */
    private final class Comparison {
        private final List<SlotMapping> mapping = new ArrayList<>();
        private final List<LiteralPatch> patches = new ArrayList<>();
        private Verdict.NeedsFullRebuild mismatch;

        boolean nodes(List<TemplateNode> before, List<TemplateNode> after, String path) {
            int shared = Math.min(before.size(), after.size());
            for (int i = 0; i < shared; i++) {
                TemplateNode oldNode = before.get(i);
                TemplateNode newNode = after.get(i);
                if (oldNode.kind() != newNode.kind()) {
                    return fail(
                        "Node at " + path + "/" + i + " changed from " + oldNode.kind() + " to " + newNode.kind(),
                        newNode.span()
                    );
                }
            }
            if (before.size() != after.size()) {
                SourceSpan span = after.size() > shared ? after.get(shared).span() : before.get(shared).span();
                String where = path.isEmpty() ? "the root" : path;
                return fail(
                    "Child count at " + where + " changed from " + before.size() + " to " + after.size(),
                    span
                );
            }
            for (int i = 0; i < shared; i++) {
                if (!node(before.get(i), after.get(i), path + "/" + i)) {
                    return false;
                }
            }
            return true;
        }

        private boolean node(TemplateNode before, TemplateNode after, String path) {
            if (before instanceof Element oldElement) {
                return element(oldElement, (Element) after, path);
            }
            if (before instanceof Component oldComponent) {
                return component(oldComponent, (Component) after, path);
            }
            if (before instanceof Text oldText) {
                return text(oldText, (Text) after, path);
            }
            if (before instanceof Expression oldExpression) {
                return slot(oldExpression.slot(), ((Expression) after).slot());
            }
            if (before instanceof Conditional oldConditional) {
                return conditional(oldConditional, (Conditional) after, path);
            }
            if (before instanceof Loop oldLoop) {
                Loop newLoop = (Loop) after;
                return slot(oldLoop.iterator(), newLoop.iterator())
                    && nodes(oldLoop.body().nodes(), newLoop.body().nodes(), path + "/for");
            }
            throw new IllegalStateException("Unknown template node: " + before.getClass().getName());
        }

        private boolean element(Element before, Element after, String path) {
            if (!before.tag().equals(after.tag()) || !Objects.equals(before.namespace(), after.namespace())) {
                return fail(
                    "Element at " + path + " changed from <" + before.qualifiedTag() + "> to <"
                        + after.qualifiedTag() + ">",
                    after.span()
                );
            }
            return attributes(before.attributes(), after.attributes(), path, after.span())
                && nodes(before.children(), after.children(), path);
        }

        private boolean component(Component before, Component after, String path) {
            if (!before.path().equals(after.path())) {
                return fail(
                    "Component at " + path + " changed from " + before.name() + " to " + after.name(),
                    after.span()
                );
            }
            return attributes(before.props(), after.props(), path, after.span())
                && nodes(before.children(), after.children(), path);
        }

        private boolean attributes(List<Attribute> before, List<Attribute> after, String path, SourceSpan owner) {
            Map<String, Attribute> oldByName = new LinkedHashMap<>();
            for (Attribute attribute : before) {
                oldByName.put(attribute.qualifiedName(), attribute);
            }
            Set<String> newNames = new LinkedHashSet<>();
            for (Attribute attribute : after) {
                newNames.add(attribute.qualifiedName());
            }
            if (!oldByName.keySet().equals(newNames)) {
                Set<String> added = new LinkedHashSet<>(newNames);
                added.removeAll(oldByName.keySet());
                Set<String> removed = new LinkedHashSet<>(oldByName.keySet());
                removed.removeAll(newNames);
                return fail("Attributes at " + path + " changed: added " + added + ", removed " + removed, owner);
            }
            for (Attribute attribute : after) {
                Attribute prior = oldByName.get(attribute.qualifiedName());
                if (prior.value() instanceof AttributeValue.Literal oldLiteral
                    && attribute.value() instanceof AttributeValue.Literal newLiteral) {
                    String location = path + "/@" + attribute.qualifiedName();
                    if (!literal(location, oldLiteral.text(), newLiteral.text(), attribute.span())) {
                        return false;
                    }
                } else if (prior.value() instanceof AttributeValue.Dynamic oldDynamic
                    && attribute.value() instanceof AttributeValue.Dynamic newDynamic) {
                    if (!slot(oldDynamic.slot(), newDynamic.slot())) {
                        return false;
                    }
                } else {
                    return fail(
                        "Attribute '" + attribute.qualifiedName() + "' at " + path
                            + " switched between a literal and a dynamic value",
                        attribute.span()
                    );
                }
            }
            return true;
        }

        private boolean text(Text before, Text after, String path) {
            List<TextSegment> oldSegments = before.segments();
            List<TextSegment> newSegments = after.segments();
            if (oldSegments.size() != newSegments.size()) {
                return fail("Text at " + path + " changed its interpolation layout", after.span());
            }
            for (int i = 0; i < newSegments.size(); i++) {
                if (oldSegments.get(i).getClass() != newSegments.get(i).getClass()) {
                    return fail("Text at " + path + " changed its interpolation layout", after.span());
                }
            }
            for (int i = 0; i < newSegments.size(); i++) {
                TextSegment oldSegment = oldSegments.get(i);
                TextSegment newSegment = newSegments.get(i);
                if (oldSegment instanceof TextSegment.Literal oldLiteral) {
                    TextSegment.Literal newLiteral = (TextSegment.Literal) newSegment;
                    String location = path + "/#text[" + i + "]";
                    if (!literal(location, oldLiteral.text(), newLiteral.text(), newLiteral.span())) {
                        return false;
                    }
                } else if (!slot(((TextSegment.Dynamic) oldSegment).slot(), ((TextSegment.Dynamic) newSegment).slot())) {
                    return false;
                }
            }
            return true;
        }

        private boolean conditional(Conditional before, Conditional after, String path) {
            List<Conditional.Branch> oldBranches = before.branches();
            List<Conditional.Branch> newBranches = after.branches();
            if (oldBranches.size() != newBranches.size()) {
                return fail(
                    "Conditional at " + path + " changed from " + oldBranches.size() + " to "
                        + newBranches.size() + " branches",
                    after.span()
                );
            }
            for (int i = 0; i < newBranches.size(); i++) {
                Conditional.Branch oldBranch = oldBranches.get(i);
                Conditional.Branch newBranch = newBranches.get(i);
                if (oldBranch.isElse() != newBranch.isElse()) {
                    return fail("Conditional at " + path + " gained or lost its else branch", after.span());
                }
                if (!newBranch.isElse() && !slot(oldBranch.guard(), newBranch.guard())) {
                    return false;
                }
                String branchPath = path + "/if[" + i + "]";
                if (!nodes(oldBranch.body().nodes(), newBranch.body().nodes(), branchPath)) {
                    return false;
                }
            }
            return true;
        }

        private boolean slot(DynamicSlot before, DynamicSlot after) {
            if (before.kind() != after.kind()) {
                return fail("Slot changed from " + before.kind() + " to " + after.kind(), after.span());
            }
            String updated = before.expression().equals(after.expression()) ? null : after.expression();
            mapping.add(new SlotMapping(after.index(), before.index(), updated));
            return true;
        }

        private boolean literal(String location, String before, String after, SourceSpan span) {
            if (before.equals(after)) {
                return true;
            }
            if (options.literalPolicy() == LiteralPolicy.FORCE_REBUILD) {
                return fail("Literal text at " + location + " changed", span);
            }
            patches.add(new LiteralPatch(location, before, after, span));
            return true;
        }

        private boolean fail(String reason, SourceSpan span) {
            mismatch = new Verdict.NeedsFullRebuild(reason, span);
            return false;
        }
    }
}
