package io.lighting.rsx.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hands out slot indices for a parsed markup tree.
 * <p>
 * The walk is pre-order and depth-first with children in source order.
 * Within an element or component the attributes come before the children,
 * text segments are visited left to right, a conditional branch's guard comes
 * before its body and a loop's iterator before its body. The code emitter and
 * the differ both rely on this order, so it must not change.
 * <p>
 * The input tree is left untouched; a new tree carrying indexed slots is built.
 */
public final class SlotAssigner {
    private final List<DynamicSlot> slots = new ArrayList<>();

    private SlotAssigner() {
    }

    public static Template assign(ParsedTemplate parsed) {
        Objects.requireNonNull(parsed, "parsed");
        SlotAssigner assigner = new SlotAssigner();
        List<TemplateNode> roots = assigner.nodes(parsed.roots());
        return new Template(parsed.key(), roots, assigner.slots, parsed.span());
    }

    private List<TemplateNode> nodes(List<TemplateNode> nodes) {
        List<TemplateNode> result = new ArrayList<>(nodes.size());
        for (TemplateNode node : nodes) {
            result.add(node(node));
        }
        return result;
    }

    private TemplateNode node(TemplateNode node) {
        if (node instanceof Element element) {
            List<Attribute> attributes = attributes(element.attributes());
            return new Element(
                element.tag(),
                element.namespace(),
                attributes,
                nodes(element.children()),
                element.span()
            );
        }
        if (node instanceof Component component) {
            List<Attribute> props = attributes(component.props());
            return new Component(component.path(), props, nodes(component.children()), component.span());
        }
        if (node instanceof Text text) {
            List<TextSegment> segments = new ArrayList<>(text.segments().size());
            for (TextSegment segment : text.segments()) {
                if (segment instanceof TextSegment.Dynamic dynamic) {
                    segments.add(new TextSegment.Dynamic(next(dynamic.slot())));
                } else {
                    segments.add(segment);
                }
            }
            return new Text(segments, text.span());
        }
        if (node instanceof Expression expression) {
            return new Expression(next(expression.slot()), expression.span());
        }
        if (node instanceof Conditional conditional) {
            List<Conditional.Branch> branches = new ArrayList<>(conditional.branches().size());
            for (Conditional.Branch branch : conditional.branches()) {
                DynamicSlot guard = branch.isElse() ? null : next(branch.guard());
                branches.add(new Conditional.Branch(guard, body(branch.body())));
            }
            return new Conditional(branches, conditional.span());
        }
        if (node instanceof Loop loop) {
            DynamicSlot iterator = next(loop.iterator());
            return new Loop(loop.pattern(), iterator, body(loop.body()), loop.span());
        }
        throw new IllegalStateException("Unknown template node: " + node.getClass().getName());
    }

    private List<Attribute> attributes(List<Attribute> attributes) {
        List<Attribute> result = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            if (attribute.value() instanceof AttributeValue.Dynamic dynamic) {
                AttributeValue value = new AttributeValue.Dynamic(next(dynamic.slot()));
                result.add(new Attribute(attribute.name(), attribute.namespace(), value, attribute.span()));
            } else {
                result.add(attribute);
            }
        }
        return result;
    }

    private TemplateBody body(TemplateBody body) {
        return new TemplateBody(nodes(body.nodes()), body.span());
    }

    private DynamicSlot next(DynamicSlot slot) {
        DynamicSlot assigned = slot.withIndex(slots.size());
        slots.add(assigned);
        return assigned;
    }
}
