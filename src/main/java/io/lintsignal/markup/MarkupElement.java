package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of an element, either {@code <name ...>...</name>} or {@code <name ... />}.
 *
 * @param node The {@link MarkupKind#ELEMENT} or {@link MarkupKind#SELF_CLOSING_ELEMENT} node
 */
public record MarkupElement(SyntaxNode node) {

    public static Optional<MarkupElement> cast(SyntaxNode node) {
        if (node.kind() instanceof MarkupKind kind && kind.isElement()) {
            return Optional.of(new MarkupElement(node));
        }
        return Optional.empty();
    }

    public boolean isSelfClosing() {
        return node.kind() == MarkupKind.SELF_CLOSING_ELEMENT;
    }

    /**
     * The node holding the name and attributes.
     */
    public SyntaxNode openingTag() {
        if (isSelfClosing()) {
            return node;
        }
        return node.childNode(MarkupKind.OPENING_ELEMENT)
                .orElseThrow(() -> new IllegalStateException("Element without opening tag: " + node));
    }

    public SyntaxToken nameToken() {
        return openingTag().childToken(MarkupKind.NAME)
                .orElseThrow(() -> new IllegalStateException("Element without name: " + node));
    }

    public String name() {
        return nameToken().text();
    }

    /**
     * True for plain lower-case names such as {@code div}, false for components ({@code Button})
     * and member or namespaced names ({@code ui.Button}, {@code svg:rect}).
     */
    public boolean isHtmlElement() {
        String name = name();
        return !name.isEmpty()
                && Character.isLowerCase(name.charAt(0))
                && name.indexOf('.') < 0
                && name.indexOf(':') < 0;
    }

    public List<MarkupAttribute> attributes() {
        List<MarkupAttribute> attributes = new ArrayList<>();
        openingTag().childNode(MarkupKind.ATTRIBUTE_LIST).ifPresent(list -> {
            for (SyntaxNode child : list.childNodes()) {
                MarkupAttribute.cast(child).ifPresent(attributes::add);
            }
        });
        return attributes;
    }

    public Optional<MarkupAttribute> findAttribute(String name) {
        return attributes().stream()
                .filter(attribute -> attribute.name().equals(name))
                .findFirst();
    }

    /**
     * Attributes whose value is known statically, by name. Bare attributes map to {@code "true"}.
     */
    public Map<String, String> staticAttributes() {
        Map<String, String> result = new LinkedHashMap<>();
        for (MarkupAttribute attribute : attributes()) {
            if (attribute.value().isEmpty()) {
                result.put(attribute.name(), "true");
            } else {
                attribute.staticValue().ifPresent(value -> result.put(attribute.name(), value));
            }
        }
        return result;
    }

    /**
     * Direct child elements; always empty for a self-closing element.
     */
    public List<MarkupElement> children() {
        List<MarkupElement> children = new ArrayList<>();
        node.childNode(MarkupKind.ELEMENT_LIST).ifPresent(list -> {
            for (SyntaxNode child : list.childNodes()) {
                cast(child).ifPresent(children::add);
            }
        });
        return children;
    }
}
