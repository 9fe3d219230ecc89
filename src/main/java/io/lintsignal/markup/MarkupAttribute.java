package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Typed view of an {@link MarkupKind#ATTRIBUTE} node.
 *
 * @param node The attribute node
 */
public record MarkupAttribute(SyntaxNode node) {

    public static Optional<MarkupAttribute> cast(SyntaxNode node) {
        return node.kind() == MarkupKind.ATTRIBUTE ? Optional.of(new MarkupAttribute(node)) : Optional.empty();
    }

    public String name() {
        return node.childToken(MarkupKind.NAME).map(token -> token.text()).orElse("");
    }

    /**
     * The value after {@code =}, empty for a bare attribute such as {@code <video controls />}.
     */
    public Optional<AttributeValue> value() {
        for (SyntaxNode child : node.childNodes()) {
            Optional<AttributeValue> value = AttributeValue.cast(child);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * The value when it is known without evaluation. A bare attribute has no static value.
     */
    public Optional<String> staticValue() {
        return value().flatMap(AttributeValue::staticValue);
    }
}
