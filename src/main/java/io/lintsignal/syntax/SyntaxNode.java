package io.lintsignal.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Interior node of the syntax tree.
 * Immutable; the text length is computed once at construction.
 */
public final class SyntaxNode implements SyntaxElement {

    private final SyntaxKind kind;
    private final int offset;
    private final List<SyntaxElement> children;
    private final int textLength;

    public SyntaxNode(SyntaxKind kind, int offset, List<SyntaxElement> children) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.offset = offset;
        this.children = children != null ? List.copyOf(children) : List.of();
        int length = 0;
        for (SyntaxElement child : this.children) {
            length += child.textLength();
        }
        this.textLength = length;
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public int offset() {
        return offset;
    }

    @Override
    public int textLength() {
        return textLength;
    }

    public List<SyntaxElement> children() {
        return children;
    }

    /**
     * Returns the direct children that are nodes.
     */
    public List<SyntaxNode> childNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * Returns the direct children that are tokens.
     */
    public List<SyntaxToken> childTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken token) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Returns the first direct child node of the given kind.
     */
    public Optional<SyntaxNode> childNode(SyntaxKind childKind) {
        return childNodes().stream()
                .filter(n -> n.kind() == childKind)
                .findFirst();
    }

    /**
     * Returns the first direct child token of the given kind.
     */
    public Optional<SyntaxToken> childToken(SyntaxKind childKind) {
        return childTokens().stream()
                .filter(t -> t.kind() == childKind)
                .findFirst();
    }

    /**
     * This node and all nodes below it, in pre-order.
     */
    public Stream<SyntaxNode> descendants() {
        return Stream.concat(
                Stream.of(this),
                childNodes().stream().flatMap(SyntaxNode::descendants)
        );
    }

    /**
     * All tokens below this node, in source order.
     */
    public Stream<SyntaxToken> descendantTokens() {
        return children.stream().flatMap(child -> {
            if (child instanceof SyntaxToken token) {
                return Stream.of(token);
            }
            return ((SyntaxNode) child).descendantTokens();
        });
    }

    public Optional<SyntaxToken> firstToken() {
        return descendantTokens().findFirst();
    }

    public Optional<SyntaxToken> lastToken() {
        return descendantTokens().reduce((first, second) -> second);
    }

    /**
     * Returns true if the given element is this node or lies below it. Compares by identity.
     */
    public boolean containsElement(SyntaxElement element) {
        if (element == this) {
            return true;
        }
        if (!textRange().contains(element.textRange()) && !element.textRange().isEmpty()) {
            return false;
        }
        for (SyntaxElement child : children) {
            if (child == element) {
                return true;
            }
            if (child instanceof SyntaxNode node && node.containsElement(element)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String fullText() {
        StringBuilder sb = new StringBuilder(textLength);
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                node.appendText(sb);
            } else {
                sb.append(child.fullText());
            }
        }
    }

    @Override
    public String trimmedText() {
        TextRange trimmed = textTrimmedRange();
        return fullText().substring(trimmed.start() - offset, trimmed.end() - offset);
    }

    @Override
    public TextRange textTrimmedRange() {
        Optional<SyntaxToken> first = firstToken();
        Optional<SyntaxToken> last = lastToken();
        if (first.isEmpty() || last.isEmpty()) {
            return TextRange.at(offset);
        }
        return TextRange.of(first.get().textTrimmedRange().start(), last.get().textTrimmedRange().end());
    }

    @Override
    public SyntaxNode withOffset(int newOffset) {
        return new SyntaxNode(kind, newOffset, reposition(children, newOffset));
    }

    /**
     * Returns a copy of this node, at the same offset, with the given children.
     */
    public SyntaxNode withChildren(List<SyntaxElement> newChildren) {
        return new SyntaxNode(kind, offset, reposition(newChildren, offset));
    }

    private static List<SyntaxElement> reposition(List<SyntaxElement> elements, int start) {
        List<SyntaxElement> positioned = new ArrayList<>(elements.size());
        int position = start;
        for (SyntaxElement element : elements) {
            positioned.add(element.offset() == position && isPositioned(element)
                    ? element
                    : element.withOffset(position));
            position += element.textLength();
        }
        return positioned;
    }

    private static boolean isPositioned(SyntaxElement element) {
        if (element instanceof SyntaxNode node) {
            int position = node.offset;
            for (SyntaxElement child : node.children) {
                if (child.offset() != position || !isPositioned(child)) {
                    return false;
                }
                position += child.textLength();
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode other)) return false;
        return offset == other.offset
                && kind == other.kind
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, offset, children);
    }

    @Override
    public String toString() {
        return kind.name() + "@" + textRange();
    }
}
