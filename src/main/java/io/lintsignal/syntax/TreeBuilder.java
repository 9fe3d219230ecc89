package io.lintsignal.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a syntax tree bottom-up from start/finish node events and tokens.
 * <p>
 * Example:
 * <pre>{@code
 * SyntaxNode root = new TreeBuilder()
 *         .startNode(Kind.ROOT)
 *         .token(Kind.NAME, "a")
 *         .finishNode()
 *         .build();
 * }</pre>
 * Offsets are assigned by {@link #build()}, so tokens can be pushed without knowing their position.
 */
public final class TreeBuilder {

    private final Deque<Frame> stack = new ArrayDeque<>();
    private SyntaxNode finished;

    private record Frame(SyntaxKind kind, List<SyntaxElement> children) {}

    public TreeBuilder startNode(SyntaxKind kind) {
        if (finished != null) {
            throw new IllegalStateException("Root node already finished");
        }
        stack.push(new Frame(kind, new ArrayList<>()));
        return this;
    }

    public TreeBuilder token(SyntaxKind kind, String text) {
        return token(kind, List.of(), text, List.of());
    }

    public TreeBuilder token(SyntaxKind kind, List<Trivia> leading, String text, List<Trivia> trailing) {
        return element(new SyntaxToken(kind, 0, leading, text, trailing));
    }

    /**
     * Pushes an already built element (node or token) as a child of the current node.
     */
    public TreeBuilder element(SyntaxElement element) {
        if (stack.isEmpty()) {
            throw new IllegalStateException("No open node to add " + element.kind().name() + " to");
        }
        stack.peek().children().add(element);
        return this;
    }

    public TreeBuilder finishNode() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("finishNode() without matching startNode()");
        }
        Frame frame = stack.pop();
        SyntaxNode node = new SyntaxNode(frame.kind(), 0, frame.children());
        if (stack.isEmpty()) {
            finished = node;
        } else {
            stack.peek().children().add(node);
        }
        return this;
    }

    /**
     * Returns the finished root, positioned at offset zero.
     */
    public SyntaxNode build() {
        if (!stack.isEmpty()) {
            throw new IllegalStateException(stack.size() + " node(s) still open");
        }
        if (finished == null) {
            throw new IllegalStateException("No root node was built");
        }
        return finished.withOffset(0);
    }
}
