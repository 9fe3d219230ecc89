package io.lintsignal.mutation;

import io.lintsignal.syntax.SyntaxElement;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates structural edits against one immutable syntax tree.
 * <p>
 * Targets are matched by identity and must belong to the root the batch was started from.
 * The batch can be committed into a new tree, or reduced to a single {@link TextEdit}
 * covering every changed region for display.
 * <p>
 * When a change targets an element inside another changed element, the outer change wins.
 */
public final class BatchMutation {

    private final SyntaxNode root;
    private final List<Change> changes = new ArrayList<>();

    /**
     * A single structural change. An empty replacement means the target is removed.
     *
     * @param target      Element of the original tree being changed
     * @param replacement New element, or empty for a removal
     */
    public record Change(SyntaxElement target, Optional<SyntaxElement> replacement) {
        public boolean isRemoval() {
            return replacement.isEmpty();
        }
    }

    private BatchMutation(SyntaxNode root) {
        this.root = root;
    }

    /**
     * Starts an empty batch against the given root.
     */
    public static BatchMutation begin(SyntaxNode root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        return new BatchMutation(root);
    }

    public SyntaxNode root() {
        return root;
    }

    public List<Change> changes() {
        return Collections.unmodifiableList(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * A new batch against the same root holding the same changes. Changes added to either batch
     * afterwards do not affect the other.
     */
    public BatchMutation copy() {
        BatchMutation copy = new BatchMutation(root);
        copy.changes.addAll(changes);
        return copy;
    }

    public BatchMutation replaceNode(SyntaxNode prev, SyntaxNode next) {
        return replaceElement(prev, next);
    }

    public BatchMutation replaceToken(SyntaxToken prev, SyntaxToken next) {
        return replaceElement(prev, next);
    }

    public BatchMutation removeNode(SyntaxNode node) {
        return removeElement(node);
    }

    public BatchMutation removeToken(SyntaxToken token) {
        return removeElement(token);
    }

    /**
     * Replaces {@code prev} with {@code next}. A later change to the same target overrides an earlier one.
     */
    public BatchMutation replaceElement(SyntaxElement prev, SyntaxElement next) {
        if (next == null) {
            throw new IllegalArgumentException("replacement cannot be null, use removeElement()");
        }
        if (prev == root && !(next instanceof SyntaxNode)) {
            throw new IllegalArgumentException("The root can only be replaced with a node");
        }
        return record(prev, Optional.of(next));
    }

    public BatchMutation removeElement(SyntaxElement element) {
        if (element == root) {
            throw new IllegalArgumentException("The root cannot be removed");
        }
        return record(element, Optional.empty());
    }

    private BatchMutation record(SyntaxElement target, Optional<SyntaxElement> replacement) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (!root.containsElement(target)) {
            throw new IllegalArgumentException("Element " + target + " does not belong to the mutation root");
        }
        changes.removeIf(change -> change.target() == target);
        changes.add(new Change(target, replacement));
        return this;
    }

    /**
     * Applies all changes and returns the new root, positioned where the original root was.
     * Subtrees without changes are shared with the original tree.
     */
    public SyntaxNode commit() {
        if (changes.isEmpty()) {
            return root;
        }
        Map<SyntaxElement, Change> byTarget = new IdentityHashMap<>();
        for (Change change : changes) {
            byTarget.put(change.target(), change);
        }
        SyntaxElement rewritten = rewrite(root, byTarget).orElseThrow();
        return ((SyntaxNode) rewritten).withOffset(root.offset());
    }

    private static Optional<SyntaxElement> rewrite(SyntaxElement element, Map<SyntaxElement, Change> byTarget) {
        Change change = byTarget.get(element);
        if (change != null) {
            return change.replacement();
        }
        if (!(element instanceof SyntaxNode node)) {
            return Optional.of(element);
        }
        List<SyntaxElement> children = new ArrayList<>(node.children().size());
        boolean changed = false;
        for (SyntaxElement child : node.children()) {
            Optional<SyntaxElement> result = rewrite(child, byTarget);
            if (result.isEmpty()) {
                changed = true;
                continue;
            }
            if (result.get() != child) {
                changed = true;
            }
            children.add(result.get());
        }
        return Optional.of(changed ? node.withChildren(children) : node);
    }

    /**
     * Reduces the batch to one edit: the range covering every changed element (trivia included)
     * and the text that range holds after the changes are committed.
     *
     * @return the edit, or empty if the batch has no changes
     */
    public Optional<TextEdit> asTextEdit() {
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        TextRange covered = changes.stream()
                .map(change -> change.target().textRange())
                .reduce(TextRange::cover)
                .orElseThrow();

        String oldText = root.fullText();
        String newText = commit().fullText();
        int prefix = covered.start() - root.offset();
        int suffix = oldText.length() - (covered.end() - root.offset());
        String replacement = newText.substring(prefix, newText.length() - suffix);
        return Optional.of(new TextEdit(covered, replacement));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatchMutation other)) return false;
        return root == other.root && changes.equals(other.changes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(root), changes);
    }

    @Override
    public String toString() {
        return "BatchMutation[" + changes.size() + " change(s) on " + root + "]";
    }
}
