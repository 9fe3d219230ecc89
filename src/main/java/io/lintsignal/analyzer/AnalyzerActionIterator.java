package io.lintsignal.analyzer;

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Sequence of actions produced by one signal, in the order the signal produced them.
 * <p>
 * The two views, {@link #intoCodeSuggestionAdvices()} and {@link #intoCodeActions()}, read from this
 * iterator: they share its cursor, so elements taken through a view are gone from the iterator and
 * from any other view. Call the signal's {@code actions()} again to get a fresh sequence.
 */
public final class AnalyzerActionIterator extends ExactSizeIterator<AnalyzerAction> {

    private final List<AnalyzerAction> actions;
    private int cursor;

    private AnalyzerActionIterator(List<AnalyzerAction> actions) {
        this.actions = List.copyOf(actions);
    }

    public static AnalyzerActionIterator empty() {
        return new AnalyzerActionIterator(List.of());
    }

    public static AnalyzerActionIterator of(Collection<AnalyzerAction> actions) {
        return new AnalyzerActionIterator(List.copyOf(actions));
    }

    public static AnalyzerActionIterator of(AnalyzerAction... actions) {
        return new AnalyzerActionIterator(List.of(actions));
    }

    @Override
    public int remaining() {
        return actions.size() - cursor;
    }

    @Override
    public AnalyzerAction next() {
        if (cursor >= actions.size()) {
            throw new NoSuchElementException();
        }
        return actions.get(cursor++);
    }

    /**
     * View yielding each remaining action as a {@link CodeSuggestionAdvice}.
     */
    public CodeSuggestionAdviceIterator intoCodeSuggestionAdvices() {
        return new CodeSuggestionAdviceIterator(this);
    }

    /**
     * View yielding each remaining action as a {@link CodeSuggestionItem}.
     */
    public CodeActionIterator intoCodeActions() {
        return new CodeActionIterator(this);
    }
}
