package io.lintsignal.analyzer;

/**
 * Flat suggestion view over an {@link AnalyzerActionIterator}.
 */
public final class CodeActionIterator extends ExactSizeIterator<CodeSuggestionItem> {

    private final AnalyzerActionIterator source;

    CodeActionIterator(AnalyzerActionIterator source) {
        this.source = source;
    }

    @Override
    public int remaining() {
        return source.remaining();
    }

    @Override
    public CodeSuggestionItem next() {
        return CodeSuggestionItem.from(source.next());
    }
}
