package io.lintsignal.analyzer;

/**
 * Advice view over an {@link AnalyzerActionIterator}.
 */
public final class CodeSuggestionAdviceIterator extends ExactSizeIterator<CodeSuggestionAdvice> {

    private final AnalyzerActionIterator source;

    CodeSuggestionAdviceIterator(AnalyzerActionIterator source) {
        this.source = source;
    }

    @Override
    public int remaining() {
        return source.remaining();
    }

    @Override
    public CodeSuggestionAdvice next() {
        return CodeSuggestionAdvice.from(source.next());
    }
}
