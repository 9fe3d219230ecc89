package io.lintsignal.analyzer;

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Sequence of transformations produced by one signal.
 */
public final class AnalyzerTransformationIterator extends ExactSizeIterator<AnalyzerTransformation> {

    private final List<AnalyzerTransformation> transformations;
    private int cursor;

    private AnalyzerTransformationIterator(List<AnalyzerTransformation> transformations) {
        this.transformations = transformations;
    }

    public static AnalyzerTransformationIterator empty() {
        return new AnalyzerTransformationIterator(List.of());
    }

    public static AnalyzerTransformationIterator of(Collection<AnalyzerTransformation> transformations) {
        return new AnalyzerTransformationIterator(List.copyOf(transformations));
    }

    public static AnalyzerTransformationIterator of(AnalyzerTransformation... transformations) {
        return new AnalyzerTransformationIterator(List.of(transformations));
    }

    @Override
    public int remaining() {
        return transformations.size() - cursor;
    }

    @Override
    public AnalyzerTransformation next() {
        if (cursor >= transformations.size()) {
            throw new NoSuchElementException();
        }
        return transformations.get(cursor++);
    }
}
