// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;

/**
 * A private, freely mutable copy of the spans of a layer, handed to the code rewriting the layer in
 * {@link Layer#retag}. No invariant is enforced while it is modified: the layer audits the result and
 * replaces its spans with it as a whole, or rejects it and keeps its spans unchanged.
 */
public final class SpanStorage extends AbstractList<AnnotatedSpan> implements RandomAccess {

    private final Layer layer;
    private final List<AnnotatedSpan> spans;

    SpanStorage(Layer layer, List<AnnotatedSpan> spans) {
        this.layer = layer;
        this.spans = spans;
    }

    /** Returns the layer being rewritten */
    public Layer layer() { return layer; }

    /** Creates a span owned by the layer being rewritten. It is not added to this. */
    public AnnotatedSpan newSpan(Span span, List<Annotation> annotations) {
        return new AnnotatedSpan(layer, span, annotations);
    }

    /** Creates a span owned by the layer being rewritten. It is not added to this. */
    public AnnotatedSpan newSpan(Span span, Annotation annotation) {
        return newSpan(span, List.of(annotation));
    }

    /**
     * Creates an annotation from the given values with the defaults of the layer filled in.
     *
     * @throws AttributeMismatchException if an attribute is not declared by the layer
     */
    public Annotation newAnnotation(Map<String, ?> values) {
        return layer.toAnnotation(values);
    }

    /** Sorts the spans of this by location */
    public void sort() {
        spans.sort(Comparator.comparing(AnnotatedSpan::span));
    }

    @Override
    public AnnotatedSpan get(int index) { return spans.get(index); }

    @Override
    public AnnotatedSpan set(int index, AnnotatedSpan span) { return spans.set(index, span); }

    @Override
    public void add(int index, AnnotatedSpan span) { spans.add(index, span); }

    @Override
    public AnnotatedSpan remove(int index) { return spans.remove(index); }

    @Override
    public int size() { return spans.size(); }

    List<AnnotatedSpan> contents() { return new ArrayList<>(spans); }

}
