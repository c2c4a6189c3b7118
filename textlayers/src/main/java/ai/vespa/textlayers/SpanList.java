// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import com.google.common.collect.ImmutableList;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.Predicate;

/**
 * An immutable, ordered selection of the spans of a single layer, with column access to their attributes.
 * Selections preserve the order of the layer.
 */
public final class SpanList extends AbstractList<AnnotatedSpan> implements RandomAccess {

    private final Layer layer;
    private final ImmutableList<AnnotatedSpan> spans;

    SpanList(Layer layer, List<AnnotatedSpan> spans) {
        this.layer = layer;
        this.spans = ImmutableList.copyOf(spans);
    }

    /** Returns the layer these spans belong to */
    public Layer layer() { return layer; }

    @Override
    public AnnotatedSpan get(int index) { return spans.get(index); }

    @Override
    public int size() { return spans.size(); }

    /** Returns the spans from index from (inclusive) to index to (exclusive) */
    public SpanList slice(int from, int to) {
        return new SpanList(layer, spans.subList(from, to));
    }

    /** Returns every step'th span from index from (inclusive) to index to (exclusive), or to the end if to is larger */
    public SpanList slice(int from, int to, int step) {
        if (step < 1) throw new IllegalArgumentException("Step must be positive, got " + step);
        if (from < 0 || from > to) throw new IndexOutOfBoundsException("Illegal slice [" + from + ", " + to + ")");
        List<AnnotatedSpan> selected = new ArrayList<>();
        for (int i = from; i < Math.min(to, spans.size()); i += step)
            selected.add(spans.get(i));
        return new SpanList(layer, selected);
    }

    /** Returns the spans accepted by the given predicate. The result may be empty. */
    public SpanList select(Predicate<? super AnnotatedSpan> predicate) {
        List<AnnotatedSpan> selected = new ArrayList<>();
        for (AnnotatedSpan span : spans)
            if (predicate.test(span))
                selected.add(span);
        return new SpanList(layer, selected);
    }

    /**
     * Returns the spans at the positions where the given mask is true. The result may be empty.
     *
     * @throws IllegalArgumentException if the mask does not have one entry per span
     */
    public SpanList select(boolean ... mask) {
        if (mask.length != spans.size())
            throw new IllegalArgumentException("Mask of length " + mask.length + " applied to " + spans.size() + " spans");
        List<AnnotatedSpan> selected = new ArrayList<>();
        for (int i = 0; i < mask.length; i++)
            if (mask[i])
                selected.add(spans.get(i));
        return new SpanList(layer, selected);
    }

    /**
     * Returns the spans at the given indexes, in the order of the layer.
     *
     * @throws IndexOutOfBoundsException if no indexes are given, or any is out of bounds
     */
    public SpanList select(int ... indexes) {
        if (indexes.length == 0)
            throw new IndexOutOfBoundsException("No indexes given");
        boolean[] mask = new boolean[spans.size()];
        for (int index : indexes)
            mask[checkIndex(index)] = true;
        return select(mask);
    }

    /**
     * Returns the value of the given attribute of each span.
     *
     * @throws UnknownAttributeException if the attribute is not declared by the layer
     * @throws IllegalStateException if the layer is ambiguous
     */
    public List<Object> values(String attribute) {
        return values(attribute, Object.class);
    }

    /** Returns the value of the given attribute of each span, cast to the given type */
    public <T> List<T> values(String attribute, Class<T> type) {
        layer.requireAttribute(attribute);
        if (layer.isAmbiguous())
            throw new IllegalStateException("Layer '" + layer.name() + "' is ambiguous: use ambiguousValues()");
        List<T> values = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans)
            values.add(span.annotation().get(attribute, type));
        return values;
    }

    /**
     * Returns the values of the given attribute of each annotation, one list per span.
     * For an unambiguous layer each list has a single element.
     */
    public List<List<Object>> ambiguousValues(String attribute) {
        layer.requireAttribute(attribute);
        List<List<Object>> values = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans)
            values.add(span.values(attribute));
        return values;
    }

    /**
     * Returns the values of the given attributes of each span of an unambiguous layer,
     * as one list per span holding the values in the order the attributes are given.
     */
    public List<List<Object>> tuples(String ... attributes) {
        for (String attribute : attributes)
            layer.requireAttribute(attribute);
        List<List<Object>> tuples = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans) {
            List<Object> tuple = new ArrayList<>(attributes.length);
            for (String attribute : attributes)
                tuple.add(span.get(attribute));
            tuples.add(tuple);
        }
        return tuples;
    }

    /** Returns the text of each span. Throws {@link UnboundException} if the layer is not attached to a text. */
    public List<String> text() {
        List<String> texts = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans)
            texts.add(span.text());
        return texts;
    }

    /** Returns the texts of each span: one per child for enveloping spans */
    public List<List<String>> texts() {
        List<List<String>> texts = new ArrayList<>(spans.size());
        for (AnnotatedSpan span : spans)
            texts.add(span.texts());
        return texts;
    }

    private int checkIndex(int index) {
        if (index < 0 || index >= spans.size())
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for " + spans.size() + " spans");
        return index;
    }

}
