// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A span location of a layer together with its annotations. A location of an unambiguous layer
 * holds exactly one annotation, whose values are read directly with {@link #get}. A location of an
 * ambiguous layer holds one or more alternative annotations, read with {@link #values} or {@link #annotations}.
 *
 * <p>Spans are owned by a single layer. Equality is defined by location, enveloped children and annotations,
 * not by the owning layer.</p>
 */
public final class AnnotatedSpan {

    private final Layer layer;
    private final Span span;
    private final List<Annotation> annotations;

    AnnotatedSpan(Layer layer, Span span, List<Annotation> annotations) {
        this.layer = Objects.requireNonNull(layer);
        this.span = Objects.requireNonNull(span);
        this.annotations = new ArrayList<>(annotations);
    }

    /** Returns the layer owning this */
    public Layer layer() { return layer; }

    /** Returns the location of this */
    public Span span() { return span; }

    public int start() { return span.start(); }

    public int end() { return span.end(); }

    public int length() { return span.length(); }

    public boolean isEnveloping() { return span.isEnveloping(); }

    /** Returns the spans this envelops, or an empty list if this is not a span of an enveloping layer */
    public List<Span> children() { return span.children(); }

    /** Returns the annotations of this location, in the order they were added */
    public List<Annotation> annotations() { return Collections.unmodifiableList(annotations); }

    /**
     * Returns the single annotation of this location.
     *
     * @throws IllegalStateException if the layer of this is ambiguous
     */
    public Annotation annotation() {
        if (layer.isAmbiguous())
            throw new IllegalStateException(this + " belongs to ambiguous layer '" + layer.name() +
                                            "': use annotations()");
        return annotations.get(0);
    }

    /**
     * Returns the value of an attribute of the annotation of this unambiguous span.
     *
     * @throws UnknownAttributeException if the attribute is not declared by the layer
     * @throws IllegalStateException if the layer of this is ambiguous
     */
    public Object get(String attribute) {
        layer.requireAttribute(attribute);
        return annotation().get(attribute);
    }

    /** Returns the value of the given attribute of each annotation of this, in annotation order */
    public List<Object> values(String attribute) {
        layer.requireAttribute(attribute);
        List<Object> values = new ArrayList<>(annotations.size());
        for (Annotation annotation : annotations)
            values.add(annotation.get(attribute));
        return values;
    }

    /**
     * Returns the raw text this spans, from its start to its end. For an enveloping span this
     * includes the text between its children; use {@link #texts()} for the sequence of child texts.
     *
     * @throws UnboundException if the layer of this is not attached to a text
     */
    public String text() {
        return layer.textObject().text().substring(start(), end());
    }

    /**
     * Returns the texts of this: a single string for an elementary span and
     * the text of each child, in order, for an enveloping span.
     *
     * @throws UnboundException if the layer of this is not attached to a text
     */
    public List<String> texts() {
        return span.texts(layer.textObject().text());
    }

    /**
     * Returns the values of an attribute which is declared either by the layer of this or by a layer of the
     * same text which this layer is attached to (directly or transitively as a parent), or which is attached to this layer.
     * The values are those of the span at the same location in the providing layer, or empty if there is none.
     *
     * @throws UnknownAttributeException if no such layer declares the attribute
     * @throws UnboundException if the layer of this is not attached to a text
     */
    public List<Object> resolve(String attribute) {
        if (layer.attributeNames().contains(attribute)) return values(attribute);
        String provider = layer.foreignAttributes().get(attribute);
        if (provider == null)
            throw new UnknownAttributeException("Attribute '" + attribute + "' is neither declared by layer '" +
                                                layer.name() + "' nor by any layer it is attached to or from");
        return layer.textObject().layer(provider).find(span).map(s -> s.values(attribute)).orElse(List.of());
    }

    /**
     * Returns the span at the location of this in the given layer, which must be attached to the layer of this
     * as its parent. If the dependent layer has no span at this location, one is added with its default values.
     */
    public AnnotatedSpan mark(String layerName) {
        Layer dependent = layer.textObject().layer(layerName);
        if ( ! dependent.topology().equals(Topology.parent(layer.name())))
            throw new IllegalArgumentException("Layer '" + layerName + "' does not have '" + layer.name() + "' as parent");
        Optional<AnnotatedSpan> existing = dependent.find(span);
        return existing.orElseGet(() -> dependent.addSpan(span, Map.of()));
    }

    void addAnnotation(Annotation annotation) {
        annotations.add(annotation);
    }

    /** Returns a copy of this owned by the given layer */
    AnnotatedSpan copyTo(Layer owner) {
        return new AnnotatedSpan(owner, span, annotations);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof AnnotatedSpan other)) return false;
        return span.equals(other.span) && span.children().equals(other.span.children()) &&
               annotations.equals(other.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(span, annotations);
    }

    @Override
    public String toString() {
        return "AnnotatedSpan(" + layer.name() + ", " + span + ", " + annotations + ")";
    }

}
