// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.operations;

import ai.vespa.textlayers.AnnotatedSpan;
import ai.vespa.textlayers.Annotation;
import ai.vespa.textlayers.AttributeMismatchException;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Span;
import ai.vespa.textlayers.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations creating new layers from existing ones. None of these modify their arguments,
 * and all return unattached layers.
 */
public final class LayerOperations {

    /** The attribute of gap layers holding the length of each gap */
    public static final String gapLength = "gap_length";

    private LayerOperations() {}

    /**
     * Returns an independent layer of elementary spans holding the annotations of the given layer.
     * Enveloping spans are replaced by the elementary span from their start to their end.
     */
    public static Layer flatten(Layer layer, String name) {
        Layer flat = new Layer.Builder(name).attributes(layer.attributeNames())
                                            .ambiguous(layer.isAmbiguous())
                                            .build();
        for (AnnotatedSpan span : layer)
            for (Annotation annotation : span.annotations())
                flat.addSpan(Span.of(span.start(), span.end()), annotation.asMap());
        return flat;
    }

    /**
     * Returns an ambiguous, independent layer holding every annotation of the given layers, flattened.
     * Annotations at the same location are kept in the order the layers are given.
     *
     * @throws AttributeMismatchException if the layers do not declare the same attributes in the same order
     * @throws IllegalArgumentException if no layers are given
     */
    public static Layer merge(String name, List<Layer> layers) {
        if (layers.isEmpty())
            throw new IllegalArgumentException("No layers to merge");
        List<String> attributes = layers.get(0).attributeNames();
        for (Layer layer : layers)
            if ( ! layer.attributeNames().equals(attributes))
                throw new AttributeMismatchException("Cannot merge layer '" + layer.name() + "' with attributes " +
                                                     layer.attributeNames() + " into a layer with attributes " + attributes);
        Layer merged = new Layer.Builder(name).attributes(attributes).ambiguous(true).build();
        for (Layer layer : layers)
            for (AnnotatedSpan span : layer)
                for (Annotation annotation : span.annotations())
                    merged.addSpan(Span.of(span.start(), span.end()), annotation.asMap());
        return merged;
    }

    /**
     * Returns a layer of the stretches of the text not covered by any span of the given layers of it.
     * Each span has the attribute {@link #gapLength}.
     *
     * @param trim whether to remove leading and trailing whitespace from each gap, skipping gaps of only whitespace
     */
    public static Layer gaps(Text text, String name, List<String> layerNames, boolean trim) {
        boolean[] covered = new boolean[text.text().length()];
        for (String layerName : layerNames)
            for (AnnotatedSpan span : text.layer(layerName))
                for (int i = span.start(); i < span.end(); i++)
                    covered[i] = true;

        Layer gaps = new Layer.Builder(name).attributes(gapLength).build();
        int start = -1;
        for (int i = 0; i <= covered.length; i++) {
            boolean inGap = i < covered.length && ! covered[i];
            if (inGap && start < 0) {
                start = i;
            }
            else if ( ! inGap && start >= 0) {
                addGap(gaps, text.text(), start, i, trim);
                start = -1;
            }
        }
        return gaps;
    }

    private static void addGap(Layer gaps, String text, int start, int end, boolean trim) {
        if (trim) {
            while (start < end && Character.isWhitespace(text.charAt(start))) start++;
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
            if (start == end) return;
        }
        gaps.addSpan(start, end, Map.of(gapLength, end - start));
    }

    /** Returns the differences between the spans of the given layers */
    public static LayerDiff diff(Layer a, Layer b) {
        List<Span> onlyInA = new ArrayList<>();
        List<Span> onlyInB = new ArrayList<>();
        List<Span> changed = new ArrayList<>();
        for (AnnotatedSpan span : a) {
            Optional<AnnotatedSpan> other = b.find(span.span());
            if (other.isEmpty())
                onlyInA.add(span.span());
            else if ( ! other.get().equals(span))
                changed.add(span.span());
        }
        for (AnnotatedSpan span : b)
            if (a.find(span.span()).isEmpty())
                onlyInB.add(span.span());
        return new LayerDiff(a.name(), b.name(), onlyInA, onlyInB, changed);
    }

}
