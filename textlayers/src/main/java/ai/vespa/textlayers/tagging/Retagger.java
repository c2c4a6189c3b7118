// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.MissingDependencyException;
import ai.vespa.textlayers.SpanStorage;
import ai.vespa.textlayers.Text;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites the spans of a layer already attached to a text.
 * The rewrite works on a private copy of the spans which replaces the spans of the layer only if
 * the result passes the consistency audit of the layer.
 *
 * @see Layer#retag
 */
public abstract class Retagger {

    private final String outputLayer;
    private final List<String> inputLayers;

    protected Retagger(String outputLayer, List<String> inputLayers) {
        this.outputLayer = Objects.requireNonNull(outputLayer, "outputLayer cannot be null");
        this.inputLayers = ImmutableList.copyOf(inputLayers);
    }

    /** Returns the name of the layer this rewrites */
    public String outputLayer() { return outputLayer; }

    /** Returns the names of the other layers this reads */
    public List<String> inputLayers() { return inputLayers; }

    /**
     * Rewrites the layer of this in the given text.
     *
     * @throws MissingDependencyException if the text lacks the layer of this or an input layer
     * @throws ai.vespa.textlayers.ConsistencyException if the rewritten layer is invalid, in which case it is unchanged
     */
    public final void retag(Text text) {
        if ( ! text.hasLayer(outputLayer))
            throw new MissingDependencyException(this + " rewrites layer '" + outputLayer + "' which is not in the text");
        Map<String, Layer> inputs = new LinkedHashMap<>();
        for (String input : inputLayers) {
            if ( ! text.hasLayer(input))
                throw new MissingDependencyException(this + " requires layer '" + input + "' which is not in the text");
            inputs.put(input, text.layer(input));
        }
        text.layer(outputLayer).retag(spans -> rewrite(spans, inputs));
    }

    /** Rewrites the given copy of the spans of the layer of this */
    protected abstract void rewrite(SpanStorage spans, Map<String, Layer> inputs);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + outputLayer + ")";
    }

}
