// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.AttributeMismatchException;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.MissingDependencyException;
import ai.vespa.textlayers.Text;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces a new layer of a text from layers already in it.
 *
 * <p>A tagger declares the name and attributes of the layer it makes and the layers it reads.
 * Subclasses implement {@link #makeLayer(Text, Map)}, which is only invoked when all input layers are present.
 * The layer returned is checked against the declaration and audited before it is returned or attached.</p>
 */
public abstract class Tagger {

    private static final Logger log = Logger.getLogger(Tagger.class.getName());

    private final String outputLayer;
    private final List<String> outputAttributes;
    private final List<String> inputLayers;

    protected Tagger(String outputLayer, List<String> outputAttributes, List<String> inputLayers) {
        this.outputLayer = Objects.requireNonNull(outputLayer, "outputLayer cannot be null");
        this.outputAttributes = ImmutableList.copyOf(outputAttributes);
        this.inputLayers = ImmutableList.copyOf(inputLayers);
    }

    /** Returns the name of the layer this makes */
    public String outputLayer() { return outputLayer; }

    /** Returns the attributes of the layer this makes, in order */
    public List<String> outputAttributes() { return outputAttributes; }

    /** Returns the names of the layers this reads */
    public List<String> inputLayers() { return inputLayers; }

    /**
     * Makes the layer of this for the given text, without attaching it.
     *
     * @throws MissingDependencyException if an input layer is not in the text
     * @throws IllegalStateException if the layer made does not match the declaration of this
     */
    public final Layer makeLayer(Text text) {
        Map<String, Layer> inputs = new LinkedHashMap<>();
        for (String input : inputLayers) {
            if ( ! text.hasLayer(input))
                throw new MissingDependencyException(this + " requires layer '" + input + "', but the text has " +
                                                     text.layerNames());
            inputs.put(input, text.layer(input));
        }
        Layer layer = makeLayer(text, inputs);
        if ( ! layer.name().equals(outputLayer))
            throw new IllegalStateException(this + " made layer '" + layer.name() + "', not '" + outputLayer + "'");
        if ( ! layer.attributeNames().equals(outputAttributes))
            throw new AttributeMismatchException(this + " made a layer with attributes " + layer.attributeNames() +
                                                 ", not " + outputAttributes);
        if (layer.isBound())
            throw new IllegalStateException(this + " returned an attached layer");
        layer.checkSpanConsistency();
        log.log(Level.FINE, () -> this + " made " + layer.size() + " spans");
        return layer;
    }

    /**
     * Makes the layer of this and attaches it to the given text.
     *
     * @return the text, for chaining
     */
    public final Text tag(Text text) {
        return text.addLayer(makeLayer(text));
    }

    /**
     * Makes the layer of this.
     *
     * @param text the text to tag
     * @param inputs the input layers of this, by name
     * @return a new, unattached layer named by {@link #outputLayer()} with the attributes given by {@link #outputAttributes()}
     */
    protected abstract Layer makeLayer(Text text, Map<String, Layer> inputs);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + inputLayers + " -> " + outputLayer + ")";
    }

}
