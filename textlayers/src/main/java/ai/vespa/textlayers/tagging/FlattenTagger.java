// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.operations.LayerOperations;

import java.util.List;
import java.util.Map;

/**
 * Makes an independent, elementary copy of a layer.
 *
 * @see LayerOperations#flatten
 */
public class FlattenTagger extends Tagger {

    private final String inputLayer;

    public FlattenTagger(String inputLayer, String outputLayer, List<String> attributes) {
        super(outputLayer, attributes, List.of(inputLayer));
        this.inputLayer = inputLayer;
    }

    @Override
    protected Layer makeLayer(Text text, Map<String, Layer> inputs) {
        return LayerOperations.flatten(inputs.get(inputLayer), outputLayer());
    }

}
