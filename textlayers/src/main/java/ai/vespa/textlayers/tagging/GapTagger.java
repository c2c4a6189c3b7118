// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.operations.LayerOperations;

import java.util.List;
import java.util.Map;

/**
 * Tags the stretches of text not covered by the input layers.
 *
 * @see LayerOperations#gaps
 */
public class GapTagger extends Tagger {

    private final boolean trim;

    public GapTagger(String outputLayer, List<String> inputLayers, boolean trim) {
        super(outputLayer, List.of(LayerOperations.gapLength), inputLayers);
        this.trim = trim;
    }

    @Override
    protected Layer makeLayer(Text text, Map<String, Layer> inputs) {
        return LayerOperations.gaps(text, outputLayer(), inputLayers(), trim);
    }

}
