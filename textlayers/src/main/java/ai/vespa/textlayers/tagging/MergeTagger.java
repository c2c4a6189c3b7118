// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.operations.LayerOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merges layers with the same attributes into one ambiguous layer.
 *
 * @see LayerOperations#merge
 */
public class MergeTagger extends Tagger {

    public MergeTagger(String outputLayer, List<String> inputLayers, List<String> attributes) {
        super(outputLayer, attributes, inputLayers);
    }

    @Override
    protected Layer makeLayer(Text text, Map<String, Layer> inputs) {
        return LayerOperations.merge(outputLayer(), new ArrayList<>(inputs.values()));
    }

}
