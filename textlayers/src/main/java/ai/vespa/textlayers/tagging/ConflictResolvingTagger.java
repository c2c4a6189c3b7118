// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.AnnotatedSpan;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.resolve.ConflictResolver;
import ai.vespa.textlayers.resolve.ConflictResolverConfig;

import java.util.List;
import java.util.Map;

/**
 * A tagger which first collects possibly overlapping candidate spans, each with a priority,
 * and then resolves the conflicts between them to make its layer.
 */
public abstract class ConflictResolvingTagger extends Tagger {

    private final ConflictResolver resolver;
    private final boolean ambiguous;

    /**
     * @param outputAttributes the attributes of the output layer, which must include the priority attribute of the config
     * @param ambiguous whether the output layer is ambiguous. If not, only the first annotation
     *                  remaining at each location after conflict resolution is kept.
     */
    protected ConflictResolvingTagger(String outputLayer, List<String> outputAttributes, List<String> inputLayers,
                                      boolean ambiguous, ConflictResolverConfig config) {
        super(outputLayer, outputAttributes, inputLayers);
        if ( ! outputAttributes.contains(config.priorityAttribute()))
            throw new IllegalArgumentException("The attributes " + outputAttributes + " of " + this +
                                               " must include the priority attribute '" + config.priorityAttribute() + "'");
        this.resolver = new ConflictResolver(config);
        this.ambiguous = ambiguous;
    }

    /** Returns the priority attribute of the candidates */
    protected final String priorityAttribute() { return resolver.config().priorityAttribute(); }

    /** Adds the candidate spans of this to the given ambiguous layer */
    protected abstract void addCandidates(Text text, Map<String, Layer> inputs, Layer candidates);

    @Override
    protected final Layer makeLayer(Text text, Map<String, Layer> inputs) {
        Layer candidates = new Layer.Builder(outputLayer()).attributes(outputAttributes()).ambiguous(true).build();
        addCandidates(text, inputs, candidates);
        Layer resolved = resolver.resolve(candidates);
        if (ambiguous) return resolved;

        Layer layer = new Layer.Builder(outputLayer()).attributes(outputAttributes()).build();
        for (AnnotatedSpan span : resolved)
            layer.addSpan(span.span(), span.annotations().get(0).asMap());
        return layer;
    }

}
