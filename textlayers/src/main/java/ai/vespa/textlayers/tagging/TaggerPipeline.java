// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.MissingDependencyException;
import ai.vespa.textlayers.Text;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A list of taggers ordered such that each runs after the taggers making its input layers.
 * Taggers which do not depend on each other keep the order they are given in.
 */
public final class TaggerPipeline {

    private static final Logger log = Logger.getLogger(TaggerPipeline.class.getName());

    private final ImmutableList<Tagger> taggers;
    private final ImmutableSet<String> requiredLayers;

    private TaggerPipeline(List<Tagger> taggers) {
        Map<String, Tagger> producers = new LinkedHashMap<>();
        for (Tagger tagger : taggers) {
            Tagger previous = producers.put(tagger.outputLayer(), tagger);
            if (previous != null)
                throw new IllegalArgumentException("Both " + previous + " and " + tagger + " make layer '" +
                                                   tagger.outputLayer() + "'");
        }

        Set<String> required = new LinkedHashSet<>();
        for (Tagger tagger : taggers)
            for (String input : tagger.inputLayers())
                if ( ! producers.containsKey(input))
                    required.add(input);

        this.taggers = order(taggers, producers.keySet());
        this.requiredLayers = ImmutableSet.copyOf(required);
    }

    public static TaggerPipeline of(Tagger ... taggers) {
        return of(List.of(taggers));
    }

    /**
     * Creates a pipeline of the given taggers.
     *
     * @throws IllegalArgumentException if two taggers make the same layer, or taggers depend on each other in a cycle
     */
    public static TaggerPipeline of(List<Tagger> taggers) {
        return new TaggerPipeline(taggers);
    }

    /** Returns the taggers of this in the order they run */
    public List<Tagger> taggers() { return taggers; }

    /** Returns the layers which are read by the taggers of this but made by none of them */
    public Set<String> requiredLayers() { return requiredLayers; }

    /**
     * Runs all the taggers of this on the given text, attaching their layers in order.
     *
     * @return the text, for chaining
     * @throws MissingDependencyException if the text lacks some layer required by this. No tagger is run in this case.
     */
    public Text tag(Text text) {
        for (String layer : requiredLayers)
            if ( ! text.hasLayer(layer))
                throw new MissingDependencyException("The pipeline requires layer '" + layer + "', but the text has " +
                                                     text.layerNames());
        for (Tagger tagger : taggers) {
            log.log(Level.FINE, () -> "Running " + tagger);
            tagger.tag(text);
        }
        return text;
    }

    private static ImmutableList<Tagger> order(List<Tagger> taggers, Set<String> produced) {
        List<Tagger> remaining = new ArrayList<>(taggers);
        List<Tagger> ordered = new ArrayList<>(taggers.size());
        Set<String> made = new HashSet<>();
        while ( ! remaining.isEmpty()) {
            Tagger next = null;
            for (Tagger candidate : remaining) {
                if (candidate.inputLayers().stream().allMatch(input -> made.contains(input) || ! produced.contains(input))) {
                    next = candidate;
                    break;
                }
            }
            if (next == null)
                throw new IllegalArgumentException("The taggers " + remaining + " depend on each other in a cycle");
            remaining.remove(next);
            ordered.add(next);
            made.add(next.outputLayer());
        }
        return ImmutableList.copyOf(ordered);
    }

    @Override
    public String toString() {
        return "tagger pipeline " + taggers;
    }

}
