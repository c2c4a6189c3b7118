// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.tagging;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import ai.vespa.textlayers.resolve.ConflictResolverConfig;
import ai.vespa.textlayers.resolve.Strategy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static ai.vespa.textlayers.LayerFixtures.locations;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RegexTaggerTestCase {

    private static final String sentence = "Pi on 3.14 ja e on 2.72 ehk 3";

    private static final List<RegexTagger.Rule> numberRules =
            List.of(new RegexTagger.Rule("\\d+", Map.of("type", "integer"), 1),
                    new RegexTagger.Rule("\\d+\\.\\d+", Map.of("type", "decimal"), 0));

    @Test
    void requireThatBetterPrioritiesWin() {
        RegexTagger tagger = new RegexTagger("numbers", List.of("type"), numberRules, false, ConflictResolverConfig.defaults());
        assertEquals(List.of("type", "_priority_"), tagger.outputAttributes());
        assertTrue(tagger.inputLayers().isEmpty());

        Text text = tagger.tag(new Text(sentence));
        Layer numbers = text.layer("numbers");
        assertFalse(numbers.isAmbiguous());
        assertEquals(List.of("3.14", "2.72", "3"), numbers.text());
        assertEquals(List.of("decimal", "decimal", "integer"), numbers.values("type"));
        assertEquals(List.of(0, 0, 1), numbers.values("_priority_"));
    }

    @Test
    void requireThatTheStrategyChoosesAmongEqualPriorities() {
        List<RegexTagger.Rule> rules = List.of(new RegexTagger.Rule("\\d+", Map.of("type", "integer"), 0),
                                               new RegexTagger.Rule("\\d+\\.\\d+", Map.of("type", "decimal"), 0));
        ConflictResolverConfig shortest = new ConflictResolverConfig.Builder().strategy(Strategy.MIN).build();
        Layer numbers = new RegexTagger("numbers", List.of("type"), rules, false, shortest).makeLayer(new Text(sentence));
        assertEquals(List.of(List.of(6, 7), List.of(8, 10), List.of(19, 20), List.of(21, 23), List.of(28, 29)),
                     locations(numbers));

        ConflictResolverConfig longest = shortest.toBuilder().strategy(Strategy.MAX).build();
        numbers = new RegexTagger("numbers", List.of("type"), rules, false, longest).makeLayer(new Text(sentence));
        assertFalse(numbers.isBound());
        assertEquals(List.of(List.of(6, 10), List.of(19, 23), List.of(28, 29)), locations(numbers));
        numbers = new RegexTagger("numbers", List.of("type"), rules, false, longest).tag(new Text(sentence)).layer("numbers");
        assertEquals(List.of("3.14", "2.72", "3"), numbers.text());

        ConflictResolverConfig all = shortest.toBuilder().strategy(Strategy.ALL).build();
        numbers = new RegexTagger("numbers", List.of("type"), rules, false, all).makeLayer(new Text(sentence));
        assertEquals(7, numbers.size());
    }

    @Test
    void requireThatEqualMatchesAreKeptInAmbiguousLayers() {
        List<RegexTagger.Rule> rules = List.of(new RegexTagger.Rule("\\d+", Map.of("type", "number"), 0),
                                               new RegexTagger.Rule("[0-9]+", Map.of("type", "digits"), 0));
        Layer ambiguous = new RegexTagger("numbers", List.of("type"), rules, true, ConflictResolverConfig.defaults())
                .makeLayer(new Text("3 ja 4"));
        assertTrue(ambiguous.isAmbiguous());
        assertEquals(List.of(List.of("number", "digits"), List.of("number", "digits")), ambiguous.ambiguousValues("type"));

        Layer unambiguous = new RegexTagger("numbers", List.of("type"), rules, false, ConflictResolverConfig.defaults())
                .makeLayer(new Text("3 ja 4"));
        assertEquals(List.of("number", "number"), unambiguous.values("type"));
    }

    @Test
    void requireThatEmptyMatchesAreSkipped() {
        List<RegexTagger.Rule> rules = List.of(new RegexTagger.Rule("\\d*", Map.of("type", "number"), 0));
        RegexTagger tagger = new RegexTagger("numbers", List.of("type"), rules, false, ConflictResolverConfig.defaults());
        assertEquals(List.of(List.of(2, 4)), locations(tagger.makeLayer(new Text("a 12 b"))));
        assertEquals(List.of("12"), tagger.tag(new Text("a 12 b")).layer("numbers").text());
    }

    @Test
    void requireThatCandidateLayersMustHaveThePriorityAttribute() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ConflictResolvingTagger("numbers", List.of("type"), List.of(), false,
                                                       ConflictResolverConfig.defaults()) {
                         @Override
                         protected void addCandidates(Text text, Map<String, Layer> inputs, Layer candidates) { }
                     });
    }

}
