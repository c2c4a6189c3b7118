// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.operations;

import ai.vespa.textlayers.AttributeMismatchException;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Span;
import ai.vespa.textlayers.Text;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static ai.vespa.textlayers.LayerFixtures.annotationLocations;
import static ai.vespa.textlayers.LayerFixtures.locations;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LayerOperationsTestCase {

    private static Text text() {
        Text text = new Text("Tere,  kallis maailm! ");
        Layer words = new Layer.Builder("words").attributes("normalized").build();
        words.addSpan(0, 4, Map.of("normalized", "tere"));
        words.addSpan(7, 13, Map.of("normalized", "kallis"));
        words.addSpan(14, 20, Map.of("normalized", "maailm"));
        text.addLayer(words);
        Layer punctuation = new Layer.Builder("punctuation").build();
        punctuation.addSpan(20, 21, Map.of());
        text.addLayer(punctuation);
        return text;
    }

    @Test
    void requireThatEnvelopingLayersAreFlattened() {
        Text text = text();
        Layer phrases = new Layer.Builder("phrases").attributes("type").enveloping("words").build();
        phrases.addEnvelopingSpan(List.of(Span.of(0, 4), Span.of(14, 20)), Map.of("type", "greeting"));
        text.addLayer(phrases);

        Layer flat = LayerOperations.flatten(phrases, "flat_phrases");
        assertEquals("flat_phrases", flat.name());
        assertFalse(flat.isBound());
        assertTrue(flat.enveloping().isEmpty());
        assertEquals(List.of("type"), flat.attributeNames());
        assertEquals(List.of(List.of(0, 20)), locations(flat));
        assertEquals(List.of("greeting"), flat.values("type"));
        assertEquals(2, phrases.get(0).span().children().size());
    }

    @Test
    void requireThatMergingKeepsAllAnnotations() {
        Layer a = new Layer.Builder("a").attributes("tag").build();
        a.addSpan(0, 4, Map.of("tag", "x"));
        a.addSpan(5, 7, Map.of("tag", "y"));
        Layer b = new Layer.Builder("b").attributes("tag").build();
        b.addSpan(0, 4, Map.of("tag", "z"));
        b.addSpan(2, 3, Map.of("tag", "w"));

        Layer merged = LayerOperations.merge("merged", List.of(a, b));
        assertTrue(merged.isAmbiguous());
        assertEquals(List.of(List.of(0, 4), List.of(0, 4), List.of(2, 3), List.of(5, 7)), annotationLocations(merged));
        assertEquals(List.of(List.of("x", "z"), List.of("w"), List.of("y")), merged.ambiguousValues("tag"));
        assertEquals(2, a.size());

        Layer other = new Layer.Builder("c").attributes("label").build();
        assertThrows(AttributeMismatchException.class, () -> LayerOperations.merge("merged", List.of(a, other)));
        assertThrows(IllegalArgumentException.class, () -> LayerOperations.merge("merged", List.of()));
    }

    @Test
    void requireThatGapsAreTheUncoveredText() {
        Text text = text();
        Layer untrimmed = LayerOperations.gaps(text, "gaps", List.of("words", "punctuation"), false);
        assertEquals(List.of(List.of(4, 7), List.of(13, 14), List.of(21, 22)), locations(untrimmed));
        assertEquals(List.of(3, 1, 1), untrimmed.values(LayerOperations.gapLength));

        Layer trimmed = LayerOperations.gaps(text, "gaps", List.of("words", "punctuation"), true);
        assertEquals(List.of(List.of(4, 5)), locations(trimmed));
        assertEquals(List.of(1), trimmed.values(LayerOperations.gapLength));

        text.addLayer(trimmed);
        assertEquals(List.of(","), trimmed.text());

        Layer onlyWords = LayerOperations.gaps(text, "word_gaps", List.of("words"), true);
        assertEquals(List.of(List.of(4, 5), List.of(20, 21)), locations(onlyWords));
    }

    @Test
    void requireThatDiffFindsAddedRemovedAndChangedSpans() {
        Layer a = new Layer.Builder("a").attributes("tag").build();
        a.addSpan(0, 4, Map.of("tag", "x"));
        a.addSpan(5, 7, Map.of("tag", "y"));
        a.addSpan(8, 9, Map.of("tag", "v"));
        Layer b = new Layer.Builder("b").attributes("tag").build();
        b.addSpan(0, 4, Map.of("tag", "x"));
        b.addSpan(5, 7, Map.of("tag", "z"));
        b.addSpan(10, 12, Map.of("tag", "w"));

        LayerDiff diff = LayerOperations.diff(a, b);
        assertFalse(diff.isEmpty());
        assertEquals(List.of(Span.of(8, 9)), diff.onlyInA());
        assertEquals(List.of(Span.of(10, 12)), diff.onlyInB());
        assertEquals(List.of(Span.of(5, 7)), diff.changed());

        LayerDiff none = LayerOperations.diff(a, a.copy());
        assertTrue(none.isEmpty());
        assertEquals("no differences between 'a' and 'a'", none.toString());
    }

}
