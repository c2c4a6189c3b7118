// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.ConsistencyException;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.NoMatchingParentSpanException;
import ai.vespa.textlayers.Span;
import ai.vespa.textlayers.Text;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LayerRecordsTestCase {

    private static final ObjectMapper mapper = new ObjectMapper();

    static Text text() {
        Text text = new Text("Hello big world");
        text.meta().put("source", "greetings");
        text.meta().put("year", 2024);

        Layer words = new Layer.Builder("words").attributes("normalized", "count").defaultValue("count", 0).build();
        words.addSpan(0, 5, Map.of("normalized", "hello", "count", 1));
        words.addSpan(6, 9, values("normalized", null));
        words.addSpan(10, 15, Map.of("normalized", "world", "count", 2));
        text.addLayer(words);

        Layer analyses = new Layer.Builder("analyses").attributes("lemma", "features").ambiguous(true).parent("words").build();
        analyses.addSpan(0, 5, Map.of("lemma", "hello", "features", List.of("interj")));
        analyses.addSpan(0, 5, Map.of("lemma", "hello", "features", List.of("noun", "sg")));
        analyses.addSpan(10, 15, Map.of("lemma", "world", "features", Map.of("case", "nom")));
        text.addLayer(analyses);

        Layer phrases = new Layer.Builder("phrases").attributes("type").enveloping("words").build();
        phrases.addEnvelopingSpan(List.of(Span.of(0, 5), Span.of(10, 15)), Map.of("type", "greeting"));
        text.addLayer(phrases);

        Layer syllables = new Layer.Builder("syllables").attributes("stress").fragmentOf("words").build();
        syllables.addSpan(0, 3, Map.of("stress", true));
        syllables.addSpan(3, 5, Map.of("stress", false));
        syllables.addSpan(10, 15, Map.of("stress", 0.5));
        text.addLayer(syllables);
        return text;
    }

    private static Map<String, Object> values(String attribute, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(attribute, value);
        return values;
    }

    private static JsonNode json(String singleQuoted) throws Exception {
        return mapper.readTree(singleQuoted.replace('\'', '"'));
    }

    @Test
    void requireThatLayersOfAllTopologiesAreReadBackEqual() {
        for (Layer layer : text().layers()) {
            Layer read = LayerRecords.fromRecord(LayerRecords.toRecord(layer));
            assertEquals(layer, read, "Layer " + layer.name());
            assertFalse(read.isBound());
        }
    }

    @Test
    void requireThatRecordsHaveAllKeys() throws Exception {
        Text text = text();
        ObjectNode words = LayerRecords.toRecord(text.layer("words"));
        assertEquals(json("{'name':'words','attributes':['normalized','count'],'parent':null,'enveloping':null," +
                          "'fragment_of':null,'ambiguous':false,'default_values':{'normalized':null,'count':0}," +
                          "'spans':[{'base_span':[0,5],'annotations':[{'normalized':'hello','count':1}]}," +
                          "{'base_span':[6,9],'annotations':[{'normalized':null,'count':0}]}," +
                          "{'base_span':[10,15],'annotations':[{'normalized':'world','count':2}]}]}"),
                     words);

        ObjectNode phrases = LayerRecords.toRecord(text.layer("phrases"));
        assertEquals(json("[{'base_span':[[0,5],[10,15]],'annotations':[{'type':'greeting'}]}]"), phrases.get("spans"));
        assertEquals("words", phrases.get("enveloping").asText());
        assertEquals("words", LayerRecords.toRecord(text.layer("syllables")).get("fragment_of").asText());
        assertEquals(2, LayerRecords.toRecord(text.layer("analyses")).get("spans").get(0).get("annotations").size());
    }

    @Test
    void requireThatRecordsAreValidatedCompletely() throws Exception {
        String valid = "{'name':'words','attributes':['a'],'parent':null,'enveloping':null,'fragment_of':null," +
                       "'ambiguous':false,'default_values':{'a':null},'spans':[SPANS]}";
        assertEquals(2, LayerRecords.fromRecord(json(valid.replace("SPANS", "{'base_span':[0,1],'annotations':[{'a':1}]}," +
                                                                             "{'base_span':[2,3],'annotations':[{'a':2}]}"))).size());
        String empty = valid.replace("SPANS", "");
        assertEquals(0, LayerRecords.fromRecord(json(empty)).size());

        for (String invalid : Arrays.asList(
                "[]",
                "{'name':'words'}",
                empty.replace("'ambiguous':false", "'ambiguous':'no'"),
                empty.replace("'ambiguous':false", "'ambiguous':false,'extra':1"),
                empty.replace("'name':'words'", "'name':'1words'"),
                empty.replace("'attributes':['a']", "'attributes':['a','a']"),
                empty.replace("'attributes':['a']", "'attributes':['start']").replace("{'a':null}", "{'start':null}"),
                empty.replace("'parent':null,'enveloping':null", "'parent':'x','enveloping':'x'"),
                empty.replace("{'a':null}", "{}"),
                valid.replace("SPANS", "{'base_span':[2,3],'annotations':[{'a':1}]},{'base_span':[0,1],'annotations':[{'a':2}]}"),
                valid.replace("SPANS", "{'base_span':[0,1],'annotations':[{'a':1}]},{'base_span':[0,1],'annotations':[{'a':2}]}"),
                valid.replace("SPANS", "{'base_span':[0,1],'annotations':[{'a':1},{'a':2}]}"),
                valid.replace("SPANS", "{'base_span':[0,1],'annotations':[]}"),
                valid.replace("SPANS", "{'base_span':[0,1],'annotations':[{'b':1}]}"),
                valid.replace("SPANS", "{'base_span':[0,1],'annotations':[{'a':1,'b':1}]}"),
                valid.replace("SPANS", "{'base_span':[1,0],'annotations':[{'a':1}]}"),
                valid.replace("SPANS", "{'base_span':[0,1.5],'annotations':[{'a':1}]}"),
                valid.replace("SPANS", "{'base_span':[],'annotations':[{'a':1}]}"),
                valid.replace("SPANS", "{'base_span':[0,1]}"),
                valid.replace("SPANS", "{'base_span':[[0,1],[2,3]],'annotations':[{'a':1}]}"))) {
            assertThrows(ConsistencyException.class, () -> LayerRecords.fromRecord(json(invalid)), invalid);
        }
    }

    @Test
    void requireThatMalformedRecordsNameTheirLayer() throws Exception {
        ConsistencyException e = assertThrows(ConsistencyException.class,
                                              () -> LayerRecords.fromRecord(json("{'name':'words','spans':[]}")));
        assertEquals("words", e.layerName());
    }

    @Test
    void requireThatTextRecordsAttachLayersInOrder() {
        Text text = text();
        Text read = TextRecords.fromRecord(TextRecords.toRecord(text));
        assertEquals(text, read);
        assertEquals(List.of("words", "analyses", "phrases", "syllables"),
                     read.layers().stream().map(Layer::name).toList());
        assertTrue(read.layer("phrases").isBound());
        assertEquals(Map.of("source", "greetings", "year", 2024), read.meta());
        assertEquals("Hello big world", read.layer("phrases").get(0).text());
    }

    @Test
    void requireThatTextRecordsAreValidated() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> TextRecords.fromRecord(json("[]")));
        assertThrows(IllegalArgumentException.class, () -> TextRecords.fromRecord(json("{'meta':{}}")));
        assertThrows(IllegalArgumentException.class, () -> TextRecords.fromRecord(json("{'text':'a','meta':[]}")));
        assertThrows(IllegalArgumentException.class, () -> TextRecords.fromRecord(json("{'text':'a','layers':{}}")));
        assertEquals(new Text("a"), TextRecords.fromRecord(json("{'text':'a'}")));

        ObjectNode misaligned = TextRecords.toRecord(text());
        ArrayNode spans = (ArrayNode)misaligned.get("layers").get(1).get("spans");
        spans.set(1, json("{'base_span':[11,15],'annotations':[{'lemma':'x','features':null}]}"));
        assertThrows(NoMatchingParentSpanException.class, () -> TextRecords.fromRecord(misaligned));
    }

}
