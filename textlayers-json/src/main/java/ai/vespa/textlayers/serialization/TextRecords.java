// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.ConsistencyException;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Converts texts to and from their record form: {"text": ..., "meta": {...}, "layers": [...]},
 * where the layers are the records of {@link LayerRecords} in the order they were attached.
 */
public final class TextRecords {

    private TextRecords() {}

    /** Returns the record of the given text and all its layers */
    public static ObjectNode toRecord(Text text) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        record.put("text", text.text());
        ObjectNode meta = record.putObject("meta");
        text.meta().forEach((key, value) -> meta.set(key, LayerRecords.toNode(value)));
        ArrayNode layers = record.putArray("layers");
        for (Layer layer : text.layers())
            layers.add(LayerRecords.toRecord(layer));
        return record;
    }

    /**
     * Returns the text described by the given record, with its layers attached in order.
     *
     * @throws IllegalArgumentException if the record is not a text record
     * @throws ConsistencyException if a layer record is malformed
     * @throws ai.vespa.textlayers.DependencyException if a layer does not fit the layer it depends on
     */
    public static Text fromRecord(JsonNode record) {
        if (record == null || ! record.isObject())
            throw new IllegalArgumentException("A text record must be an object");
        if ( ! record.path("text").isTextual())
            throw new IllegalArgumentException("A text record must have a string 'text'");
        Text text = new Text(record.get("text").asText());

        JsonNode meta = record.path("meta");
        if ( ! meta.isMissingNode()) {
            if ( ! meta.isObject())
                throw new IllegalArgumentException("'meta' must be an object, got " + meta);
            for (Iterator<Map.Entry<String, JsonNode>> i = meta.fields(); i.hasNext(); ) {
                Map.Entry<String, JsonNode> field = i.next();
                text.meta().put(field.getKey(), LayerRecords.toValue(field.getValue()));
            }
        }

        JsonNode layers = record.path("layers");
        if ( ! layers.isMissingNode()) {
            if ( ! layers.isArray())
                throw new IllegalArgumentException("'layers' must be an array, got " + layers);
            for (JsonNode layer : layers)
                text.addLayer(LayerRecords.fromRecord(layer));
        }
        return text;
    }

}
