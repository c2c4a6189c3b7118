// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.AnnotatedSpan;
import ai.vespa.textlayers.Annotation;
import ai.vespa.textlayers.ConsistencyException;
import ai.vespa.textlayers.EnvelopingSpan;
import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Span;
import ai.vespa.textlayers.TextLayerException;
import ai.vespa.textlayers.Topology;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts layers to and from their record form, a JSON tree:
 *
 * <pre>
 * { "name": "words", "attributes": ["lemma"], "parent": null, "enveloping": null, "fragment_of": null,
 *   "ambiguous": false, "default_values": { "lemma": null },
 *   "spans": [ { "base_span": [0, 5], "annotations": [ { "lemma": "hello" } ] } ] }
 * </pre>
 *
 * The base span of an enveloping span is the list of the base spans of its children.
 * All keys are always written. Reading a record validates it completely: every record written from a
 * valid layer is read back to an equal layer, and anything else is rejected with a {@link ConsistencyException}.
 */
public final class LayerRecords {

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private static final Set<String> layerKeys = Set.of("name", "attributes", "parent", "enveloping", "fragment_of",
                                                        "ambiguous", "default_values", "spans");
    private static final Set<String> spanKeys = Set.of("base_span", "annotations");

    private LayerRecords() {}

    /** Returns the record of the given layer */
    public static ObjectNode toRecord(Layer layer) {
        ObjectNode record = nodes.objectNode();
        record.put("name", layer.name());
        ArrayNode attributes = record.putArray("attributes");
        layer.attributeNames().forEach(attributes::add);
        record.put("parent", layer.parent().orElse(null));
        record.put("enveloping", layer.enveloping().orElse(null));
        record.put("fragment_of", layer.fragmentOf().orElse(null));
        record.put("ambiguous", layer.isAmbiguous());
        ObjectNode defaults = record.putObject("default_values");
        layer.defaults().forEach((attribute, value) -> defaults.set(attribute, toNode(value)));
        ArrayNode spans = record.putArray("spans");
        for (AnnotatedSpan span : layer) {
            ObjectNode spanRecord = spans.addObject();
            spanRecord.set("base_span", baseSpan(span.span()));
            ArrayNode annotations = spanRecord.putArray("annotations");
            for (Annotation annotation : span.annotations()) {
                ObjectNode values = annotations.addObject();
                annotation.asMap().forEach((attribute, value) -> values.set(attribute, toNode(value)));
            }
        }
        return record;
    }

    private static ArrayNode baseSpan(Span span) {
        ArrayNode node = nodes.arrayNode();
        if (span.isEnveloping()) {
            for (Span child : span.children())
                node.add(baseSpan(child));
        }
        else {
            node.add(span.start());
            node.add(span.end());
        }
        return node;
    }

    /**
     * Returns the unattached layer described by the given record.
     *
     * @throws ConsistencyException if the record is malformed or describes an invalid layer
     */
    public static Layer fromRecord(JsonNode record) {
        String name = record != null && record.path("name").isTextual() ? record.get("name").asText() : "?";
        try {
            return readLayer(name, record);
        }
        catch (ConsistencyException e) {
            throw e;
        }
        catch (TextLayerException | IllegalArgumentException e) {
            throw new ConsistencyException(name, null, e.getMessage(), e);
        }
    }

    private static Layer readLayer(String name, JsonNode record) {
        if (record == null || ! record.isObject())
            throw new ConsistencyException(name, "A layer record must be an object");
        requireKeys(name, record, layerKeys, "layer record");

        Layer.Builder builder = new Layer.Builder(text(name, record, "name", false));
        List<String> attributes = new ArrayList<>();
        for (JsonNode attribute : array(name, record, "attributes")) {
            if ( ! attribute.isTextual())
                throw new ConsistencyException(name, "Attribute names must be strings, got " + attribute);
            attributes.add(attribute.asText());
        }
        builder.attributes(attributes);
        builder.topology(topology(name, record));
        if ( ! record.get("ambiguous").isBoolean())
            throw new ConsistencyException(name, "'ambiguous' must be a boolean");
        boolean ambiguous = record.get("ambiguous").asBoolean();
        builder.ambiguous(ambiguous);
        JsonNode defaults = record.get("default_values");
        if ( ! defaults.isObject())
            throw new ConsistencyException(name, "'default_values' must be an object");
        if ( ! fieldNames(defaults).equals(new HashSet<>(attributes)))
            throw new ConsistencyException(name, "'default_values' must have a value for exactly the attributes " + attributes);
        for (String attribute : attributes)
            builder.defaultValue(attribute, toValue(defaults.get(attribute)));
        Layer layer = builder.build();

        Span previous = null;
        for (JsonNode spanRecord : array(name, record, "spans")) {
            if ( ! spanRecord.isObject())
                throw new ConsistencyException(name, "A span record must be an object, got " + spanRecord);
            requireKeys(name, spanRecord, spanKeys, "span record");
            Span span = span(name, spanRecord.get("base_span"));
            if (previous != null && previous.compareTo(span) >= 0)
                throw new ConsistencyException(name, span, "Span is not ordered after " + previous);
            JsonNode annotations = spanRecord.get("annotations");
            if ( ! annotations.isArray() || annotations.isEmpty())
                throw new ConsistencyException(name, span, "'annotations' must be a non-empty array");
            if ( ! ambiguous && annotations.size() != 1)
                throw new ConsistencyException(name, span, "A span of an unambiguous layer must have exactly one annotation");
            for (JsonNode annotation : annotations)
                layer.addSpan(span, annotationValues(name, span, annotation, attributes));
            previous = span;
        }
        layer.checkSpanConsistency();
        return layer;
    }

    private static Topology topology(String name, JsonNode record) {
        List<Topology> topologies = new ArrayList<>();
        String parent = text(name, record, "parent", true);
        String enveloping = text(name, record, "enveloping", true);
        String fragmentOf = text(name, record, "fragment_of", true);
        if (parent != null) topologies.add(Topology.parent(parent));
        if (enveloping != null) topologies.add(Topology.enveloping(enveloping));
        if (fragmentOf != null) topologies.add(Topology.fragmentOf(fragmentOf));
        if (topologies.size() > 1)
            throw new ConsistencyException(name, "At most one of 'parent', 'enveloping' and 'fragment_of' can be set");
        return topologies.isEmpty() ? Topology.independent() : topologies.get(0);
    }

    private static Span span(String name, JsonNode node) {
        if (node == null || ! node.isArray() || node.isEmpty())
            throw new ConsistencyException(name, "'base_span' must be a non-empty array, got " + node);
        if (node.get(0).isArray()) {
            List<Span> children = new ArrayList<>();
            for (JsonNode child : node)
                children.add(span(name, child));
            return EnvelopingSpan.of(children);
        }
        if (node.size() != 2 || ! node.get(0).canConvertToInt() || ! node.get(1).canConvertToInt() ||
            ! node.get(0).isIntegralNumber() || ! node.get(1).isIntegralNumber())
            throw new ConsistencyException(name, "An elementary base span must be [start, end], got " + node);
        return Span.of(node.get(0).asInt(), node.get(1).asInt());
    }

    private static Map<String, Object> annotationValues(String name, Span span, JsonNode annotation, List<String> attributes) {
        if ( ! annotation.isObject())
            throw new ConsistencyException(name, span, "An annotation must be an object, got " + annotation);
        if ( ! fieldNames(annotation).equals(new HashSet<>(attributes)))
            throw new ConsistencyException(name, span, "Annotation " + annotation + " must have exactly the attributes " + attributes);
        Map<String, Object> values = new LinkedHashMap<>();
        for (String attribute : attributes)
            values.put(attribute, toValue(annotation.get(attribute)));
        return values;
    }

    private static void requireKeys(String name, JsonNode record, Set<String> keys, String description) {
        Set<String> present = fieldNames(record);
        if ( ! present.equals(keys))
            throw new ConsistencyException(name, "A " + description + " must have exactly the keys " + keys + ", got " + present);
    }

    private static String text(String name, JsonNode record, String key, boolean nullable) {
        JsonNode node = record.get(key);
        if (nullable && node.isNull()) return null;
        if ( ! node.isTextual())
            throw new ConsistencyException(name, "'" + key + "' must be a string" + (nullable ? " or null" : "") + ", got " + node);
        return node.asText();
    }

    private static JsonNode array(String name, JsonNode record, String key) {
        JsonNode node = record.get(key);
        if ( ! node.isArray())
            throw new ConsistencyException(name, "'" + key + "' must be an array, got " + node);
        return node;
    }

    private static Set<String> fieldNames(JsonNode node) {
        Set<String> names = new HashSet<>();
        for (Iterator<String> i = node.fieldNames(); i.hasNext(); )
            names.add(i.next());
        return names;
    }

    static JsonNode toNode(Object value) {
        return Jackson.mapper().valueToTree(value);
    }

    static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return Jackson.mapper().convertValue(node, Object.class);
    }

}
