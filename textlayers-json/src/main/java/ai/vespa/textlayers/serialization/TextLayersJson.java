// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.Layer;
import ai.vespa.textlayers.Text;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads and writes texts and layers as JSON.
 */
public final class TextLayersJson {

    private static final Logger log = Logger.getLogger(TextLayersJson.class.getName());

    private final ObjectWriter writer;

    public TextLayersJson() {
        this(false);
    }

    /** Creates a JSON codec, writing indented JSON if pretty is true */
    public TextLayersJson(boolean pretty) {
        this.writer = pretty ? Jackson.mapper().writerWithDefaultPrettyPrinter() : Jackson.mapper().writer();
    }

    public String toJson(Text text) {
        return write(TextRecords.toRecord(text));
    }

    public String toJson(Layer layer) {
        return write(LayerRecords.toRecord(layer));
    }

    /** Returns the text of the given JSON. Throws IllegalArgumentException if it is not valid JSON. */
    public Text textFromJson(String json) {
        return TextRecords.fromRecord(parse(json));
    }

    /** Returns the unattached layer of the given JSON. Throws IllegalArgumentException if it is not valid JSON. */
    public Layer layerFromJson(String json) {
        return LayerRecords.fromRecord(parse(json));
    }

    /** Writes the given text to a file */
    public void write(Text text, Path file) {
        try {
            Files.writeString(file, toJson(text), UTF_8);
            log.log(Level.FINE, () -> "Wrote " + text + " to " + file);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    /** Reads a text from a file */
    public Text read(Path file) {
        try {
            return textFromJson(Files.readString(file, UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    private String write(JsonNode node) {
        try {
            return writer.writeValueAsString(node);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + node, e);
        }
    }

    private JsonNode parse(String json) {
        try {
            return Jackson.mapper().readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

}
