// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.Optional;

/**
 * Thrown by a consistency audit of a layer, describing the first invariant found to be violated.
 */
public class ConsistencyException extends TextLayerException {

    private final String layerName;
    private final Span location;

    public ConsistencyException(String layerName, Span location, String message) {
        this(layerName, location, message, null);
    }

    public ConsistencyException(String layerName, Span location, String message, Throwable cause) {
        super("Layer '" + layerName + "'" + (location == null ? "" : " at " + location) + ": " + message, cause);
        this.layerName = layerName;
        this.location = location;
    }

    public ConsistencyException(String layerName, String message) {
        this(layerName, null, message);
    }

    /** Returns the name of the layer which failed the audit */
    public String layerName() { return layerName; }

    /** Returns the location of the offending span, if the violation concerns a single span */
    public Optional<Span> location() { return Optional.ofNullable(location); }

}
