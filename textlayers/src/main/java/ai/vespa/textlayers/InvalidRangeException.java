// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a span is created with a negative start or an end which is not after the start.
 */
public class InvalidRangeException extends SchemaException {

    public InvalidRangeException(String message) {
        super(message);
    }

}
