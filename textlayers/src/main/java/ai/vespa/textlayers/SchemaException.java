// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a span, annotation or layer violates the structure declared by a layer schema.
 * Raised at the point of the offending call, never deferred.
 */
public abstract class SchemaException extends TextLayerException {

    protected SchemaException(String message) {
        super(message);
    }

}
