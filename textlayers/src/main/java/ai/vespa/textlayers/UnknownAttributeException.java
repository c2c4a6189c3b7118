// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when reading an attribute which is not declared by the layer.
 */
public class UnknownAttributeException extends SchemaException {

    public UnknownAttributeException(String message) {
        super(message);
    }

}
