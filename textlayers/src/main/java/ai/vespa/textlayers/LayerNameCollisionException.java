// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

/**
 * Thrown when a layer is added to a text which already has a layer or a member with the same name.
 */
public class LayerNameCollisionException extends SchemaException {

    public LayerNameCollisionException(String message) {
        super(message);
    }

}
